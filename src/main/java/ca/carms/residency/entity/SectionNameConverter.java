package ca.carms.residency.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link SectionName} as its source column name.
 */
@Converter
public class SectionNameConverter implements AttributeConverter<SectionName, String> {

    @Override
    public String convertToDatabaseColumn(SectionName attribute) {
        return attribute == null ? null : attribute.columnName();
    }

    @Override
    public SectionName convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return SectionName.fromColumn(dbData)
            .orElseThrow(() -> new IllegalStateException("Unknown section_name in store: " + dbData));
    }
}
