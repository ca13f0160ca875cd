package ca.carms.residency.etl.normalize;

import ca.carms.residency.entity.SectionName;
import lombok.Value;

@Value
public class SectionRow {
    Integer programDescriptionId;
    SectionName sectionName;
    String sectionText;
}
