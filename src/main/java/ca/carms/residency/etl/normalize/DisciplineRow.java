package ca.carms.residency.etl.normalize;

import lombok.Value;

@Value
public class DisciplineRow {
    Integer id;
    String name;
}
