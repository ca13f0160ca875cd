package ca.carms.residency.etl.normalize;

import lombok.Value;

@Value
public class SchoolRow {
    Integer id;
    String name;
}
