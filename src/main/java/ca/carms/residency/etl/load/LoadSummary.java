package ca.carms.residency.etl.load;

import lombok.Value;

import java.util.Map;

@Value
public class LoadSummary {
    Map<String, Integer> written;
    Map<String, Integer> deleted;
}
