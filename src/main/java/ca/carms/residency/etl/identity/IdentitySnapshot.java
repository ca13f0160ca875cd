package ca.carms.residency.etl.identity;

import lombok.Value;

import java.util.Map;

/**
 * Natural key to surrogate id mappings already in the store.
 */
@Value
public class IdentitySnapshot {

    Map<String, Integer> programStreamIds;
    Map<String, Integer> programDescriptionIds;

    public static IdentitySnapshot empty() {
        return new IdentitySnapshot(Map.of(), Map.of());
    }
}
