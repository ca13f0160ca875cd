package ca.carms.residency.etl.normalize;

import ca.carms.residency.exception.ConflictingReferenceException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiFunction;

/**
 * Deduplicates (id, name) lookup pairs. The same id under two names is fatal.
 */
class ReferenceCollector {

    private final String referenceType;
    private final Map<Integer, String> names = new TreeMap<>();

    ReferenceCollector(String referenceType) {
        this.referenceType = referenceType;
    }

    /**
     * Pairs with a null id or name are skipped.
     */
    void add(Integer id, String name) {
        if (id == null || name == null) {
            return;
        }
        String existing = names.putIfAbsent(id, name);
        if (existing != null && !existing.equals(name)) {
            throw new ConflictingReferenceException(referenceType, id, existing, name);
        }
    }

    boolean contains(Integer id) {
        return id != null && names.containsKey(id);
    }

    <T> List<T> rows(BiFunction<Integer, String, T> factory) {
        return names.entrySet().stream()
            .map(entry -> factory.apply(entry.getKey(), entry.getValue()))
            .toList();
    }
}
