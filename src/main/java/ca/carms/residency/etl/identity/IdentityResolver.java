package ca.carms.residency.etl.identity;

import ca.carms.residency.exception.DuplicateNaturalKeyException;
import lombok.Value;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Assigns stable surrogate ids to natural keys.
 * <p>
 * Keys are trimmed and compared case-sensitively. Resolution is a function of
 * the registered keys and the persisted mapping only, never of row order:
 * <ol>
 *   <li>a key already persisted keeps its id;</li>
 *   <li>otherwise, walking keys in sorted order, the id the source proposes is
 *       adopted when no other key owns it;</li>
 *   <li>remaining keys, again in sorted order, get {@code max(taken) + 1}.</li>
 * </ol>
 * Registering the same key twice with different attributes is fatal.
 */
public class IdentityResolver {

    private final String keyName;
    private final Map<String, Integer> persisted;
    private final Map<String, Candidate> candidates = new TreeMap<>();
    private Map<String, Integer> resolved;

    public IdentityResolver(String keyName, Map<String, Integer> persisted) {
        this.keyName = keyName;
        this.persisted = new TreeMap<>();
        persisted.forEach((key, id) -> {
            String normalized = normalize(key);
            if (normalized != null) {
                this.persisted.put(normalized, id);
            }
        });
    }

    /**
     * Trim a natural key; blank becomes null. Case is preserved.
     */
    public static String normalize(String naturalKey) {
        if (naturalKey == null) {
            return null;
        }
        String trimmed = naturalKey.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Register a natural key seen in the current batch.
     *
     * @param naturalKey  the key, normalized with {@link #normalize(String)}
     * @param sourceId    id proposed by the source, may be null
     * @param fingerprint the attributes the key stands for
     * @return true on first sight, false for an identical repeat
     * @throws DuplicateNaturalKeyException when the key was registered with a different fingerprint
     */
    public boolean register(String naturalKey, Integer sourceId, Object fingerprint) {
        if (resolved != null) {
            throw new IllegalStateException(keyName + " identities already resolved");
        }
        String key = normalize(naturalKey);
        if (key == null) {
            throw new IllegalArgumentException(keyName + " must not be blank");
        }
        Candidate existing = candidates.get(key);
        if (existing == null) {
            candidates.put(key, new Candidate(sourceId, fingerprint));
            return true;
        }
        if (!Objects.equals(existing.getFingerprint(), fingerprint)) {
            throw new DuplicateNaturalKeyException(keyName, key);
        }
        return false;
    }

    /**
     * Resolve every registered key. Repeated calls return the same mapping.
     */
    public Map<String, Integer> resolve() {
        if (resolved != null) {
            return resolved;
        }
        Map<String, Integer> assigned = new TreeMap<>();
        Set<Integer> taken = new HashSet<>(persisted.values());

        candidates.keySet().forEach(key -> {
            Integer id = persisted.get(key);
            if (id != null) {
                assigned.put(key, id);
            }
        });

        candidates.forEach((key, candidate) -> {
            if (!assigned.containsKey(key) && candidate.getSourceId() != null && taken.add(candidate.getSourceId())) {
                assigned.put(key, candidate.getSourceId());
            }
        });

        int next = taken.stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
        for (String key : candidates.keySet()) {
            if (!assigned.containsKey(key)) {
                assigned.put(key, next);
                taken.add(next);
                next++;
            }
        }

        resolved = Collections.unmodifiableMap(assigned);
        return resolved;
    }

    /**
     * Surrogate id of a registered key.
     */
    public Integer idFor(String naturalKey) {
        Integer id = resolve().get(normalize(naturalKey));
        if (id == null) {
            throw new IllegalArgumentException(keyName + " '" + naturalKey + "' was never registered");
        }
        return id;
    }

    @Value
    private static class Candidate {
        Integer sourceId;
        Object fingerprint;
    }
}
