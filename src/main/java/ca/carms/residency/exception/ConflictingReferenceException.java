package ca.carms.residency.exception;

import lombok.Getter;

/**
 * The same lookup id maps to two different names across source rows.
 */
@Getter
public class ConflictingReferenceException extends EtlException {

    private final String referenceType;
    private final Integer referenceId;

    public ConflictingReferenceException(String referenceType, Integer referenceId, String existingName, String conflictingName) {
        super(String.format("%s %d maps to conflicting names '%s' and '%s'",
            referenceType, referenceId, existingName, conflictingName));
        this.referenceType = referenceType;
        this.referenceId = referenceId;
    }
}
