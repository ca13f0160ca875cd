package ca.carms.residency.exception;

import lombok.Getter;

/**
 * A natural key appears more than once in a batch with different attributes.
 */
@Getter
public class DuplicateNaturalKeyException extends EtlException {

    private final String keyName;
    private final String naturalKey;

    public DuplicateNaturalKeyException(String keyName, String naturalKey) {
        super(String.format("%s '%s' appears more than once with different attributes", keyName, naturalKey));
        this.keyName = keyName;
        this.naturalKey = naturalKey;
    }
}
