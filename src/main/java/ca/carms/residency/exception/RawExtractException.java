package ca.carms.residency.exception;

/**
 * A raw source could not be read or lacks a required column.
 */
public class RawExtractException extends EtlException {

    public RawExtractException(String message) {
        super(message);
    }

    public RawExtractException(String message, Throwable cause) {
        super(message, cause);
    }
}
