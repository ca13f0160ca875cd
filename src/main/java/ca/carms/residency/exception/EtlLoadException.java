package ca.carms.residency.exception;

/**
 * The store rejected the load; the transaction has been rolled back.
 */
public class EtlLoadException extends EtlException {

    public EtlLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
