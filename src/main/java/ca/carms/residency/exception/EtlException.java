package ca.carms.residency.exception;

/**
 * Base class for errors that abort an ETL run. A run that fails with one of
 * these leaves previously persisted data untouched.
 */
public abstract class EtlException extends RuntimeException {

    protected EtlException(String message) {
        super(message);
    }

    protected EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
