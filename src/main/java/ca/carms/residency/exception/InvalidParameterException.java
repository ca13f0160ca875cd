package ca.carms.residency.exception;

import lombok.Getter;

/**
 * A query parameter is outside its allowed range.
 */
@Getter
public class InvalidParameterException extends RuntimeException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }
}
