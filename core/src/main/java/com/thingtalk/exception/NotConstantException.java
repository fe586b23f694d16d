package com.thingtalk.exception;

/**
 * Exception thrown when a value that still needs to be resolved (a variable
 * reference, an event, a context reference or a computation) is converted
 * to a plain Java object.
 */
public class NotConstantException extends RuntimeException {

    private final String valueSource;

    /**
     * Creates the exception for the given value.
     *
     * @param valueSource the surface syntax of the offending value
     */
    public NotConstantException(String valueSource) {
        super("Value is not a constant: " + valueSource);
        this.valueSource = valueSource;
    }

    /**
     * Returns the surface syntax of the value that could not be converted.
     *
     * @return the value source
     */
    public String getValueSource() {
        return valueSource;
    }
}
