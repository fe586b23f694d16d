package com.thingtalk.exception;

/**
 * Exception thrown when a name cannot be resolved through the class and
 * function inheritance structure.
 *
 * <p>This indicates a tree that was built or cloned incorrectly (for example
 * a signature with {@code extends} that is not attached to a class, or a
 * parent function that does not exist). It is a programmer error and is not
 * meant to be recovered from.
 */
public class ResolutionException extends RuntimeException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
