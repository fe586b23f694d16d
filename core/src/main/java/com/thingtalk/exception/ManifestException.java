package com.thingtalk.exception;

/**
 * Exception thrown when a legacy JSON manifest cannot be converted.
 */
public class ManifestException extends RuntimeException {

    private final String kind;

    public ManifestException(String message, String kind) {
        super(message);
        this.kind = kind;
    }

    public ManifestException(String message, String kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the kind of the class whose manifest failed to convert.
     *
     * @return the class kind, or null if unknown
     */
    public String getKind() {
        return kind;
    }
}
