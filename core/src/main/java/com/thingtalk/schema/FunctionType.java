package com.thingtalk.schema;

import java.util.Locale;

/**
 * Kind of function a signature describes.
 */
public enum FunctionType {
    QUERY,
    ACTION,
    STREAM;

    /**
     * Returns the surface keyword, e.g. "query".
     *
     * @return the keyword
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the function type whose functions a signature of this type
     * inherits from. Streams are monitored queries, so they extend queries.
     *
     * @return the function type parent functions are looked up as
     */
    public FunctionType parentLookupType() {
        return this == STREAM ? QUERY : this;
    }
}
