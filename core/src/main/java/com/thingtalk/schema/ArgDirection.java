package com.thingtalk.schema;

/**
 * Direction of a function argument.
 */
public enum ArgDirection {
    /** Required input parameter */
    IN_REQ("in req"),
    /** Optional input parameter */
    IN_OPT("in opt"),
    /** Output parameter */
    OUT("out");

    private final String keyword;

    ArgDirection(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the surface keyword, e.g. "in req".
     *
     * @return the keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a direction by its surface keyword.
     *
     * @param keyword "in req", "in opt" or "out"
     * @return the direction
     * @throws IllegalArgumentException if the keyword is not recognized
     */
    public static ArgDirection fromKeyword(String keyword) {
        for (ArgDirection direction : values()) {
            if (direction.keyword.equals(keyword)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Invalid argument direction: " + keyword);
    }
}
