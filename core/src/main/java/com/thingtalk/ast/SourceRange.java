package com.thingtalk.ast;

import java.util.Objects;

/**
 * Span of source text a node was parsed from.
 *
 * @param start the first position covered by the node
 * @param end the position just past the node
 */
public record SourceRange(Position start, Position end) {

    /**
     * A location in the source text.
     *
     * @param offset the character offset from the start of the input
     * @param line the 1-based line number
     * @param column the 1-based column number
     */
    public record Position(int offset, int line, int column) {}

    public SourceRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException(
                "end offset " + end.offset() + " precedes start offset " + start.offset());
        }
    }

    @Override
    public String toString() {
        return start.line() + ":" + start.column() + "-" + end.line() + ":" + end.column();
    }
}
