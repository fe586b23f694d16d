package com.thingtalk.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parses type strings into {@link Type} objects.
 *
 * <p>The accepted syntax is the one produced by {@link Type#toString()}:
 * <ul>
 *   <li>{@code Number}, {@code String}, {@code Date}, ...</li>
 *   <li>{@code Entity(tt:email_address)}</li>
 *   <li>{@code Measure(ms)}, {@code Measure()}</li>
 *   <li>{@code Enum(on,off)}, {@code Enum(*)}</li>
 *   <li>{@code Array(Entity(tt:hashtag))}</li>
 *   <li>{@code Compound}, {@code Compound(name)} (parsed without fields)</li>
 * </ul>
 *
 * <p>Bare identifiers that name no known type become {@link UnknownType}.
 */
public final class TypeParser {

    private final String input;
    private int pos;

    private TypeParser(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Parses a type string.
     *
     * @param typeStr the type string
     * @return the parsed type
     * @throws IllegalArgumentException if the string is empty or malformed
     */
    public static Type parse(String typeStr) {
        if (typeStr == null || typeStr.isBlank()) {
            throw new IllegalArgumentException("Type string cannot be null or empty");
        }
        TypeParser parser = new TypeParser(typeStr.trim());
        Type type = parser.parseType();
        parser.skipSpaces();
        if (parser.pos != parser.input.length()) {
            throw new IllegalArgumentException(
                "Unexpected trailing characters in type '" + typeStr + "' at position " + parser.pos);
        }
        return type;
    }

    private Type parseType() {
        skipSpaces();
        String head = readIdentifier();
        if (head.isEmpty()) {
            throw new IllegalArgumentException("Expected a type name in '" + input + "' at position " + pos);
        }

        skipSpaces();
        if (!peek('(')) {
            if (head.equals("Compound")) {
                return new CompoundType(null, Collections.emptyMap());
            }
            PrimitiveType primitive = PrimitiveType.forName(head);
            if (primitive != null) {
                return primitive;
            }
            return new UnknownType(head);
        }

        pos++; // consume '('
        Type result;
        switch (head) {
            case "Array":
                result = new ArrayType(parseType());
                skipSpaces();
                break;
            case "Entity":
                result = new EntityType(readUntilClose().trim());
                break;
            case "Measure":
                result = new MeasureType(readUntilClose().trim());
                break;
            case "Enum":
                result = parseEnum(readUntilClose());
                break;
            case "Compound":
                result = new CompoundType(readUntilClose().trim(), Collections.emptyMap());
                break;
            default:
                throw new IllegalArgumentException("Unknown parameterized type '" + head + "' in '" + input + "'");
        }
        expect(')');
        return result;
    }

    private static Type parseEnum(String body) {
        String trimmed = body.trim();
        if (trimmed.equals("*")) {
            return new EnumType(null);
        }
        List<String> entries = new ArrayList<>();
        for (String entry : trimmed.split(",")) {
            String e = entry.trim();
            if (!e.isEmpty()) {
                entries.add(e);
            }
        }
        return new EnumType(entries);
    }

    private String readIdentifier() {
        int start = pos;
        while (pos < input.length() && Character.isLetterOrDigit(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private String readUntilClose() {
        int start = pos;
        while (pos < input.length() && input.charAt(pos) != ')') {
            pos++;
        }
        return input.substring(start, pos);
    }

    private boolean peek(char c) {
        return pos < input.length() && input.charAt(pos) == c;
    }

    private void expect(char c) {
        if (!peek(c)) {
            throw new IllegalArgumentException("Expected '" + c + "' in type '" + input + "' at position " + pos);
        }
        pos++;
    }

    private void skipSpaces() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
