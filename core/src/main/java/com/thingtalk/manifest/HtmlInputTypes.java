package com.thingtalk.manifest;

import com.thingtalk.exception.ManifestException;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

/**
 * Maps configuration parameter types to and from the HTML input types of the
 * manifest {@code params} section.
 */
public final class HtmlInputTypes {

    private HtmlInputTypes() {} // Utility class

    /**
     * Converts an HTML input type to a ThingTalk type.
     *
     * @param htmlType the input type, e.g. {@code password}
     * @param kind the class being converted, for error reporting
     * @return the parameter type
     * @throws ManifestException if the input type is not supported
     */
    public static Type toType(String htmlType, String kind) {
        if (htmlType == null) {
            throw new ManifestException("Missing HTML input type", kind);
        }
        switch (htmlType) {
            case "text":
                return PrimitiveType.STRING;
            case "password":
                return new EntityType("tt:password");
            case "number":
                return PrimitiveType.NUMBER;
            case "url":
                return new EntityType("tt:url");
            case "email":
                return new EntityType("tt:email_address");
            case "tel":
                return new EntityType("tt:phone_number");
            default:
                throw new ManifestException("Unexpected HTML input type " + htmlType, kind);
        }
    }

    /**
     * Converts a parameter type to the HTML input type used to ask for it.
     *
     * @param type the parameter type
     * @param kind the class being converted, for error reporting
     * @return the input type
     * @throws ManifestException if the type has no HTML representation
     */
    public static String toHtml(Type type, String kind) {
        if (type == PrimitiveType.STRING) {
            return "text";
        }
        if (type == PrimitiveType.NUMBER) {
            return "number";
        }
        if (type instanceof EntityType) {
            switch (((EntityType) type).entityName()) {
                case "tt:password":
                    return "password";
                case "tt:url":
                    return "url";
                case "tt:email_address":
                    return "email";
                case "tt:phone_number":
                    return "tel";
                default:
                    return "text";
            }
        }
        throw new ManifestException("Unexpected parameter type " + type, kind);
    }
}
