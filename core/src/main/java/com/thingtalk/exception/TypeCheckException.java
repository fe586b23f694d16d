package com.thingtalk.exception;

/**
 * Exception thrown when a program does not agree with the signatures of the
 * functions it invokes.
 *
 * <p>This is the user-facing error category: it reports unknown arguments,
 * misuse of input and output arguments, missing required arguments, missing
 * required filters and unresolved schemas.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       SchemaValidator.validate(program);
 *   } catch (TypeCheckException e) {
 *       System.err.println(e.getMessage());
 *       System.err.println("Context: " + e.getContext());
 *       System.err.println("Suggestion: " + e.getSuggestion());
 *   }
 * </pre>
 */
public class TypeCheckException extends RuntimeException {

    private final String phase;
    private final String context;
    private final String suggestion;

    /**
     * Creates a type-check exception.
     *
     * @param message the error message
     * @param phase the check that failed, e.g. "input parameter validation"
     * @param context the offending construct, printed in surface syntax
     * @param suggestion how to fix the program, or null
     */
    public TypeCheckException(String message, String phase, String context, String suggestion) {
        super(message);
        this.phase = phase;
        this.context = context;
        this.suggestion = suggestion;
    }

    public String getPhase() {
        return phase;
    }

    public String getContext() {
        return context;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Returns a multi-line message including phase, context and suggestion.
     *
     * @return the detailed message
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (phase != null) {
            sb.append("\n  Phase: ").append(phase);
        }
        if (context != null) {
            sb.append("\n  Context: ").append(context);
        }
        if (suggestion != null) {
            sb.append("\n  Suggestion: ").append(suggestion);
        }
        return sb.toString();
    }
}
