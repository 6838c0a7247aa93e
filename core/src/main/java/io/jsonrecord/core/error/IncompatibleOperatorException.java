package io.jsonrecord.core.error;

/**
 * Thrown when an operator is applied to a chain whose field kind it does not support, e.g. {@code
 * maxlength} on an integer chain.
 */
public final class IncompatibleOperatorException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public IncompatibleOperatorException(String message, String typeName, String source) {
        super(message, typeName, source);
    }

    public IncompatibleOperatorException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName, source);
    }
}
