package io.jsonrecord.core.error;

/** Thrown when a schema definition file has invalid syntax, unknown keys or missing required entries. */
public final class SchemaParseException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String typeName, String source) {
        super(message, typeName, source);
    }

    public SchemaParseException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName, source);
    }
}
