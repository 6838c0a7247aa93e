package io.jsonrecord.core.error;

/**
 * Thrown when a record type name is registered twice in the same registry. Re-registration is
 * rejected so that a chain is never silently replaced.
 */
public final class DuplicateSchemaException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public DuplicateSchemaException(String message, String typeName, String source) {
        super(message, typeName, source);
    }

    public DuplicateSchemaException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName, source);
    }
}
