package io.jsonrecord.core.error;

/** Thrown when two fields of one record type share a name. */
public final class DuplicateFieldException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public DuplicateFieldException(String message, String typeName, String source) {
        super(message, typeName, source);
    }

    public DuplicateFieldException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName, source);
    }
}
