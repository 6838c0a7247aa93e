package io.jsonrecord.core.error;

/**
 * Abstract parent for definition-time programming errors. Thrown while chains are built or a
 * record type is registered, never while data flows through a registered schema. Carries an
 * additional {@code source} identifying the definition file, or {@code null} for schemas declared
 * in code.
 */
public abstract class SchemaDefinitionException extends JsonRecordException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaDefinitionException(String message, String typeName, String source) {
        super(message, typeName, Phase.DEFINITION);
        this.source = source;
    }

    protected SchemaDefinitionException(String message, Throwable cause, String typeName, String source) {
        super(message, cause, typeName, Phase.DEFINITION);
        this.source = source;
    }

    /** The file path or resource identifier that declared the schema, or {@code null}. */
    public String source() {
        return source;
    }
}
