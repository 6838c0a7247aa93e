package io.jsonrecord.core.error;

/**
 * Thrown when a pipeline operation targets a record type that was never registered. Indicates a
 * programming error, not bad input, and aborts the operation immediately.
 */
public final class SchemaNotFoundException extends JsonRecordException {

    private static final long serialVersionUID = 1L;

    private final String registryName;

    public SchemaNotFoundException(String typeName, String registryName) {
        super("Schema not found: no record type '" + typeName + "' registered in '" + registryName + "'",
                typeName,
                Phase.LOOKUP);
        this.registryName = registryName;
    }

    /** Name of the registry that was searched. */
    public String registryName() {
        return registryName;
    }
}
