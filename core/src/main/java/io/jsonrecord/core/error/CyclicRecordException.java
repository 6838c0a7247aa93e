package io.jsonrecord.core.error;

/**
 * Thrown when a record graph refers back to a record that is still being serialized. JSON has no
 * way to express the reference, so the output would never end.
 */
public final class CyclicRecordException extends JsonRecordException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public CyclicRecordException(String typeName, String path) {
        super("Record graph is cyclic: value at '" + path + "' refers back to an enclosing " + typeName
                + " record.", typeName, Phase.SERIALIZATION);
        this.path = path;
    }

    /** Dotted path of the field holding the back reference. */
    public String path() {
        return path;
    }
}
