package io.jsonrecord.core.error;

/**
 * Root of the json-record exception tree. Every failure names the record type involved and the
 * pass that raised it. Schema problems extend {@link SchemaDefinitionException} and bad caller
 * input extends {@link RecordInputException}; lookup, validation and cycle failures have their own
 * classes.
 */
public abstract class JsonRecordException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        /** Building chains or registering a record type. */
        DEFINITION,
        /** Resolving a record type by name. */
        LOOKUP,
        /** Writing caller input onto a record. */
        INPUT,
        /** Running the validate pass. */
        VALIDATION,
        /** Turning a record graph into JSON. */
        SERIALIZATION
    }

    private final String typeName;
    private final Phase phase;

    protected JsonRecordException(String message, String typeName, Phase phase) {
        super(message);
        this.typeName = typeName;
        this.phase = phase;
    }

    protected JsonRecordException(String message, Throwable cause, String typeName, Phase phase) {
        super(message, cause);
        this.typeName = typeName;
        this.phase = phase;
    }

    /** Name of the record type being processed, or {@code null} before one is known. */
    public String typeName() {
        return typeName;
    }

    /** The message text; the same string {@link #getMessage()} returns. */
    public String detail() {
        return getMessage();
    }

    /** Which pass failed. */
    public Phase phase() {
        return phase;
    }
}
