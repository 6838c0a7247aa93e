package io.jsonrecord.core.error;

import java.util.List;

/**
 * Abstract parent for ordinary input errors raised by the sanitize pass. The remaining known fields
 * are sanitized before one of these is thrown, so the failure identifies every offending key at
 * once instead of aborting at the first.
 */
public abstract class RecordInputException extends JsonRecordException {

    private static final long serialVersionUID = 1L;

    private final List<String> keys;

    protected RecordInputException(String message, String typeName, List<String> keys) {
        super(message, typeName, Phase.INPUT);
        this.keys = keys != null ? List.copyOf(keys) : List.of();
    }

    /** The offending input keys or field names, in input order. */
    public List<String> keys() {
        return keys;
    }
}
