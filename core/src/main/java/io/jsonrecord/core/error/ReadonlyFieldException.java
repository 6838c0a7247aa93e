package io.jsonrecord.core.error;

import java.util.List;

/**
 * Thrown when caller input targets readonly fields and the record type reports readonly violations
 * instead of discarding them.
 */
public final class ReadonlyFieldException extends RecordInputException {

    private static final long serialVersionUID = 1L;

    public ReadonlyFieldException(String typeName, List<String> fields) {
        super("Readonly field" + (fields.size() > 1 ? "s" : "") + " " + fields + " cannot be set on " + typeName
                        + ".",
                typeName,
                fields);
    }
}
