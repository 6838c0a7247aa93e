package io.jsonrecord.core.error;

import java.util.List;

/** Thrown when {@code set} is called on a record whose type is immutable after construction. */
public final class ImmutableRecordException extends RecordInputException {

    private static final long serialVersionUID = 1L;

    public ImmutableRecordException(String typeName, List<String> keys) {
        super(typeName + " is immutable after construction; refused to set " + keys + ".", typeName, keys);
    }
}
