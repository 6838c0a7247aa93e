package io.jsonrecord.core.error;

import java.util.List;

/**
 * Thrown when one input names the same field twice, once by its declared name and once by its
 * wire key (e.g. {@code read_count} and {@code readCount}). Nothing is written.
 */
public final class AmbiguousFieldException extends RecordInputException {

    private static final long serialVersionUID = 1L;

    public AmbiguousFieldException(String typeName, List<String> keys) {
        super(typeName + ": input keys " + keys + " name the same field.", typeName, keys);
    }
}
