package io.jsonrecord.core.model;

import java.util.Objects;

/**
 * One failed check of the validate pass.
 *
 * @param path    dotted path from the root record, e.g. {@code address.zipcode} or {@code tags.2}
 * @param message human-readable failure description
 * @param value   the offending value as stored on the record, may be {@code null}
 */
public record ValidationError(String path, String message, Object value) {

    public ValidationError {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
