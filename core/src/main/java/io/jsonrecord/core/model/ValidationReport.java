package io.jsonrecord.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered outcome of one validate pass: field declaration order, then nested recursion order.
 * Empty iff the pass succeeded. Entries are never deduplicated.
 *
 * <p>Thread-safe: immutable.
 */
public final class ValidationReport {

    private static final ValidationReport EMPTY = new ValidationReport(List.of());

    private final List<ValidationError> errors;

    private ValidationReport(List<ValidationError> errors) {
        this.errors = errors;
    }

    public static ValidationReport empty() {
        return EMPTY;
    }

    /** Creates a report from the given errors, defensively copied. */
    public static ValidationReport of(List<ValidationError> errors) {
        return errors.isEmpty() ? EMPTY : new ValidationReport(List.copyOf(errors));
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    /** All errors in encounter order. */
    public List<ValidationError> errors() {
        return errors;
    }

    /** Errors whose path equals the given path. */
    public List<ValidationError> errorsAt(String path) {
        return errors.stream().filter(e -> e.path().equals(path)).toList();
    }

    /** Ordered path → message map; when a path failed more than once, the first message wins. */
    public Map<String, String> messages() {
        Map<String, String> messages = new LinkedHashMap<>();
        errors.forEach(e -> messages.putIfAbsent(e.path(), e.message()));
        return Collections.unmodifiableMap(messages);
    }

    @Override
    public String toString() {
        return errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ", "[", "]"));
    }
}
