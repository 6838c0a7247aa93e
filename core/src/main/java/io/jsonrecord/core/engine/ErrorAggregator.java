package io.jsonrecord.core.engine;

import io.jsonrecord.core.model.ValidationError;
import io.jsonrecord.core.model.ValidationReport;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects validation failures during one validate pass, in encounter order, and hands them out as
 * a single {@link ValidationReport}. Entries are never deduplicated.
 *
 * <p>In fail-fast mode the aggregator saturates after its first entry and the pipeline stops
 * walking further fields.
 *
 * <p>Not thread-safe: one aggregator per pass.
 */
public final class ErrorAggregator {

    private final boolean failFast;
    private final List<ValidationError> errors = new ArrayList<>();

    public ErrorAggregator() {
        this(false);
    }

    public ErrorAggregator(boolean failFast) {
        this.failFast = failFast;
    }

    public void add(String path, String message, Object value) {
        errors.add(new ValidationError(path, message, value));
    }

    /** Returns {@code true} once a fail-fast aggregator holds an entry. */
    public boolean isSaturated() {
        return failFast && !errors.isEmpty();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public ValidationReport toReport() {
        return ValidationReport.of(errors);
    }
}
