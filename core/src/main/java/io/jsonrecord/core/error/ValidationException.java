package io.jsonrecord.core.error;

import io.jsonrecord.core.model.ValidationError;
import io.jsonrecord.core.model.ValidationReport;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thrown when a validate pass finds at least one failure. Carries the complete {@link
 * ValidationReport}; the message lists every {@code path: message} pair in report order.
 */
public final class ValidationException extends JsonRecordException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationReport report;

    public ValidationException(String typeName, ValidationReport report) {
        super(describe(typeName, report), typeName, Phase.VALIDATION);
        this.report = Objects.requireNonNull(report, "report must not be null");
    }

    /** The full ordered report of the failed pass. */
    public ValidationReport report() {
        return report;
    }

    private static String describe(String typeName, ValidationReport report) {
        return "Validation failed for " + typeName + " (" + report.size() + " error"
                + (report.size() == 1 ? "" : "s") + "): "
                + report.errors().stream().map(ValidationError::toString).collect(Collectors.joining("; "));
    }
}
