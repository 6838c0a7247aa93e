package io.jsonrecord.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.jsonrecord.core.model.ValidationError;
import io.jsonrecord.core.model.ValidationReport;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorAggregatorTest")
class ErrorAggregatorTest {

    @Test
    @DisplayName("keeps encounter order and never deduplicates")
    void orderAndDuplicates() {
        ErrorAggregator errors = new ErrorAggregator();
        errors.add("b", "second", 2);
        errors.add("a", "first", 1);
        errors.add("a", "again", 1);

        ValidationReport report = errors.toReport();

        assertThat(report.errors()).extracting(ValidationError::path).containsExactly("b", "a", "a");
        assertThat(report.errorsAt("a")).hasSize(2);
        assertThat(report.messages()).containsExactly(
                Map.entry("b", "second"), Map.entry("a", "first"));
        assertThat(errors.isSaturated()).isFalse();
    }

    @Test
    @DisplayName("fail-fast aggregators saturate after the first entry")
    void failFast() {
        ErrorAggregator errors = new ErrorAggregator(true);
        assertThat(errors.isSaturated()).isFalse();

        errors.add("a", "first", null);

        assertThat(errors.isSaturated()).isTrue();
        assertThat(errors.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("an empty aggregator yields the empty report")
    void empty() {
        assertThat(new ErrorAggregator().toReport()).isSameAs(ValidationReport.empty());
        assertThat(ValidationReport.empty().toString()).isEqualTo("[]");
    }
}
