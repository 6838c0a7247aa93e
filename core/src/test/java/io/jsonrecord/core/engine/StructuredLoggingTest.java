package io.jsonrecord.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.jsonrecord.core.error.ReadonlyFieldException;
import io.jsonrecord.core.model.ReadonlyViolationPolicy;
import io.jsonrecord.core.model.SchemaOptions;
import io.jsonrecord.core.testkit.TestSchemas;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the {@code key=value} log lines emitted on registration, dropped keys and readonly
 * vetoes.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private ListAppender<ILoggingEvent> appender;
    private Logger registryLogger;
    private Logger pipelineLogger;
    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        registryLogger = (Logger) LoggerFactory.getLogger(SchemaRegistry.class);
        pipelineLogger = (Logger) LoggerFactory.getLogger(TransformationPipeline.class);
        registryLogger.addAppender(appender);
        pipelineLogger.addAppender(appender);
        registry = new SchemaRegistry("logging");
    }

    @AfterEach
    void tearDown() {
        registryLogger.detachAppender(appender);
        pipelineLogger.detachAppender(appender);
        appender.stop();
    }

    @Test
    @DisplayName("registration logs registry, type and field count at INFO")
    void registrationLogged() {
        TestSchemas.article(registry);

        assertThat(messagesAt(Level.INFO))
                .containsExactly("schema.registered registry=logging type=Article fields=3 source=code");
    }

    @Test
    @DisplayName("dropped unknown keys are logged at DEBUG")
    void droppedKeysLogged() {
        TestSchemas.article(registry).create(Map.of("title", "Hi", "bogus", true));

        assertThat(messagesAt(Level.DEBUG))
                .contains("record.unknown_keys_dropped type=Article keys=[bogus]");
    }

    @Test
    @DisplayName("readonly vetoes are logged at WARN under the warn policy")
    void readonlyWarn() {
        SchemaEntry coupon = TestSchemas.coupon(
                registry, SchemaOptions.DEFAULTS.withReadonlyViolation(ReadonlyViolationPolicy.WARN));

        JsonRecord record = coupon.create(Map.of("code", "X", "used", true));

        assertThat(record.get("used")).isEqualTo(false);
        assertThat(messagesAt(Level.WARN))
                .containsExactly("record.readonly_vetoed type=Coupon mode=CONSTRUCT fields=[used]");
    }

    @Test
    @DisplayName("discard policy stays quiet at WARN")
    void readonlyDiscard() {
        TestSchemas.coupon(registry, SchemaOptions.DEFAULTS).create(Map.of("code", "X", "used", true));

        assertThat(messagesAt(Level.WARN)).isEmpty();
    }

    @Test
    @DisplayName("reject policy raises after the veto was logged")
    void readonlyReject() {
        SchemaEntry coupon = TestSchemas.coupon(
                registry, SchemaOptions.DEFAULTS.withReadonlyViolation(ReadonlyViolationPolicy.REJECT));

        assertThatThrownBy(() -> coupon.create(Map.of("used", true)))
                .isInstanceOf(ReadonlyFieldException.class)
                .hasMessage("Readonly field [used] cannot be set on Coupon.");
        assertThat(messagesAt(Level.DEBUG)).contains("record.readonly_vetoed type=Coupon mode=CONSTRUCT fields=[used]");
    }

    private List<String> messagesAt(Level level) {
        return appender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }
}
