package io.jsonrecord.core.spi;

import java.util.List;

/**
 * SPI for observability hooks on a schema registry and the passes run against its records.
 *
 * <p>Implementations bridge to metrics or tracing systems; the core carries no telemetry
 * dependency. All methods receive immutable event objects and MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught and logged; they never affect the
 * pipeline.
 */
public interface PipelineListener {

    /**
     * Called after a record type was registered.
     *
     * @param event contains registry name, type name, field count
     */
    void onSchemaRegistered(SchemaRegisteredEvent event);

    /**
     * Called after a sanitize pass wrote caller input onto a record.
     *
     * @param event contains type name, write mode, written fields, dropped keys
     */
    void onRecordSanitized(RecordSanitizedEvent event);

    /**
     * Called after a validate pass completed, successful or not.
     *
     * @param event contains type name, error count, duration
     */
    void onValidationCompleted(ValidationCompletedEvent event);

    // --- Event records ---

    /** Event emitted when a record type is registered. */
    record SchemaRegisteredEvent(String registryName, String typeName, int fieldCount) {}

    /** Event emitted when a sanitize pass completes. {@code mode} is CONSTRUCT, SET or UPDATE. */
    record RecordSanitizedEvent(String typeName, String mode, List<String> writtenFields, List<String> droppedKeys) {}

    /** Event emitted when a validate pass completes. */
    record ValidationCompletedEvent(String typeName, int errorCount, long durationNanos) {}
}
