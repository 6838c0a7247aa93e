package io.jsonrecord.core.model;

/**
 * Naming convention mapping between internal field names and JSON keys. Applied only at the input
 * and output boundary, never to the names a schema declares.
 */
public enum KeyCasePolicy {
    /** JSON keys equal field names (default). */
    IDENTITY,

    /** Fields are declared {@code snake_case}; JSON keys are {@code camelCase}. */
    SNAKE_CAMEL
}
