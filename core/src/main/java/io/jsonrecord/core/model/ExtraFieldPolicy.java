package io.jsonrecord.core.model;

/** What the sanitize pass does with input keys a record type does not declare. */
public enum ExtraFieldPolicy {
    /** Drop unknown keys silently (default). */
    IGNORE,

    /** Sanitize the known fields, then fail naming every unknown key. */
    REJECT
}
