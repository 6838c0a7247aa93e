package io.jsonrecord.core.model;

/**
 * What the sanitize pass does when caller input targets a field whose {@code readonly} or {@code
 * writeonce} guard vetoes the value. The vetoed value is never stored; the policy only decides how
 * loudly that happens.
 */
public enum ReadonlyViolationPolicy {
    /** Drop the value silently (default). */
    DISCARD,

    /** Drop the value and log a warning. */
    WARN,

    /** Sanitize the remaining fields, then fail naming every vetoed field. */
    REJECT
}
