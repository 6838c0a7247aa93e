package io.jsonrecord.core.chain;

/**
 * Read-only view of the record an operator runs against. Operators reach sibling fields only
 * through this view.
 */
public interface RecordView {

    /** Registered type name of the record. */
    String typeName();

    /**
     * Returns the current value of a declared field.
     *
     * @param fieldName internal field name
     * @return the stored value, or {@code null} when unset
     */
    Object get(String fieldName);
}
