package io.jsonrecord.core.chain;

/**
 * Read-only context handed to every operator invocation. Exposes the enclosing record, the field the
 * chain is bound to and where in the record tree the value sits.
 *
 * @param record       the enclosing record, never null
 * @param fieldName    the field the chain is bound to; for list/dict items, the owning field
 * @param path         dotted path of the value from the root record, e.g. {@code address.zipcode}
 * @param construction {@code true} while the record is being constructed
 * @param currentValue value stored before this write, {@code null} at construction and outside
 *                     the sanitize pass
 */
public record OperatorContext(
        RecordView record, String fieldName, String path, boolean construction, Object currentValue) {

    /**
     * Returns a sibling field's current value from the enclosing record.
     *
     * @param name internal name of the sibling field
     * @return the sibling value, or {@code null} when unset
     */
    public Object sibling(String name) {
        return record.get(name);
    }

    /** Returns a copy addressing a nested path under the same field. */
    public OperatorContext at(String childPath) {
        return new OperatorContext(record, fieldName, childPath, construction, null);
    }
}
