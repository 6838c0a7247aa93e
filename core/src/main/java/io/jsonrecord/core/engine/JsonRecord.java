package io.jsonrecord.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonrecord.core.chain.RecordView;
import io.jsonrecord.core.engine.TransformationPipeline.WriteMode;
import io.jsonrecord.core.error.ValidationException;
import io.jsonrecord.core.model.ValidationReport;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A record instance: an exclusively-owned bag of field values conforming to its {@link
 * SchemaEntry}. Created through {@link SchemaEntry#create}; every write path runs the sanitize pass,
 * so stored values have always passed the WRITE operators of their chains. They may still fail the
 * VALIDATE operators until {@link #validate()} succeeds.
 *
 * <p>Lifecycle: constructed (sanitized) → {@link #validate()} → valid or invalid → {@link #set}
 * (sanitized again) → … An invalid record is never terminal.
 *
 * <p>Not thread-safe: concurrent mutation of one record must be serialized by the caller.
 */
public final class JsonRecord implements RecordView {

    private final SchemaEntry schema;
    private final Map<String, Object> values = new LinkedHashMap<>();

    JsonRecord(SchemaEntry schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        for (String name : schema.fieldNames()) {
            values.put(name, null);
        }
    }

    public SchemaEntry schema() {
        return schema;
    }

    @Override
    public String typeName() {
        return schema.typeName();
    }

    /**
     * Returns a field's stored value. Lists and maps come back unmodifiable; change them through
     * {@link #set}.
     *
     * @throws IllegalArgumentException if the type declares no such field
     */
    @Override
    public Object get(String fieldName) {
        requireField(fieldName);
        return values.get(fieldName);
    }

    /** Returns a field's stored value cast to the given type. */
    public <T> T get(String fieldName, Class<T> type) {
        return type.cast(get(fieldName));
    }

    /**
     * Unmodifiable view of all field values in declaration order. Stored lists and maps are
     * unmodifiable at every depth.
     */
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Writes caller input through the sanitize pass. Keys follow the type's key-case policy;
     * readonly and writeonce guards apply; fields absent from the input keep their values.
     *
     * @return this record
     * @throws io.jsonrecord.core.error.ImmutableRecordException if the type is immutable
     * @throws io.jsonrecord.core.error.UnexpectedFieldException if unknown keys are rejected
     * @throws io.jsonrecord.core.error.ReadonlyFieldException   if readonly violations are rejected
     */
    public JsonRecord set(Map<String, ?> input) {
        pipeline().sanitize(schema, this, input, WriteMode.SET);
        return this;
    }

    /** Single-field form of {@link #set(Map)}; {@code value} may be null. */
    public JsonRecord set(String key, Object value) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put(key, value);
        return set(input);
    }

    /**
     * Trusted write for internal callers: runs the WRITE operators but ignores readonly and
     * writeonce guards and the mutability option. Unknown keys always fail.
     *
     * @return this record
     * @throws io.jsonrecord.core.error.UnexpectedFieldException if a key is not a declared field
     */
    public JsonRecord update(Map<String, ?> input) {
        pipeline().sanitize(schema, this, input, WriteMode.UPDATE);
        return this;
    }

    /**
     * Runs the validate pass over every field.
     *
     * @return this record when the report is empty
     * @throws ValidationException carrying the full report otherwise
     */
    public JsonRecord validate() {
        ValidationReport report = report();
        if (!report.isEmpty()) {
            throw new ValidationException(typeName(), report);
        }
        return this;
    }

    /** Runs the validate pass and returns its report without throwing. */
    public ValidationReport report() {
        return pipeline().validate(schema, this, false);
    }

    /** Returns {@code true} if the record validates; stops at the first failure. */
    public boolean isValid() {
        return pipeline().validate(schema, this, true).isEmpty();
    }

    /** Serializes the record; writeonly fields are omitted. */
    public ObjectNode toJson() {
        return toJson(false);
    }

    /**
     * Serializes the record to a fresh tree with keys renamed per the key-case policy.
     *
     * @param ignoreWriteonly include writeonly fields as well
     */
    public ObjectNode toJson(boolean ignoreWriteonly) {
        return pipeline().serialize(schema, this, ignoreWriteonly);
    }

    /** Serializes the record to compact JSON text. */
    public String toJsonString() {
        try {
            return JsonValues.MAPPER.writeValueAsString(toJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write " + typeName() + " as JSON", e);
        }
    }

    void store(String fieldName, Object value) {
        values.put(fieldName, value);
    }

    private TransformationPipeline pipeline() {
        return schema.registry().pipeline();
    }

    private void requireField(String fieldName) {
        if (!values.containsKey(fieldName)) {
            throw new IllegalArgumentException("No field '" + fieldName + "' in " + typeName());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonRecord other)) return false;
        return schema == other.schema && values.equals(other.values);
    }

    /** Nested records and containers count by type and size only, so cyclic graphs hash safely. */
    @Override
    public int hashCode() {
        int hash = schema.typeName().hashCode();
        for (Object value : values.values()) {
            int part;
            if (value instanceof JsonRecord nested) {
                part = nested.typeName().hashCode();
            } else if (value instanceof Collection<?> collection) {
                part = collection.size();
            } else if (value instanceof Map<?, ?> map) {
                part = map.size();
            } else {
                part = Objects.hashCode(value);
            }
            hash = 31 * hash + part;
        }
        return hash;
    }

    /** Renders {@code Type{field=value, ...}}; a back reference prints as {@code Type{...}}. */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        describe(this, out, Collections.newSetFromMap(new IdentityHashMap<>()));
        return out.toString();
    }

    private static void describe(Object value, StringBuilder out, Set<JsonRecord> enclosing) {
        if (value instanceof JsonRecord record) {
            out.append(record.typeName());
            if (!enclosing.add(record)) {
                out.append("{...}");
                return;
            }
            describeEntries(record.values, out, enclosing);
            enclosing.remove(record);
        } else if (value instanceof Map<?, ?> map) {
            describeEntries(map, out, enclosing);
        } else if (value instanceof List<?> list) {
            out.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                describe(list.get(i), out, enclosing);
            }
            out.append(']');
        } else {
            out.append(value);
        }
    }

    private static void describeEntries(Map<?, ?> map, StringBuilder out, Set<JsonRecord> enclosing) {
        out.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!first) {
                out.append(", ");
            }
            first = false;
            out.append(e.getKey()).append('=');
            describe(e.getValue(), out, enclosing);
        }
        out.append('}');
    }
}
