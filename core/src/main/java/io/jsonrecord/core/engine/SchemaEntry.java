package io.jsonrecord.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonrecord.core.model.FieldDescriptor;
import io.jsonrecord.core.model.SchemaOptions;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registered schema of one record type: the ordered field descriptors plus type-level options.
 * Created by {@link SchemaRegistry} and shared by every record of the type.
 *
 * <p>Thread-safe: immutable after registration.
 */
public final class SchemaEntry {

    private final String typeName;
    private final Map<String, FieldDescriptor> fields;
    private final SchemaOptions options;
    private final KeyCaseConverter keyCase;
    private final SchemaRegistry registry;
    private final String source;

    SchemaEntry(
            String typeName,
            List<FieldDescriptor> descriptors,
            SchemaOptions options,
            SchemaRegistry registry,
            String source) {
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        descriptors.forEach(d -> byName.put(d.name(), d));
        this.typeName = typeName;
        this.fields = Collections.unmodifiableMap(byName);
        this.options = options;
        this.keyCase = KeyCaseConverter.of(options.keyCase());
        this.registry = registry;
        this.source = source;
    }

    public String typeName() {
        return typeName;
    }

    /** Field descriptors in declaration order. */
    public Collection<FieldDescriptor> fields() {
        return fields.values();
    }

    /** Field names in declaration order. */
    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /** Returns the descriptor of the named field, or {@code null} if the type declares none. */
    public FieldDescriptor field(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public SchemaOptions options() {
        return options;
    }

    public KeyCaseConverter keyCase() {
        return keyCase;
    }

    /** The registry this type was registered in; nested instance types resolve against it. */
    public SchemaRegistry registry() {
        return registry;
    }

    /** Definition file the type was parsed from, or {@code null} for types declared in code. */
    public String source() {
        return source;
    }

    /**
     * Constructs a record from an input mapping through the sanitize pass.
     *
     * @param input JSON-shaped values keyed by JSON key; may be empty
     * @throws io.jsonrecord.core.error.UnexpectedFieldException if unknown keys are rejected
     */
    public JsonRecord create(Map<String, ?> input) {
        return registry.pipeline().construct(this, input);
    }

    /** Constructs a record with no input; every field receives its default, if any. */
    public JsonRecord create() {
        return create(Map.of());
    }

    /**
     * Constructs a record from a JSON object node.
     *
     * @throws IllegalArgumentException if the node is not a JSON object
     */
    @SuppressWarnings("unchecked")
    public JsonRecord create(JsonNode input) {
        if (input == null || !input.isObject()) {
            throw new IllegalArgumentException(
                    typeName + " must be constructed from a JSON object, got "
                            + (input == null ? "null" : input.getNodeType()));
        }
        return create((Map<String, ?>) JsonValues.fromJson(input));
    }

    /** Parses JSON text and constructs a record from it. */
    public JsonRecord fromJson(String json) {
        return create(JsonValues.parse(json));
    }

    @Override
    public String toString() {
        return "SchemaEntry[" + typeName + ", fields=" + fields.keySet() + ", options=" + options + "]";
    }
}
