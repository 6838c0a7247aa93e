package io.jsonrecord.core.engine;

import io.jsonrecord.core.chain.RuleChain;
import io.jsonrecord.core.error.DuplicateFieldException;
import io.jsonrecord.core.error.DuplicateSchemaException;
import io.jsonrecord.core.error.SchemaNotFoundException;
import io.jsonrecord.core.model.FieldDescriptor;
import io.jsonrecord.core.model.FieldSpec;
import io.jsonrecord.core.model.SchemaOptions;
import io.jsonrecord.core.spi.PipelineListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only registry of record schemas, keyed by type name. Each type is registered exactly once,
 * normally at startup; afterwards the registry is only read.
 *
 * <p>Several independent registries may coexist (e.g. one per module or per test); {@link
 * #global()} is the process-wide default. Nested instance references resolve against the registry
 * of the referring schema, lazily, so types may reference each other in any order.
 *
 * <p>Thread-safe: backed by a {@link ConcurrentHashMap}. Registration must happen-before the first
 * concurrent lookup of the same type; no further locking is needed.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);
    private static final SchemaRegistry GLOBAL = new SchemaRegistry("default");

    private final String name;
    private final Map<String, SchemaEntry> entries = new ConcurrentHashMap<>();
    private final PipelineListener listener;
    private final TransformationPipeline pipeline;

    /**
     * Creates an empty registry without a listener.
     *
     * @param name registry name used in log lines and error messages
     */
    public SchemaRegistry(String name) {
        this(name, null);
    }

    /**
     * Creates an empty registry with an optional pipeline listener.
     *
     * @param name     registry name used in log lines and error messages
     * @param listener listener for registration and pipeline events, may be null
     */
    public SchemaRegistry(String name, PipelineListener listener) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.listener = listener; // nullable
        this.pipeline = new TransformationPipeline(listener);
    }

    /** The process-wide default registry. */
    public static SchemaRegistry global() {
        return GLOBAL;
    }

    public String name() {
        return name;
    }

    /**
     * Registers a record type with default options.
     *
     * @see #register(String, List, SchemaOptions, String)
     */
    public SchemaEntry register(String typeName, List<FieldSpec> fields) {
        return register(typeName, fields, SchemaOptions.DEFAULTS, null);
    }

    /**
     * Registers a record type.
     *
     * @see #register(String, List, SchemaOptions, String)
     */
    public SchemaEntry register(String typeName, List<FieldSpec> fields, SchemaOptions options) {
        return register(typeName, fields, options, null);
    }

    /**
     * Registers a record type and returns its schema handle.
     *
     * @param typeName type name, unique within this registry
     * @param fields   fields in declaration order
     * @param options  type-level options
     * @param source   definition file the type came from, or null
     * @return the registered schema
     * @throws DuplicateFieldException  if two fields share a name
     * @throws DuplicateSchemaException if the type name is already registered
     */
    public SchemaEntry register(String typeName, List<FieldSpec> fields, SchemaOptions options, String source) {
        Objects.requireNonNull(typeName, "typeName must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (typeName.isBlank()) {
            throw new IllegalArgumentException("typeName must not be blank");
        }

        Set<String> seen = new HashSet<>();
        List<FieldDescriptor> descriptors = new ArrayList<>(fields.size());
        for (FieldSpec spec : fields) {
            if (!seen.add(spec.name())) {
                throw new DuplicateFieldException(
                        typeName + ": duplicate field '" + spec.name() + "'", typeName, source);
            }
            descriptors.add(FieldDescriptor.from(spec));
        }

        SchemaEntry entry = new SchemaEntry(typeName, descriptors, options, this, source);
        SchemaEntry existing = entries.putIfAbsent(typeName, entry);
        if (existing != null) {
            throw new DuplicateSchemaException(
                    "Record type '" + typeName + "' is already registered in '" + name + "'"
                            + (existing.source() != null ? " (from " + existing.source() + ")" : ""),
                    typeName,
                    source);
        }
        LOG.info(
                "schema.registered registry={} type={} fields={} source={}",
                name,
                typeName,
                descriptors.size(),
                source != null ? source : "code");
        notifyRegistered(entry);
        return entry;
    }

    /**
     * Starts a fluent definition of a record type.
     *
     * @param typeName type name, unique within this registry
     * @return a definition builder; call {@link Definition#register()} to finish
     */
    public Definition define(String typeName) {
        return new Definition(typeName);
    }

    /**
     * Looks up a registered type.
     *
     * @throws SchemaNotFoundException if no such type is registered
     */
    public SchemaEntry lookup(String typeName) {
        SchemaEntry entry = entries.get(typeName);
        if (entry == null) {
            throw new SchemaNotFoundException(typeName, name);
        }
        return entry;
    }

    /** Looks up a registered type, returning empty if absent. */
    public Optional<SchemaEntry> find(String typeName) {
        return Optional.ofNullable(entries.get(typeName));
    }

    public boolean contains(String typeName) {
        return entries.containsKey(typeName);
    }

    public int size() {
        return entries.size();
    }

    /** Registered type names, sorted. */
    public Set<String> typeNames() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    TransformationPipeline pipeline() {
        return pipeline;
    }

    private void notifyRegistered(SchemaEntry entry) {
        if (listener == null) return;
        try {
            listener.onSchemaRegistered(new PipelineListener.SchemaRegisteredEvent(
                    name, entry.typeName(), entry.fieldNames().size()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onSchemaRegistered failed", e);
        }
    }

    @Override
    public String toString() {
        return "SchemaRegistry[" + name + ", types=" + entries.size() + "]";
    }

    /**
     * Fluent builder for one record type. Fields keep the order they are added in.
     */
    public final class Definition {

        private final String typeName;
        private final List<FieldSpec> fields = new ArrayList<>();
        private SchemaOptions options = SchemaOptions.DEFAULTS;
        private String source;

        Definition(String typeName) {
            this.typeName = typeName;
        }

        public Definition field(String fieldName, RuleChain chain) {
            fields.add(FieldSpec.of(fieldName, chain));
            return this;
        }

        public Definition options(SchemaOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public Definition source(String source) {
            this.source = source;
            return this;
        }

        /** Registers the type; see {@link SchemaRegistry#register(String, List, SchemaOptions, String)}. */
        public SchemaEntry register() {
            return SchemaRegistry.this.register(typeName, fields, options, source);
        }
    }
}
