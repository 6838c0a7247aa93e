package io.jsonrecord.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jsonrecord.core.chain.FieldKind;
import io.jsonrecord.core.chain.Mode;
import io.jsonrecord.core.chain.Operator;
import io.jsonrecord.core.chain.OperatorContext;
import io.jsonrecord.core.chain.Operators;
import io.jsonrecord.core.chain.RuleChain;
import io.jsonrecord.core.error.AmbiguousFieldException;
import io.jsonrecord.core.error.CyclicRecordException;
import io.jsonrecord.core.error.ImmutableRecordException;
import io.jsonrecord.core.error.ReadonlyFieldException;
import io.jsonrecord.core.error.UnexpectedFieldException;
import io.jsonrecord.core.model.ExtraFieldPolicy;
import io.jsonrecord.core.model.FieldDescriptor;
import io.jsonrecord.core.model.ReadonlyViolationPolicy;
import io.jsonrecord.core.model.ValidationReport;
import io.jsonrecord.core.spi.PipelineListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the three passes of a record's lifecycle against its schema:
 *
 * <ul>
 *   <li><b>sanitize</b>: caller input through the WRITE operators of each field's chain, guards
 *       first;
 *   <li><b>validate</b>: stored values through the VALIDATE operators, failures collected by an
 *       {@link ErrorAggregator};
 *   <li><b>serialize</b>: stored values through the READ operators into a fresh Jackson tree with
 *       wire keys.
 * </ul>
 *
 * <p>All passes recurse into nested records, lists and dicts. Nested instance types are resolved
 * lazily through the registry owning the referring schema.
 *
 * <p>Thread-safe: holds no per-pass state. One instance is owned by each {@link SchemaRegistry}.
 */
public final class TransformationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TransformationPipeline.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Which write path invoked the sanitize pass. */
    public enum WriteMode {
        /** Building a new record: every declared field runs its chain, so defaults fill. */
        CONSTRUCT,

        /** Caller assignment after construction: only supplied fields run, guards apply. */
        SET,

        /** Trusted internal assignment: guards and mutability are skipped, unknown keys fail. */
        UPDATE
    }

    private final PipelineListener listener;

    /** @param listener event listener, may be null */
    public TransformationPipeline(PipelineListener listener) {
        this.listener = listener;
    }

    /** Creates a record of the given type and sanitizes the input onto it. */
    public JsonRecord construct(SchemaEntry entry, Map<String, ?> input) {
        JsonRecord record = new JsonRecord(entry);
        sanitize(entry, record, input, WriteMode.CONSTRUCT);
        return record;
    }

    /**
     * Writes caller input onto a record through the WRITE operators of each field.
     *
     * <p>Known fields are always written before an input error is raised, so one failure names
     * every offending key.
     *
     * @throws ImmutableRecordException  on {@link WriteMode#SET} against an immutable type
     * @throws UnexpectedFieldException  for unknown keys under the REJECT policy, or in UPDATE mode
     * @throws ReadonlyFieldException    for vetoed guarded fields under the REJECT violation policy
     * @throws AmbiguousFieldException   when two input keys name the same field; nothing is written
     */
    public void sanitize(SchemaEntry entry, JsonRecord record, Map<String, ?> input, WriteMode mode) {
        Map<String, ?> source = input != null ? input : Map.of();
        if (mode == WriteMode.SET && !entry.options().mutable()) {
            throw new ImmutableRecordException(entry.typeName(), new ArrayList<>(source.keySet()));
        }

        Map<String, Object> supplied = new LinkedHashMap<>();
        Map<String, String> keyOf = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();
        List<String> ambiguous = new ArrayList<>();
        for (Map.Entry<String, ?> e : source.entrySet()) {
            String name = fieldNameOf(entry, e.getKey());
            if (name == null) {
                unknown.add(e.getKey());
                continue;
            }
            String earlier = keyOf.putIfAbsent(name, e.getKey());
            if (earlier != null) {
                if (!ambiguous.contains(earlier)) {
                    ambiguous.add(earlier);
                }
                ambiguous.add(e.getKey());
                continue;
            }
            supplied.put(name, JsonValues.normalize(e.getValue()));
        }
        if (!ambiguous.isEmpty()) {
            throw new AmbiguousFieldException(entry.typeName(), ambiguous);
        }

        List<String> written = new ArrayList<>();
        List<String> vetoed = new ArrayList<>();
        for (FieldDescriptor field : entry.fields()) {
            String name = field.name();
            boolean present = supplied.containsKey(name);
            if (!present && mode != WriteMode.CONSTRUCT) {
                continue;
            }
            Object value = supplied.get(name);
            OperatorContext ctx =
                    new OperatorContext(record, name, name, mode == WriteMode.CONSTRUCT, record.get(name));

            if (present && mode != WriteMode.UPDATE && field.guarded() && !guardsAccept(field.chain(), value, ctx)) {
                vetoed.add(name);
                if (mode == WriteMode.SET) {
                    continue;
                }
                value = null;
            }
            record.store(name, write(entry, field.chain(), value, ctx));
            written.add(name);
        }

        if (!vetoed.isEmpty()) {
            ReadonlyViolationPolicy policy = entry.options().readonlyViolation();
            if (policy == ReadonlyViolationPolicy.WARN) {
                LOG.warn("record.readonly_vetoed type={} mode={} fields={}", entry.typeName(), mode, vetoed);
            } else {
                LOG.debug("record.readonly_vetoed type={} mode={} fields={}", entry.typeName(), mode, vetoed);
            }
        }
        notifySanitized(entry, mode, written, unknown);

        ReadonlyFieldException readonlyFailure = !vetoed.isEmpty()
                        && entry.options().readonlyViolation() == ReadonlyViolationPolicy.REJECT
                ? new ReadonlyFieldException(entry.typeName(), vetoed)
                : null;
        if (!unknown.isEmpty()) {
            if (mode == WriteMode.UPDATE || entry.options().extraFields() == ExtraFieldPolicy.REJECT) {
                UnexpectedFieldException failure = new UnexpectedFieldException(entry.typeName(), unknown);
                if (readonlyFailure != null) {
                    failure.addSuppressed(readonlyFailure);
                }
                throw failure;
            }
            LOG.debug("record.unknown_keys_dropped type={} keys={}", entry.typeName(), unknown);
        }
        if (readonlyFailure != null) {
            throw readonlyFailure;
        }
    }

    /**
     * Runs the validate pass over every field of a record, in declaration order.
     *
     * @param failFast stop at the first failure instead of collecting all of them
     * @return the report, empty when the record is valid
     */
    public ValidationReport validate(SchemaEntry entry, JsonRecord record, boolean failFast) {
        long start = System.nanoTime();
        ErrorAggregator errors = new ErrorAggregator(failFast);
        validateRecord(entry, record, "", errors, identitySet());
        long duration = System.nanoTime() - start;
        LOG.debug(
                "record.validated type={} errors={} failFast={} durationMs={}",
                entry.typeName(),
                errors.size(),
                failFast,
                duration / 1_000_000);
        notifyValidated(entry, errors.size(), duration);
        return errors.toReport();
    }

    /**
     * Serializes a record to a fresh object node. Keys are renamed per the type's key-case policy;
     * the record itself is never touched.
     *
     * <p>A record reached twice along different branches is written twice. A record that refers
     * back to one of its enclosing records cannot be written.
     *
     * @param ignoreWriteonly include fields whose chain declares {@code writeonly}
     * @throws CyclicRecordException if the record graph contains a cycle
     */
    public ObjectNode serialize(SchemaEntry entry, JsonRecord record, boolean ignoreWriteonly) {
        Set<JsonRecord> enclosing = identitySet();
        enclosing.add(record);
        return serializeRecord(entry, record, "", ignoreWriteonly, enclosing);
    }

    // --- sanitize ---

    private static String fieldNameOf(SchemaEntry entry, String key) {
        if (entry.hasField(key)) {
            return key;
        }
        String name = entry.keyCase().fromWire(key);
        return entry.hasField(name) ? name : null;
    }

    private static boolean guardsAccept(RuleChain chain, Object value, OperatorContext ctx) {
        for (Operator op : chain.operators(Mode.WRITE)) {
            if (op.isGuard() && !op.accepts(value, ctx)) {
                return false;
            }
        }
        return true;
    }

    private Object write(SchemaEntry owner, RuleChain chain, Object value, OperatorContext ctx) {
        Object current = value;
        for (Operator op : chain.operators(Mode.WRITE)) {
            current = op.write(current, ctx);
        }
        return writeNested(owner, chain, current, ctx);
    }

    @SuppressWarnings("unchecked")
    private Object writeNested(SchemaEntry owner, RuleChain chain, Object value, OperatorContext ctx) {
        if (value == null) {
            return null;
        }
        switch (chain.kind()) {
            case LIST -> {
                if (value instanceof List<?> list) {
                    List<Object> items = new ArrayList<>(list.size());
                    for (int i = 0; i < list.size(); i++) {
                        items.add(write(owner, chain.itemChain(), list.get(i), ctx.at(ctx.path() + "." + i)));
                    }
                    return Collections.unmodifiableList(items);
                }
            }
            case DICT -> {
                if (value instanceof Map<?, ?> map) {
                    Map<String, Object> entries = new LinkedHashMap<>();
                    for (Map.Entry<?, ?> e : map.entrySet()) {
                        String key = owner.keyCase().fromWire(String.valueOf(e.getKey()));
                        entries.put(key, write(owner, chain.itemChain(), e.getValue(), ctx.at(ctx.path() + "." + key)));
                    }
                    return Collections.unmodifiableMap(entries);
                }
            }
            case INSTANCE -> {
                if (value instanceof Map<?, ?> map) {
                    SchemaEntry nested = owner.registry().lookup(chain.instanceType());
                    return construct(nested, (Map<String, ?>) map);
                }
            }
            default -> {
                // scalars are stored as the chain left them
            }
        }
        return JsonValues.freeze(value);
    }

    // --- validate ---

    private void validateRecord(
            SchemaEntry entry, JsonRecord record, String prefix, ErrorAggregator errors, Set<JsonRecord> visited) {
        if (!visited.add(record)) {
            return;
        }
        for (FieldDescriptor field : entry.fields()) {
            if (errors.isSaturated()) {
                return;
            }
            String name = field.name();
            String path = prefix.isEmpty() ? name : prefix + "." + name;
            Object value = record.get(name);
            validateValue(field.chain(), value, new OperatorContext(record, name, path, false, value), errors, visited);
        }
    }

    private void validateValue(
            RuleChain chain, Object value, OperatorContext ctx, ErrorAggregator errors, Set<JsonRecord> visited) {
        for (Operator op : chain.operators(Mode.VALIDATE)) {
            String failure = op.validate(value, ctx);
            if (failure != null) {
                errors.add(ctx.path(), failure, value);
                return;
            }
        }
        if (value == null) {
            return;
        }
        if (chain.kind() == FieldKind.LIST && value instanceof List<?> list) {
            for (int i = 0; i < list.size() && !errors.isSaturated(); i++) {
                Object item = list.get(i);
                validateValue(chain.itemChain(), item, ctx.at(ctx.path() + "." + i), errors, visited);
            }
        } else if (chain.kind() == FieldKind.DICT && value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (errors.isSaturated()) {
                    return;
                }
                validateValue(chain.itemChain(), e.getValue(), ctx.at(ctx.path() + "." + e.getKey()), errors, visited);
            }
        } else if (value instanceof JsonRecord nested) {
            validateRecord(nested.schema(), nested, ctx.path(), errors, visited);
        }
    }

    // --- serialize ---

    private static Object read(RuleChain chain, Object value, OperatorContext ctx, boolean ignoreWriteonly) {
        Object current = value;
        for (Operator op : chain.operators(Mode.READ)) {
            if (ignoreWriteonly && op.name().equals(Operators.WRITEONLY)) {
                continue;
            }
            current = op.read(current, ctx);
            if (current == Operator.OMITTED) {
                return Operator.OMITTED;
            }
        }
        return current;
    }

    private ObjectNode serializeRecord(
            SchemaEntry entry, JsonRecord record, String prefix, boolean ignoreWriteonly, Set<JsonRecord> enclosing) {
        ObjectNode out = NODES.objectNode();
        KeyCaseConverter keys = entry.keyCase();
        for (FieldDescriptor field : entry.fields()) {
            String name = field.name();
            String path = prefix.isEmpty() ? name : prefix + "." + name;
            OperatorContext ctx = new OperatorContext(record, name, path, false, null);
            Object value = read(field.chain(), record.get(name), ctx, ignoreWriteonly);
            if (value == Operator.OMITTED) {
                continue;
            }
            out.set(keys.toWire(name), toNode(entry, field.chain(), value, ctx, ignoreWriteonly, enclosing));
        }
        return out;
    }

    private JsonNode toNode(
            SchemaEntry owner,
            RuleChain chain,
            Object value,
            OperatorContext ctx,
            boolean ignoreWriteonly,
            Set<JsonRecord> enclosing) {
        if (value instanceof JsonRecord nested) {
            if (!enclosing.add(nested)) {
                throw new CyclicRecordException(nested.typeName(), ctx.path());
            }
            ObjectNode node = serializeRecord(nested.schema(), nested, ctx.path(), ignoreWriteonly, enclosing);
            enclosing.remove(nested);
            return node;
        }
        RuleChain items = chain != null ? chain.itemChain() : null;
        if (value instanceof List<?> list) {
            ArrayNode array = NODES.arrayNode(list.size());
            for (int i = 0; i < list.size(); i++) {
                OperatorContext itemCtx = ctx.at(ctx.path() + "." + i);
                Object item = items != null ? read(items, list.get(i), itemCtx, ignoreWriteonly) : list.get(i);
                if (item != Operator.OMITTED) {
                    array.add(toNode(owner, items, item, itemCtx, ignoreWriteonly, enclosing));
                }
            }
            return array;
        }
        if (value instanceof Map<?, ?> map && chain != null && chain.kind() == FieldKind.DICT) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                String key = String.valueOf(e.getKey());
                OperatorContext itemCtx = ctx.at(ctx.path() + "." + key);
                Object item = read(items, e.getValue(), itemCtx, ignoreWriteonly);
                if (item != Operator.OMITTED) {
                    object.set(owner.keyCase().toWire(key), toNode(owner, items, item, itemCtx, ignoreWriteonly, enclosing));
                }
            }
            return object;
        }
        return JsonValues.toJson(value);
    }

    private static Set<JsonRecord> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    // --- listener ---

    private void notifySanitized(SchemaEntry entry, WriteMode mode, List<String> written, List<String> dropped) {
        if (listener == null) return;
        try {
            listener.onRecordSanitized(new PipelineListener.RecordSanitizedEvent(
                    entry.typeName(), mode.name(), List.copyOf(written), List.copyOf(dropped)));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onRecordSanitized failed", e);
        }
    }

    private void notifyValidated(SchemaEntry entry, int errorCount, long durationNanos) {
        if (listener == null) return;
        try {
            listener.onValidationCompleted(
                    new PipelineListener.ValidationCompletedEvent(entry.typeName(), errorCount, durationNanos));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onValidationCompleted failed", e);
        }
    }
}
