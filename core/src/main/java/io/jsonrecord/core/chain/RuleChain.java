package io.jsonrecord.core.chain;

import io.jsonrecord.core.error.IncompatibleOperatorException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Ordered, immutable composition of {@link Operator}s for one field. Chains start from a
 * kind-tagged root token in {@link Types}; every fluent call appends one operator and returns a
 * <em>new</em> chain, so a chain can be shared across any number of field declarations.
 *
 * <p>Within one mode, operators run in call order: a later WRITE operator sees the value already
 * transformed by the earlier ones. The root kind operator is always first.
 *
 * <p>Appending an operator the chain's {@link FieldKind} does not support throws {@link
 * IncompatibleOperatorException} immediately, so misuse surfaces while the schema is being
 * defined and never while data flows through it.
 *
 * <p>Thread-safe: immutable.
 */
public final class RuleChain {

    private final FieldKind kind;
    private final List<Operator> operators;
    private final RuleChain itemChain;
    private final String instanceType;

    RuleChain(FieldKind kind, List<Operator> operators, RuleChain itemChain, String instanceType) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
        this.itemChain = itemChain;
        this.instanceType = instanceType;
    }

    static RuleChain root(FieldKind kind, RuleChain itemChain, String instanceType) {
        return new RuleChain(kind, List.of(Operators.kind(kind, instanceType)), itemChain, instanceType);
    }

    public FieldKind kind() {
        return kind;
    }

    /** All operators in declaration order, root kind operator first. */
    public List<Operator> operators() {
        return operators;
    }

    /** Operators taking part in the given mode, in declaration order. */
    public List<Operator> operators(Mode mode) {
        return operators.stream().filter(op -> op.hasMode(mode)).toList();
    }

    /** Chain applied to every element of a list or value of a dict, or {@code null}. */
    public RuleChain itemChain() {
        return itemChain;
    }

    /** Referenced record type name for instance chains, or {@code null}. */
    public String instanceType() {
        return instanceType;
    }

    /** Returns {@code true} if an operator with the given name is part of this chain. */
    public boolean has(String operatorName) {
        return operators.stream().anyMatch(op -> op.name().equals(operatorName));
    }

    public boolean isRequired() {
        return has(Operators.REQUIRED);
    }

    public boolean isReadonly() {
        return has(Operators.READONLY);
    }

    public boolean isWriteonce() {
        return has(Operators.WRITEONCE);
    }

    public boolean isWriteonly() {
        return has(Operators.WRITEONLY);
    }

    /**
     * Returns the provider of the last {@code default} operator, or {@code null} when the chain
     * declares no default.
     */
    public Supplier<Object> defaultProvider() {
        for (int i = operators.size() - 1; i >= 0; i--) {
            Operator op = operators.get(i);
            if (op.name().equals(Operators.DEFAULT)) {
                return () -> op.write(null, null);
            }
        }
        return null;
    }

    /**
     * Appends an operator, returning a new chain.
     *
     * @throws IncompatibleOperatorException if the operator does not apply to this chain's kind
     */
    public RuleChain with(Operator operator) {
        Objects.requireNonNull(operator, "operator must not be null");
        if (!operator.appliesTo(kind)) {
            throw new IncompatibleOperatorException(
                    "Operator '" + operator.name() + "' cannot be applied to a " + kind.label() + " chain (" + this
                            + "); it supports " + operator.kinds(),
                    null,
                    null);
        }
        List<Operator> next = new ArrayList<>(operators);
        next.add(operator);
        return new RuleChain(kind, next, itemChain, instanceType);
    }

    // --- Presence and access ---

    public RuleChain required() {
        return with(Operators.required());
    }

    /**
     * Fill-if-null default. The literal is coerced by the chain's kind first, so a date default
     * given as {@code "2024-01-01"} is stored as a {@code LocalDate}.
     */
    public RuleChain defaultValue(Object value) {
        return with(Operators.defaultValue(coerce(value)));
    }

    /** Fill-if-null default computed on every fill; supplied values are coerced like literals. */
    public RuleChain defaultValue(Supplier<?> provider) {
        Objects.requireNonNull(provider, "default provider must not be null");
        return with(Operators.defaultValue(provider, this::coerce));
    }

    public RuleChain readonly() {
        return with(Operators.readonly());
    }

    public RuleChain writeonce() {
        return with(Operators.writeonce());
    }

    public RuleChain writeonly() {
        return with(Operators.writeonly());
    }

    // --- Length and pattern ---

    public RuleChain maxlength(int max) {
        return with(Operators.maxlength(max));
    }

    public RuleChain minlength(int min) {
        return with(Operators.minlength(min));
    }

    public RuleChain length(int min, int max) {
        return with(Operators.length(min, max));
    }

    public RuleChain match(String regex) {
        return with(Operators.match(regex));
    }

    public RuleChain email() {
        return with(Operators.email());
    }

    /**
     * Appends a membership check. Values are normalized to the chain's Java type ({@code Long} for
     * integer chains, {@code Double} for float chains).
     *
     * @throws IncompatibleOperatorException if a value does not fit the chain's kind
     */
    public RuleChain oneOf(Object... values) {
        if (!kind.isNumeric() && kind != FieldKind.STRING) {
            // let with() produce the standard message
            return with(Operators.oneOf(List.of()));
        }
        List<Object> allowed = new ArrayList<>(values.length);
        for (Object value : values) {
            Object normalized = normalize(value);
            boolean fits = switch (kind) {
                case STRING -> normalized instanceof String;
                case INTEGER -> normalized instanceof Long;
                case FLOAT -> normalized instanceof Double;
                default -> false;
            };
            if (!fits) {
                throw new IncompatibleOperatorException(
                        "oneof value " + value + " does not fit a " + kind.label() + " chain", null, null);
            }
            allowed.add(normalized);
        }
        return with(Operators.oneOf(allowed));
    }

    // --- Numeric bounds ---

    public RuleChain min(Number min) {
        return with(Operators.min(min));
    }

    public RuleChain max(Number max) {
        return with(Operators.max(max));
    }

    public RuleChain range(Number min, Number max) {
        return with(Operators.range(min, max));
    }

    // --- String normalization ---

    public RuleChain trim() {
        return with(Operators.trim());
    }

    public RuleChain toLowerCase() {
        return with(Operators.toLowerCase());
    }

    public RuleChain toUpperCase() {
        return with(Operators.toUpperCase());
    }

    // --- Custom ---

    /** Appends a custom WRITE-mode coercion. */
    public RuleChain transform(String name, Operator.WriteFunction fn) {
        return with(Operators.transform(name, fn));
    }

    /** Appends a custom VALIDATE-mode check; siblings are reachable through the context. */
    public RuleChain validate(String name, Operator.ValidateFunction fn) {
        return with(Operators.validate(name, fn));
    }

    /** Appends a custom READ-mode representation conversion. */
    public RuleChain format(String name, Operator.ReadFunction fn) {
        return with(Operators.format(name, fn));
    }

    /** Normalizes a Java literal the way the kind operator coerces input. */
    private Object coerce(Object value) {
        return operators.get(0).write(normalize(value), null);
    }

    private Object normalize(Object value) {
        if (kind == FieldKind.INTEGER
                && (value instanceof Integer || value instanceof Short || value instanceof Byte)) {
            return ((Number) value).longValue();
        }
        if (kind == FieldKind.INTEGER && value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        if (kind == FieldKind.FLOAT && value instanceof Number n && !(value instanceof Double)) {
            return n.doubleValue();
        }
        return value;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        switch (kind) {
            case LIST -> sb.append("listof(").append(itemChain).append(')');
            case DICT -> sb.append("dictof(").append(itemChain).append(')');
            case INSTANCE -> sb.append("instanceof('").append(instanceType).append("')");
            default -> sb.append(kind.label());
        }
        for (int i = 1; i < operators.size(); i++) {
            sb.append('.').append(operators.get(i));
        }
        return sb.toString();
    }
}
