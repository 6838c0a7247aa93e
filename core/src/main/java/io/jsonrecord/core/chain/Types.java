package io.jsonrecord.core.chain;

import java.util.Objects;

/**
 * Root tokens every {@link RuleChain} starts from. Each method returns a fresh chain holding only
 * the kind operator; append further operators fluently:
 *
 * <pre>{@code
 * RuleChain title = Types.string().trim().maxlength(100).required();
 * RuleChain tags = Types.listOf(Types.string().toLowerCase()).defaultValue(List.of());
 * RuleChain address = Types.instanceOf("Address").required();
 * }</pre>
 */
public final class Types {

    private Types() {}

    public static RuleChain string() {
        return RuleChain.root(FieldKind.STRING, null, null);
    }

    public static RuleChain integer() {
        return RuleChain.root(FieldKind.INTEGER, null, null);
    }

    public static RuleChain floating() {
        return RuleChain.root(FieldKind.FLOAT, null, null);
    }

    public static RuleChain bool() {
        return RuleChain.root(FieldKind.BOOLEAN, null, null);
    }

    public static RuleChain date() {
        return RuleChain.root(FieldKind.DATE, null, null);
    }

    public static RuleChain datetime() {
        return RuleChain.root(FieldKind.DATETIME, null, null);
    }

    public static RuleChain any() {
        return RuleChain.root(FieldKind.ANY, null, null);
    }

    /** List whose every element runs through {@code items}. */
    public static RuleChain listOf(RuleChain items) {
        return RuleChain.root(FieldKind.LIST, Objects.requireNonNull(items, "items must not be null"), null);
    }

    /** String-keyed dict whose every value runs through {@code values}. */
    public static RuleChain dictOf(RuleChain values) {
        return RuleChain.root(FieldKind.DICT, Objects.requireNonNull(values, "values must not be null"), null);
    }

    /** Nested record of the named type, resolved against the registry of the enclosing schema. */
    public static RuleChain instanceOf(String typeName) {
        Objects.requireNonNull(typeName, "typeName must not be null");
        return RuleChain.root(FieldKind.INSTANCE, null, typeName);
    }
}
