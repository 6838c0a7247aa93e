package io.jsonrecord.core.chain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Factory for the built-in operators. {@link RuleChain}'s fluent methods delegate here; custom
 * operators are built with {@link Operator#builder(String)} instead.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class Operators {

    public static final String REQUIRED = "required";
    public static final String DEFAULT = "default";
    public static final String READONLY = "readonly";
    public static final String WRITEONCE = "writeonce";
    public static final String WRITEONLY = "writeonly";

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private Operators() {}

    // --- Kind roots ---

    /**
     * Root operator of every chain: coerces cleanly convertible JSON input to the kind's Java type
     * (WRITE), checks the type (VALIDATE) and renders dates as ISO-8601 strings (READ).
     *
     * @param kind         the chain's kind
     * @param instanceType referenced record type for {@link FieldKind#INSTANCE}, otherwise null
     */
    public static Operator kind(FieldKind kind, String instanceType) {
        Operator.Builder b = Operator.builder(kind.label()).kinds(kind);
        if (instanceType != null) {
            b.parameters(instanceType);
        }
        switch (kind) {
            case STRING -> b.validate(typeCheck(String.class, kind));
            case INTEGER -> b.write((v, ctx) -> toLong(v)).validate((v, ctx) ->
                    v == null || v instanceof Long || v instanceof BigInteger ? null : shouldBe(ctx, kind.label()));
            case FLOAT -> b.write((v, ctx) -> v instanceof Number n && !(v instanceof Double) ? n.doubleValue() : v)
                    .validate(typeCheck(Double.class, kind));
            case BOOLEAN -> b.validate(typeCheck(Boolean.class, kind));
            case DATE -> b.write((v, ctx) -> toDate(v))
                    .validate(typeCheck(LocalDate.class, kind))
                    .read((v, ctx) -> v instanceof LocalDate d ? d.toString() : v);
            case DATETIME -> b.write((v, ctx) -> toInstant(v))
                    .validate(typeCheck(Instant.class, kind))
                    .read((v, ctx) -> v instanceof Instant i ? i.toString() : v);
            case LIST -> b.validate(typeCheck(List.class, kind));
            case DICT -> b.validate(typeCheck(Map.class, kind));
            case INSTANCE -> b.validate((v, ctx) -> v == null
                            || (v instanceof RecordView r && r.typeName().equals(instanceType))
                    ? null
                    : shouldBe(ctx, "instance of '" + instanceType + "'"));
            case ANY -> b.write((v, ctx) -> v);
        }
        return b.build();
    }

    // --- Presence and access ---

    public static Operator required() {
        return Operator.builder(REQUIRED)
                .validate((v, ctx) -> v == null ? "Value at '" + ctx.path() + "' should not be null." : null)
                .build();
    }

    /**
     * Fill-if-absent default. Mutable container defaults are copied on every fill so records never
     * share a list or map.
     */
    public static Operator defaultValue(Object value) {
        Objects.requireNonNull(value, "default value must not be null");
        return defaultValue(() -> copyOf(value), value);
    }

    public static Operator defaultValue(Supplier<?> provider) {
        Objects.requireNonNull(provider, "default provider must not be null");
        return defaultValue(provider, provider);
    }

    /** Provider default whose every produced value passes through {@code coercion} first. */
    public static Operator defaultValue(Supplier<?> provider, UnaryOperator<Object> coercion) {
        Objects.requireNonNull(provider, "default provider must not be null");
        Objects.requireNonNull(coercion, "coercion must not be null");
        return defaultValue(() -> coercion.apply(provider.get()), provider);
    }

    private static Operator defaultValue(Supplier<?> provider, Object description) {
        return Operator.builder(DEFAULT)
                .parameters(description)
                .write((v, ctx) -> v != null ? v : provider.get())
                .build();
    }

    /** Vetoes every caller-supplied value; the value can only come from a default or a trusted update. */
    public static Operator readonly() {
        return Operator.builder(READONLY).guard((v, ctx) -> false).build();
    }

    /** Accepts a caller-supplied value only while the field is still unset. */
    public static Operator writeonce() {
        return Operator.builder(WRITEONCE)
                .guard((v, ctx) -> ctx.currentValue() == null)
                .build();
    }

    /** Keeps the field out of serialized output. */
    public static Operator writeonly() {
        return Operator.builder(WRITEONLY).read((v, ctx) -> Operator.OMITTED).build();
    }

    // --- Length and pattern ---

    public static Operator maxlength(int max) {
        return Operator.builder("maxlength")
                .parameters(max)
                .kinds(FieldKind.STRING, FieldKind.LIST)
                .validate((v, ctx) -> {
                    int len = lengthOf(v);
                    return len > max
                            ? "Length of value at '" + ctx.path() + "' should not be greater than " + max + "."
                            : null;
                })
                .build();
    }

    public static Operator minlength(int min) {
        return Operator.builder("minlength")
                .parameters(min)
                .kinds(FieldKind.STRING, FieldKind.LIST)
                .validate((v, ctx) -> {
                    int len = lengthOf(v);
                    return len >= 0 && len < min
                            ? "Length of value at '" + ctx.path() + "' should not be less than " + min + "."
                            : null;
                })
                .build();
    }

    public static Operator length(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("length: min " + min + " is greater than max " + max);
        }
        return Operator.builder("length")
                .parameters(min, max)
                .kinds(FieldKind.STRING, FieldKind.LIST)
                .validate((v, ctx) -> {
                    int len = lengthOf(v);
                    return len >= 0 && (len < min || len > max)
                            ? "Length of value at '" + ctx.path() + "' should be between " + min + " and " + max
                                    + "."
                            : null;
                })
                .build();
    }

    public static Operator match(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return Operator.builder("match")
                .parameters(regex)
                .kinds(FieldKind.STRING)
                .validate((v, ctx) -> v instanceof String s && !pattern.matcher(s).find()
                        ? "Value at '" + ctx.path() + "' does not match pattern '" + regex + "'."
                        : null)
                .build();
    }

    public static Operator email() {
        return Operator.builder("email")
                .kinds(FieldKind.STRING)
                .validate((v, ctx) -> v instanceof String s && !EMAIL.matcher(s).matches()
                        ? "Value at '" + ctx.path() + "' is not a valid email address."
                        : null)
                .build();
    }

    /** Membership check; {@code allowed} must already be normalized to the chain's Java type. */
    public static Operator oneOf(List<?> allowed) {
        List<?> values = List.copyOf(allowed);
        return Operator.builder("oneof")
                .parameters(values)
                .kinds(FieldKind.STRING, FieldKind.INTEGER, FieldKind.FLOAT)
                .validate((v, ctx) -> v == null || values.contains(v)
                        ? null
                        : "Value " + describe(v) + " at '" + ctx.path() + "' is not one of " + values + ".")
                .build();
    }

    // --- Numeric bounds ---

    public static Operator min(Number min) {
        return Operator.builder("min")
                .parameters(min)
                .kinds(FieldKind.INTEGER, FieldKind.FLOAT)
                .validate((v, ctx) -> v instanceof Number n && compare(n, min) < 0
                        ? "Value at '" + ctx.path() + "' should not be less than " + min + "."
                        : null)
                .build();
    }

    public static Operator max(Number max) {
        return Operator.builder("max")
                .parameters(max)
                .kinds(FieldKind.INTEGER, FieldKind.FLOAT)
                .validate((v, ctx) -> v instanceof Number n && compare(n, max) > 0
                        ? "Value at '" + ctx.path() + "' should not be greater than " + max + "."
                        : null)
                .build();
    }

    public static Operator range(Number min, Number max) {
        if (compare(min, max) > 0) {
            throw new IllegalArgumentException("range: min " + min + " is greater than max " + max);
        }
        return Operator.builder("range")
                .parameters(min, max)
                .kinds(FieldKind.INTEGER, FieldKind.FLOAT)
                .validate((v, ctx) -> v instanceof Number n && (compare(n, min) < 0 || compare(n, max) > 0)
                        ? "Value at '" + ctx.path() + "' should be between " + min + " and " + max + "."
                        : null)
                .build();
    }

    // --- String normalization ---

    public static Operator trim() {
        return Operator.builder("trim")
                .kinds(FieldKind.STRING)
                .write((v, ctx) -> v instanceof String s ? s.strip() : v)
                .build();
    }

    public static Operator toLowerCase() {
        return Operator.builder("tolower")
                .kinds(FieldKind.STRING)
                .write((v, ctx) -> v instanceof String s ? s.toLowerCase(Locale.ROOT) : v)
                .build();
    }

    public static Operator toUpperCase() {
        return Operator.builder("toupper")
                .kinds(FieldKind.STRING)
                .write((v, ctx) -> v instanceof String s ? s.toUpperCase(Locale.ROOT) : v)
                .build();
    }

    // --- Custom ---

    public static Operator transform(String name, Operator.WriteFunction fn) {
        return Operator.builder(name).write(Objects.requireNonNull(fn, "fn")).build();
    }

    public static Operator validate(String name, Operator.ValidateFunction fn) {
        return Operator.builder(name).validate(Objects.requireNonNull(fn, "fn")).build();
    }

    public static Operator format(String name, Operator.ReadFunction fn) {
        return Operator.builder(name).read(Objects.requireNonNull(fn, "fn")).build();
    }

    // --- Helpers ---

    static String shouldBe(OperatorContext ctx, String what) {
        return "Value at '" + ctx.path() + "' should be " + what + ".";
    }

    private static Operator.ValidateFunction typeCheck(Class<?> type, FieldKind kind) {
        return (v, ctx) -> v == null || type.isInstance(v) ? null : shouldBe(ctx, kind.label());
    }

    private static String describe(Object v) {
        return v instanceof String ? "'" + v + "'" : String.valueOf(v);
    }

    /** Length of a string or list, or -1 for anything else. */
    private static int lengthOf(Object v) {
        if (v instanceof String s) return s.length();
        if (v instanceof List<?> l) return l.size();
        return -1;
    }

    static int compare(Number a, Number b) {
        return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
    }

    private static Object toLong(Object v) {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        return v;
    }

    private static Object toDate(Object v) {
        if (!(v instanceof String s)) {
            return v;
        }
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s).toLocalDate();
            } catch (DateTimeParseException ignored) {
                // left as-is; the validate pass reports it
                return v;
            }
        }
    }

    private static Object toInstant(Object v) {
        if (!(v instanceof String s)) {
            return v;
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                // left as-is; the validate pass reports it
                return v;
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Object copyOf(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyOf(item)));
            return copy;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) map).forEach((k, item) -> copy.put(k, copyOf(item)));
            return copy;
        }
        return value;
    }
}
