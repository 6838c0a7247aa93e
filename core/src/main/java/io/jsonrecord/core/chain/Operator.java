package io.jsonrecord.core.chain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Atomic bound rule assigned to one field (a transform, a check, or both). Immutable and
 * thread-safe: parameters are captured when the chain is built and every invocation is independent
 * of earlier ones.
 *
 * <p>An operator holds up to three pure functions, one per {@link Mode}, plus an optional
 * WRITE-mode {@link WriteGuard} for access control. The pipeline calls whichever function exists for
 * the pass it runs and skips operators that declare no behaviour for that mode.
 */
public final class Operator {

    /**
     * Marker returned by a {@link ReadFunction} to drop the field from serialized output.
     */
    public static final Object OMITTED = new Object() {
        @Override
        public String toString() {
            return "<omitted>";
        }
    };

    /** WRITE-mode coercion. Returns the (possibly new) value; never signals failure. */
    @FunctionalInterface
    public interface WriteFunction {
        Object apply(Object value, OperatorContext context);
    }

    /** VALIDATE-mode check. Returns the failure message, or {@code null} if the value passes. */
    @FunctionalInterface
    public interface ValidateFunction {
        String check(Object value, OperatorContext context);
    }

    /** READ-mode representation conversion. May return {@link #OMITTED}. */
    @FunctionalInterface
    public interface ReadFunction {
        Object apply(Object value, OperatorContext context);
    }

    /**
     * WRITE-mode access check evaluated before any other write function of the chain. Returning
     * {@code false} vetoes the caller-supplied value.
     */
    @FunctionalInterface
    public interface WriteGuard {
        boolean accepts(Object suppliedValue, OperatorContext context);
    }

    private final String name;
    private final List<Object> parameters;
    private final Set<FieldKind> kinds;
    private final WriteGuard guard;
    private final WriteFunction write;
    private final ValidateFunction validate;
    private final ReadFunction read;

    private Operator(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(builder.parameters));
        this.kinds = builder.kinds.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.allOf(FieldKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.kinds));
        this.guard = builder.guard;
        this.write = builder.write;
        this.validate = builder.validate;
        this.read = builder.read;
        if (guard == null && write == null && validate == null && read == null) {
            throw new IllegalArgumentException("operator '" + name + "' declares no behaviour for any mode");
        }
    }

    /**
     * Returns a new {@link Builder} for an operator with the given name.
     *
     * @param name operator name as it appears in chain descriptions, e.g. {@code "maxlength"}
     * @return a fresh builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /** Parameters bound at build time, in declaration order. */
    public List<Object> parameters() {
        return parameters;
    }

    /** Field kinds this operator may be attached to. */
    public Set<FieldKind> kinds() {
        return kinds;
    }

    public boolean appliesTo(FieldKind kind) {
        return kinds.contains(kind);
    }

    /** The modes this operator takes part in, derived from the functions it declares. */
    public Set<Mode> modes() {
        EnumSet<Mode> modes = EnumSet.noneOf(Mode.class);
        if (guard != null || write != null) modes.add(Mode.WRITE);
        if (validate != null) modes.add(Mode.VALIDATE);
        if (read != null) modes.add(Mode.READ);
        return modes;
    }

    public boolean hasMode(Mode mode) {
        return switch (mode) {
            case WRITE -> guard != null || write != null;
            case VALIDATE -> validate != null;
            case READ -> read != null;
        };
    }

    public boolean isGuard() {
        return guard != null;
    }

    /** Runs the guard; operators without a guard accept every value. */
    public boolean accepts(Object suppliedValue, OperatorContext context) {
        return guard == null || guard.accepts(suppliedValue, context);
    }

    /** Runs the write function; operators without one return the value unchanged. */
    public Object write(Object value, OperatorContext context) {
        return write != null ? write.apply(value, context) : value;
    }

    /** Runs the validate function; operators without one always pass. */
    public String validate(Object value, OperatorContext context) {
        return validate != null ? validate.check(value, context) : null;
    }

    /** Runs the read function; operators without one return the value unchanged. */
    public Object read(Object value, OperatorContext context) {
        return read != null ? read.apply(value, context) : value;
    }

    @Override
    public String toString() {
        if (parameters.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            Object p = parameters.get(i);
            sb.append(p instanceof String ? "'" + p + "'" : String.valueOf(p));
        }
        return sb.append(')').toString();
    }

    /** Builder for {@link Operator}. Each setter returns this builder. */
    public static final class Builder {

        private final String name;
        private List<Object> parameters = List.of();
        private Set<FieldKind> kinds = EnumSet.noneOf(FieldKind.class);
        private WriteGuard guard;
        private WriteFunction write;
        private ValidateFunction validate;
        private ReadFunction read;

        Builder(String name) {
            this.name = name;
        }

        /** Binds the operator's parameters; they are copied and frozen on {@link #build()}. */
        public Builder parameters(Object... parameters) {
            this.parameters = Arrays.asList(parameters);
            return this;
        }

        /** Restricts the operator to the given kinds. Leaving this unset allows every kind. */
        public Builder kinds(FieldKind first, FieldKind... rest) {
            this.kinds = EnumSet.of(first, rest);
            return this;
        }

        public Builder guard(WriteGuard guard) {
            this.guard = guard;
            return this;
        }

        public Builder write(WriteFunction write) {
            this.write = write;
            return this;
        }

        public Builder validate(ValidateFunction validate) {
            this.validate = validate;
            return this;
        }

        public Builder read(ReadFunction read) {
            this.read = read;
            return this;
        }

        public Operator build() {
            return new Operator(this);
        }
    }
}
