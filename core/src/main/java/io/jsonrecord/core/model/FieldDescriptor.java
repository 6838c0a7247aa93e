package io.jsonrecord.core.model;

import io.jsonrecord.core.chain.FieldKind;
import io.jsonrecord.core.chain.RuleChain;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Registered metadata of one field. Created once when its record type is registered and never
 * mutated afterwards; the flags are derived from the chain at that point.
 *
 * @param name            internal field name
 * @param chain           the field's rule chain
 * @param required        chain contains {@code required}
 * @param defaultProvider provider of the chain's default value, or {@code null}
 * @param readonly        chain contains {@code readonly}
 * @param writeonce       chain contains {@code writeonce}
 * @param writeonly       chain contains {@code writeonly}
 */
public record FieldDescriptor(
        String name,
        RuleChain chain,
        boolean required,
        Supplier<Object> defaultProvider,
        boolean readonly,
        boolean writeonce,
        boolean writeonly) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(chain, "chain must not be null");
    }

    /** Derives a descriptor from a binder-supplied field spec. */
    public static FieldDescriptor from(FieldSpec spec) {
        RuleChain chain = spec.chain();
        return new FieldDescriptor(
                spec.name(),
                chain,
                chain.isRequired(),
                chain.defaultProvider(),
                chain.isReadonly(),
                chain.isWriteonce(),
                chain.isWriteonly());
    }

    public FieldKind kind() {
        return chain.kind();
    }

    public boolean hasDefault() {
        return defaultProvider != null;
    }

    /** Returns {@code true} when a guard may veto caller input for this field. */
    public boolean guarded() {
        return readonly || writeonce;
    }
}
