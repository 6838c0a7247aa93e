package io.jsonrecord.core.model;

import io.jsonrecord.core.chain.RuleChain;
import java.util.Objects;

/**
 * One field as supplied when a record type is registered: its internal name and its built chain.
 * The declared kind travels with the chain.
 */
public record FieldSpec(String name, RuleChain chain) {

    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(chain, "chain must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
    }

    public static FieldSpec of(String name, RuleChain chain) {
        return new FieldSpec(name, chain);
    }
}
