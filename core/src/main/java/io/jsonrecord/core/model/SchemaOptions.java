package io.jsonrecord.core.model;

import java.util.Objects;

/**
 * Type-level options of a registered record schema. Immutable; use the {@code with*} methods to
 * derive variants from {@link #DEFAULTS}.
 *
 * @param extraFields       unknown input keys: {@link ExtraFieldPolicy#IGNORE} by default
 * @param keyCase           JSON key convention: {@link KeyCasePolicy#IDENTITY} by default
 * @param mutable           whether {@code set} is allowed after construction, {@code true} by default
 * @param readonlyViolation handling of vetoed readonly/writeonce input, {@link
 *                          ReadonlyViolationPolicy#DISCARD} by default
 */
public record SchemaOptions(
        ExtraFieldPolicy extraFields,
        KeyCasePolicy keyCase,
        boolean mutable,
        ReadonlyViolationPolicy readonlyViolation) {

    public static final SchemaOptions DEFAULTS =
            new SchemaOptions(ExtraFieldPolicy.IGNORE, KeyCasePolicy.IDENTITY, true, ReadonlyViolationPolicy.DISCARD);

    public SchemaOptions {
        Objects.requireNonNull(extraFields, "extraFields must not be null");
        Objects.requireNonNull(keyCase, "keyCase must not be null");
        Objects.requireNonNull(readonlyViolation, "readonlyViolation must not be null");
    }

    public SchemaOptions withExtraFields(ExtraFieldPolicy policy) {
        return new SchemaOptions(policy, keyCase, mutable, readonlyViolation);
    }

    public SchemaOptions withKeyCase(KeyCasePolicy policy) {
        return new SchemaOptions(extraFields, policy, mutable, readonlyViolation);
    }

    public SchemaOptions withMutable(boolean value) {
        return new SchemaOptions(extraFields, keyCase, value, readonlyViolation);
    }

    public SchemaOptions withReadonlyViolation(ReadonlyViolationPolicy policy) {
        return new SchemaOptions(extraFields, keyCase, mutable, policy);
    }
}
