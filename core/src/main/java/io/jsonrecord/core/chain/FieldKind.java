package io.jsonrecord.core.chain;

/**
 * Declared kind of a field, fixed by the root token a {@link RuleChain} starts from. Decides which
 * operators may be appended to the chain and how JSON input is coerced.
 */
public enum FieldKind {
    STRING("str"),
    INTEGER("int"),
    FLOAT("float"),
    BOOLEAN("bool"),
    DATE("date"),
    DATETIME("datetime"),
    LIST("list"),
    DICT("dict"),
    INSTANCE("instance"),
    ANY("any");

    private final String label;

    FieldKind(String label) {
        this.label = label;
    }

    /** Short name used in operator names and validation messages, e.g. {@code "int"}. */
    public String label() {
        return label;
    }

    /** Returns {@code true} for numeric kinds. */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
