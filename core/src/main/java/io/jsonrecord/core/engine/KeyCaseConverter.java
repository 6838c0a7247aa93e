package io.jsonrecord.core.engine;

import io.jsonrecord.core.model.KeyCasePolicy;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Bidirectional mapping between internal field names and JSON keys (e.g. {@code read_count} ↔
 * {@code readCount}). Applied only at the construction-input and serialize-output boundary.
 *
 * <p>Fails closed: a name that does not convert cleanly, or whose conversion would not convert back
 * to the same name, is returned unchanged instead of being guessed at.
 *
 * <p>Thread-safe: stateless.
 */
public final class KeyCaseConverter {

    public static final KeyCaseConverter IDENTITY = new KeyCaseConverter(KeyCasePolicy.IDENTITY);
    public static final KeyCaseConverter SNAKE_CAMEL = new KeyCaseConverter(KeyCasePolicy.SNAKE_CAMEL);

    private static final Pattern SNAKE = Pattern.compile("[a-z][a-z0-9]*(_[a-z][a-z0-9]*)*");
    private static final Pattern CAMEL = Pattern.compile("[a-z][a-z0-9]*([A-Z][a-z0-9]*)*");
    private static final Pattern CONSECUTIVE_CAPITALS = Pattern.compile("[A-Z]{2}");

    private final KeyCasePolicy policy;

    private KeyCaseConverter(KeyCasePolicy policy) {
        this.policy = policy;
    }

    public static KeyCaseConverter of(KeyCasePolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        return switch (policy) {
            case IDENTITY -> IDENTITY;
            case SNAKE_CAMEL -> SNAKE_CAMEL;
        };
    }

    public KeyCasePolicy policy() {
        return policy;
    }

    /** Maps an internal field name to its JSON key. */
    public String toWire(String name) {
        return policy == KeyCasePolicy.SNAKE_CAMEL ? snakeToCamel(name) : name;
    }

    /** Maps a JSON key back to the internal field name. */
    public String fromWire(String key) {
        return policy == KeyCasePolicy.SNAKE_CAMEL ? camelToSnake(key) : key;
    }

    /**
     * Converts {@code snake_case} to {@code camelCase}. Returns the input unchanged if it is not
     * lower snake case or the result would not map back to it.
     */
    public static String snakeToCamel(String name) {
        if (name == null || name.indexOf('_') < 0 || !SNAKE.matcher(name).matches()) {
            return name;
        }
        String camel = snakeToCamelUnchecked(name);
        return name.equals(rawCamelToSnake(camel)) ? camel : name;
    }

    /**
     * Converts {@code camelCase} to {@code snake_case}. Keys with consecutive capitals (acronyms
     * such as {@code readURL}) and keys that do not map back cleanly are returned unchanged.
     */
    public static String camelToSnake(String key) {
        if (key == null
                || !CAMEL.matcher(key).matches()
                || key.chars().noneMatch(Character::isUpperCase)
                || CONSECUTIVE_CAPITALS.matcher(key).find()) {
            return key;
        }
        String snake = rawCamelToSnake(key);
        return key.equals(snakeToCamelUnchecked(snake)) ? snake : key;
    }

    private static String rawCamelToSnake(String key) {
        StringBuilder sb = new StringBuilder(key.length() + 4);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isUpperCase(c)) {
                sb.append('_').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String snakeToCamelUnchecked(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "KeyCaseConverter[" + policy + "]";
    }
}
