package io.jsonrecord.core.chain;

/**
 * The three pipeline passes an {@link Operator} can take part in.
 *
 * <ul>
 * <li>{@link #WRITE}: sanitize pass, run on construction and on every update.</li>
 * <li>{@link #VALIDATE}: validate pass, run on demand.</li>
 * <li>{@link #READ}: serialize pass, run by {@code toJson()}.</li>
 * </ul>
 */
public enum Mode {
    WRITE,
    VALIDATE,
    READ
}
