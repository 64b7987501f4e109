package io.quyaml.core.model;

import java.util.Objects;

/**
 * A named register of fixed width, declared in source as {@code name[size]}.
 *
 * @param name register name as written before the brackets
 * @param size number of (qu)bits, zero allowed for the classical register
 */
public record Register(String name, int size) {

    public Register {
        Objects.requireNonNull(name, "name must not be null");
        if (size < 0) {
            throw new IllegalArgumentException("Register size must not be negative, got: " + size);
        }
    }

    /** Source form, e.g. {@code q[2]}. */
    public String declaration() {
        return name + "[" + size + "]";
    }
}
