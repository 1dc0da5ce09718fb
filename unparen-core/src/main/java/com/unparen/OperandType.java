package com.unparen;

import java.util.Objects;

/**
 * The static type of an operand as reported by semantic analysis.
 *
 * @param name     the fully qualified type name, e.g. {@code System.Int32}
 * @param category the arithmetic family the type belongs to
 */
public record OperandType(String name, Category category) {

    public OperandType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
    }

    public enum Category {
        INTEGRAL,
        FLOATING_POINT,
        DECIMAL,
        BOOLEAN,
        STRING,
        DYNAMIC,
        OTHER
    }
}
