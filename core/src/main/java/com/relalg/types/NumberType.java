package com.relalg.types;

/**
 * Data type of number values.
 */
public final class NumberType implements DataType {

    private static final NumberType INSTANCE = new NumberType();

    private NumberType() {}

    public static NumberType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "number";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NumberType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
