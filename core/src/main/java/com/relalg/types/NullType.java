package com.relalg.types;

/**
 * Data type of NULL values and of expressions whose type is unknown
 * until evaluation.
 */
public final class NullType implements DataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NullType;
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
