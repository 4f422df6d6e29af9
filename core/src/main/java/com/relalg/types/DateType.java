package com.relalg.types;

/**
 * Data type of calendar dates ({@code java.time.LocalDate} values).
 */
public final class DateType implements DataType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {}

    public static DateType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DateType;
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
