package com.relalg.logical;

import com.relalg.exception.InternalTranslationException;
import java.util.Locale;
import java.util.Objects;

/**
 * An aggregate computed by a {@link GroupBy}, producing one output column.
 *
 * @param function the aggregate function
 * @param column the aggregated column (null for COUNT_ALL)
 * @param name the output column name
 */
public record AggregateFunction(Function function, Column column, String name) {

    public AggregateFunction {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (function != Function.COUNT_ALL && column == null) {
            throw new IllegalArgumentException(function + " requires a column");
        }
    }

    @Override
    public String toString() {
        String arg = function == Function.COUNT_ALL ? "*" : column.toString();
        String functionName = function == Function.COUNT_ALL ? "count" : function.name().toLowerCase(Locale.ROOT);
        return functionName + "(" + arg + ")→" + name;
    }

    /**
     * Supported aggregate functions.
     */
    public enum Function {
        COUNT_ALL,
        COUNT,
        SUM,
        AVG,
        MIN,
        MAX;

        /**
         * Resolves the function name used by the parsers (case-insensitive).
         *
         * @param name the function name, such as "COUNT_ALL" or "sum"
         * @return the function
         * @throws InternalTranslationException if the name is unknown
         */
        public static Function forName(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InternalTranslationException("aggregate function '" + name + "' not implemented", e);
            }
        }
    }
}
