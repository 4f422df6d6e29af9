package com.relalg.types;

import com.relalg.exception.InternalTranslationException;

/**
 * Sealed interface for the value types of the relational-algebra engine.
 *
 * <p>The engine knows exactly five value types, mirroring the datatype tags the
 * parser attaches to every expression:
 * <ul>
 *   <li>{@link StringType} - text values</li>
 *   <li>{@link NumberType} - integral and decimal numbers</li>
 *   <li>{@link BooleanType} - truth values</li>
 *   <li>{@link DateType} - calendar dates</li>
 *   <li>{@link NullType} - the type of NULL and of expressions with unknown type</li>
 * </ul>
 */
public sealed interface DataType
    permits StringType, NumberType, BooleanType, DateType, NullType {

    /**
     * Returns the name of this data type as used by both surface grammars.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Resolves a datatype tag of the AST to its data type.
     *
     * @param name the type name ("string", "number", "boolean", "date" or "null")
     * @return the data type
     * @throws InternalTranslationException if the name is not a supported type
     */
    static DataType forName(String name) {
        if (name == null) {
            throw new InternalTranslationException("datatype must not be null");
        }
        return switch (name) {
            case "string"  -> StringType.get();
            case "number"  -> NumberType.get();
            case "boolean" -> BooleanType.get();
            case "date"    -> DateType.get();
            case "null"    -> NullType.get();
            default -> throw new InternalTranslationException(
                "datatype '%s' not implemented yet".formatted(name));
        };
    }
}
