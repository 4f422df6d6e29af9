package com.relalg.types;

import java.util.Objects;

/**
 * A column of a {@link Schema}.
 *
 * <p>Each column has a name, an optional relation alias qualifying it and a data type.
 *
 * @param name the column name
 * @param relAlias the relation alias qualifying the column (may be null)
 * @param type the column data type
 */
public record SchemaColumn(String name, String relAlias, DataType type) {

    public SchemaColumn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Returns whether this column answers to the given reference.
     *
     * <p>An unqualified reference matches any column of that name; a qualified
     * reference additionally requires the relation alias to match.
     *
     * @param refName the referenced column name
     * @param refAlias the referenced relation alias (may be null)
     * @return true if the reference denotes this column
     */
    public boolean matches(String refName, String refAlias) {
        if (!name.equals(refName)) {
            return false;
        }
        return refAlias == null || refAlias.equals(relAlias);
    }

    /**
     * Returns a copy of this column qualified by another relation alias.
     *
     * @param alias the new relation alias
     * @return the requalified column
     */
    public SchemaColumn withRelAlias(String alias) {
        return new SchemaColumn(name, alias, type);
    }

    /**
     * Returns a copy of this column under another name.
     *
     * @param newName the new column name
     * @return the renamed column
     */
    public SchemaColumn withName(String newName) {
        return new SchemaColumn(newName, relAlias, type);
    }

    public String qualifiedName() {
        return relAlias != null ? relAlias + "." + name : name;
    }

    @Override
    public String toString() {
        return qualifiedName() + ": " + type;
    }
}
