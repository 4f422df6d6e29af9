package com.relalg.expression;

import com.relalg.ast.CodeInfo;
import com.relalg.types.DataType;
import com.relalg.types.NullType;
import java.util.Objects;

/**
 * Expression reading a column of the current row.
 *
 * <p>References can be:
 * <ul>
 *   <li>Simple: {@code a}, {@code name}</li>
 *   <li>Qualified: {@code R.a}, {@code s.name}</li>
 * </ul>
 *
 * <p>The type of a column is only known once the reference is resolved against
 * an input schema, so the reference itself reports {@link NullType}.
 */
public final class ColumnValue implements ValueExpr {

    private final String columnName;
    private final String relAlias; // Optional relation qualifier
    private final CodeInfo codeInfo;
    private final boolean wrappedInParentheses;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @param relAlias the relation alias (may be null)
     * @param codeInfo the source position (may be null)
     * @param wrappedInParentheses whether the reference was parenthesized
     */
    public ColumnValue(String columnName, String relAlias, CodeInfo codeInfo, boolean wrappedInParentheses) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.relAlias = relAlias;
        this.codeInfo = codeInfo;
        this.wrappedInParentheses = wrappedInParentheses;
    }

    /**
     * Creates an unpositioned column reference.
     *
     * @param columnName the column name
     * @param relAlias the relation alias (may be null)
     */
    public ColumnValue(String columnName, String relAlias) {
        this(columnName, relAlias, null, false);
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the relation alias qualifying the column.
     *
     * @return the alias, or null if unqualified
     */
    public String relAlias() {
        return relAlias;
    }

    @Override
    public DataType dataType() {
        return NullType.get();
    }

    @Override
    public CodeInfo codeInfo() {
        return codeInfo;
    }

    @Override
    public boolean wrappedInParentheses() {
        return wrappedInParentheses;
    }

    @Override
    public String format() {
        String text = relAlias != null ? relAlias + "." + columnName : columnName;
        return wrappedInParentheses ? "(" + text + ")" : text;
    }

    @Override
    public String toString() {
        return format();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnValue)) return false;
        ColumnValue that = (ColumnValue) obj;
        return wrappedInParentheses == that.wrappedInParentheses &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(relAlias, that.relAlias) &&
               Objects.equals(codeInfo, that.codeInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, relAlias, codeInfo, wrappedInParentheses);
    }
}
