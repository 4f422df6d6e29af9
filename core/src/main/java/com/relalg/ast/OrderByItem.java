package com.relalg.ast;

/**
 * One ORDER BY entry.
 *
 * @param col the column to sort by
 * @param asc true for ascending, false for descending order
 */
public record OrderByItem(ColumnName col, boolean asc) {
}
