package com.relalg.ast;

/**
 * A position within the query text.
 *
 * @param offset zero-based character offset
 * @param line one-based line number
 * @param column one-based column number
 */
public record SourceLocation(int offset, int line, int column) {
}
