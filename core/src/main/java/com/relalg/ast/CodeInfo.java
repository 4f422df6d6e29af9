package com.relalg.ast;

import java.util.Objects;

/**
 * Source position record attached by the parser to every AST node.
 *
 * <p>The translator copies it onto each produced tree node so that errors,
 * warnings and pretty-printing can point back into the query text.
 *
 * @param start where the node's text begins
 * @param end where the node's text ends (exclusive)
 * @param text the node's source text
 */
public record CodeInfo(SourceLocation start, SourceLocation end, String text) {

    public CodeInfo {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Creates code info for a single line of text starting at the given offset.
     *
     * @param text the source text
     * @param offset the zero-based offset of the text on line 1
     * @return the code info
     */
    public static CodeInfo of(String text, int offset) {
        return new CodeInfo(
            new SourceLocation(offset, 1, offset + 1),
            new SourceLocation(offset + text.length(), 1, offset + text.length() + 1),
            text);
    }

    @Override
    public String toString() {
        return "line " + start.line() + ", column " + start.column();
    }
}
