package com.relalg.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Annotations every AST node carries, regardless of the grammar it came from.
 *
 * <p>{@code codeInfo} is mandatory for well-formed input; the record accepts null
 * so that a defective parser output can be detected by the translator instead of
 * failing while the AST is being built.
 *
 * @param codeInfo the source position (null only for defective input)
 * @param wrappedInParentheses whether the node was written inside parentheses
 * @param metaData key/value pairs to copy onto the produced tree node
 */
public record AstInfo(CodeInfo codeInfo, boolean wrappedInParentheses, Map<String, Object> metaData) {

    public AstInfo {
        metaData = metaData == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metaData));
    }

    public static AstInfo of(CodeInfo codeInfo) {
        return new AstInfo(codeInfo, false, null);
    }

    public static AstInfo parenthesized(CodeInfo codeInfo) {
        return new AstInfo(codeInfo, true, null);
    }

    /**
     * Returns a copy of this info with an additional metadata entry.
     *
     * @param key the metadata key
     * @param value the metadata value
     * @return the extended info
     */
    public AstInfo withMetaData(String key, Object value) {
        Map<String, Object> extended = new LinkedHashMap<>(metaData);
        extended.put(key, value);
        return new AstInfo(codeInfo, wrappedInParentheses, extended);
    }
}
