package com.relalg.logical;

import com.relalg.ast.CodeInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Annotations shared by every operator-tree node: source position, metadata,
 * warnings and the parenthesization flag.
 *
 * <p>The translator fills in position, metadata and parenthesization once while
 * building a node. Warnings may be appended later.
 */
public final class NodeHeader {

    private CodeInfo codeInfo;
    private boolean wrappedInParentheses;
    private final Map<String, Object> metaData = new LinkedHashMap<>();
    private final List<Warning> warnings = new ArrayList<>();

    NodeHeader() {
    }

    /**
     * Returns the source position of the node.
     *
     * @return the code info, or null if not yet annotated
     */
    public CodeInfo codeInfo() {
        return codeInfo;
    }

    public void setCodeInfo(CodeInfo codeInfo) {
        this.codeInfo = codeInfo;
    }

    public boolean wrappedInParentheses() {
        return wrappedInParentheses;
    }

    public void setWrappedInParentheses(boolean wrappedInParentheses) {
        this.wrappedInParentheses = wrappedInParentheses;
    }

    /**
     * Returns the metadata of the node.
     *
     * @return an unmodifiable view of the metadata, in insertion order
     */
    public Map<String, Object> metaData() {
        return Collections.unmodifiableMap(metaData);
    }

    /**
     * Returns one metadata value.
     *
     * @param key the metadata key
     * @return the value, or null if absent
     */
    public Object metaData(String key) {
        return metaData.get(key);
    }

    public void setMetaData(String key, Object value) {
        metaData.put(key, value);
    }

    /**
     * Returns the advisory warnings attached to the node.
     *
     * @return an unmodifiable view of the warnings, oldest first
     */
    public List<Warning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Appends an advisory warning.
     *
     * @param messageKey the message key of the warning
     * @param codeInfo the source position the warning refers to
     */
    public void addWarning(String messageKey, CodeInfo codeInfo) {
        warnings.add(new Warning(messageKey, codeInfo));
    }

    /**
     * Copies position, flag, metadata and warnings from another header.
     *
     * @param other the header to copy
     */
    void copyFrom(NodeHeader other) {
        this.codeInfo = other.codeInfo;
        this.wrappedInParentheses = other.wrappedInParentheses;
        this.metaData.putAll(other.metaData);
        this.warnings.addAll(other.warnings);
    }
}
