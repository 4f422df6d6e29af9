package com.relalg.logical;

import com.relalg.ast.CodeInfo;
import java.util.Objects;

/**
 * A non-fatal diagnostic attached to a node. Warnings never change the tree;
 * a renderer resolves the key and shows the text next to the result.
 *
 * @param messageKey the message key
 * @param codeInfo the source position the warning refers to
 */
public record Warning(String messageKey, CodeInfo codeInfo) {

    public Warning {
        Objects.requireNonNull(messageKey, "messageKey must not be null");
    }
}
