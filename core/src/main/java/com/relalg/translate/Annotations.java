package com.relalg.translate;

import com.relalg.ast.AstInfo;
import com.relalg.ast.CodeInfo;
import com.relalg.exception.InternalTranslationException;
import com.relalg.logical.LogicalPlan;
import com.relalg.logical.NodeHeader;
import java.util.Map;

/**
 * The annotate step shared by both translators: copies source position,
 * metadata and parenthesization from an AST node onto the tree node built for it.
 */
final class Annotations {

    private Annotations() {} // Utility class

    /**
     * Applies all AST annotations to a tree node.
     *
     * @param node the tree node
     * @param info the annotations of the AST node it was built from
     * @param <T> the node type
     * @return the node, for chaining
     * @throws InternalTranslationException if the AST node has no source position
     */
    static <T extends LogicalPlan> T annotate(T node, AstInfo info) {
        NodeHeader header = node.header();
        header.setCodeInfo(requireCodeInfo(info, node));

        for (Map.Entry<String, Object> entry : info.metaData().entrySet()) {
            header.setMetaData(entry.getKey(), entry.getValue());
        }

        if (info.wrappedInParentheses()) {
            header.setWrappedInParentheses(true);
        }
        return node;
    }

    /**
     * Sets only the source position of a tree node.
     *
     * @param node the tree node
     * @param info the annotations carrying the position
     * @param <T> the node type
     * @return the node, for chaining
     * @throws InternalTranslationException if there is no source position
     */
    static <T extends LogicalPlan> T position(T node, AstInfo info) {
        node.header().setCodeInfo(requireCodeInfo(info, node));
        return node;
    }

    /**
     * Returns the source position of an AST node, which well-formed parser
     * output always has.
     *
     * @param info the AST annotations
     * @param target what the position is needed for, for the error message
     * @return the code info
     * @throws InternalTranslationException if the position is missing
     */
    static CodeInfo requireCodeInfo(AstInfo info, Object target) {
        if (info == null || info.codeInfo() == null) {
            throw new InternalTranslationException("AST node without source position (building " + target + ")");
        }
        return info.codeInfo();
    }
}
