package org.faultline.compiler.frontend.resolve;

import org.faultline.compiler.frontend.parser.ast.ErrorTree;
import org.faultline.compiler.frontend.parser.ast.LeafNode;

/**
 * A node of the taxonomy paired with its resolved configuration.
 *
 * @param config The configuration after inheritance.
 * @param node The group or leaf.
 */
public record ResolvedNode(NodeConfig config, ErrorTree node) {

    /**
     * @return Whether the node declares a variant.
     */
    public boolean isLeaf() {
        return node instanceof LeafNode;
    }
}
