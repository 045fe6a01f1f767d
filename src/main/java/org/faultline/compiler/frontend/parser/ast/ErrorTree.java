package org.faultline.compiler.frontend.parser.ast;

import org.faultline.compiler.api.SourceInfo;

import java.util.List;

/**
 * A node of the error taxonomy: either a group contributing inherited attributes,
 * or a leaf declaring one concrete variant.
 */
public sealed interface ErrorTree permits GroupNode, LeafNode {

    /**
     * @return The compiler attributes written in front of the node, unmerged and in order.
     */
    List<AttributeNode> attributes();

    /**
     * @return Attributes addressed to the host type rather than to the compiler.
     */
    List<String> hostAttributes();

    /**
     * @return The position of the node.
     */
    SourceInfo sourceInfo();
}
