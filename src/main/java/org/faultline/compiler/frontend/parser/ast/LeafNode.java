package org.faultline.compiler.frontend.parser.ast;

import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.SourceInfo;
import org.faultline.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A leaf of the taxonomy, declaring one variant.
 *
 * @param identifier The token of the variant name.
 * @param attributes The compiler attributes of the variant.
 * @param hostAttributes Other attributes of the variant, verbatim.
 * @param shape The public field shape, with the span marker stripped.
 * @param fields The fields in declaration order.
 * @param spanField The span-carrying field, or null.
 */
public record LeafNode(
        Token identifier,
        List<AttributeNode> attributes,
        List<String> hostAttributes,
        FieldShape shape,
        List<FieldNode> fields,
        SpanField spanField
) implements ErrorTree {

    /**
     * @return The variant name.
     */
    public String name() {
        return identifier.text();
    }

    /**
     * @return The declared field types, in field order.
     */
    public List<String> fieldTypes() {
        return fields.stream().map(FieldNode::type).toList();
    }

    @Override
    public SourceInfo sourceInfo() {
        return identifier.sourceInfo();
    }
}
