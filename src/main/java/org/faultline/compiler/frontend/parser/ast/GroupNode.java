package org.faultline.compiler.frontend.parser.ast;

import org.faultline.compiler.api.SourceInfo;
import org.faultline.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An interior node of the taxonomy. Its attributes are inherited by every descendant.
 *
 * @param openBrace The token of the opening brace.
 * @param attributes The compiler attributes of the group.
 * @param hostAttributes Other attributes of the group, verbatim.
 * @param children The child nodes in declaration order.
 */
public record GroupNode(
        Token openBrace,
        List<AttributeNode> attributes,
        List<String> hostAttributes,
        List<ErrorTree> children
) implements ErrorTree {

    @Override
    public SourceInfo sourceInfo() {
        return openBrace.sourceInfo();
    }
}
