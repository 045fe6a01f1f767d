package org.faultline.compiler.frontend.parser.ast;

import org.faultline.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The root of a parsed taxonomy: its name, root attributes and top-level nodes.
 *
 * @param name The token of the taxonomy name.
 * @param visibility The visibility keyword, or an empty string.
 * @param generics The generic parameter list as written, or an empty string.
 * @param attributes The root compiler attributes.
 * @param hostAttributes Other attributes of the taxonomy, verbatim.
 * @param roots The top-level nodes in declaration order.
 */
public record TaxonomyNode(
        Token name,
        String visibility,
        String generics,
        List<AttributeNode> attributes,
        List<String> hostAttributes,
        List<ErrorTree> roots
) {}
