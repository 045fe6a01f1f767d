package org.faultline.compiler.frontend.resolve;

import org.faultline.compiler.api.AttributeException;
import org.faultline.compiler.api.CompilationException;
import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.frontend.lexer.TokenType;
import org.faultline.compiler.frontend.parser.ast.AttributeNode;
import org.faultline.compiler.frontend.parser.ast.ErrorTree;
import org.faultline.compiler.frontend.parser.ast.GroupNode;
import org.faultline.compiler.frontend.parser.ast.LeafNode;
import org.faultline.compiler.frontend.parser.ast.SpanField;
import org.faultline.compiler.frontend.parser.ast.TaxonomyNode;
import org.faultline.compiler.frontend.template.TemplateSource;
import org.faultline.runtime.Severity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Walks a taxonomy depth-first in declaration order and resolves the attributes of every node.
 * <p>
 * The walk is pull-based and keeps an explicit stack of (remaining siblings, inherited configuration)
 * frames instead of recursing, so nesting depth is not limited by the call stack. Visiting a node
 * merges its own attributes onto the configuration inherited from its parent. A group pushes a frame
 * for its children; a leaf pushes nothing. The first attribute error ends the walk and discards the stack.
 * <p>
 * Merge rules:
 * <ul>
 *     <li>{@code kind}: the nearest declaration wins.</li>
 *     <li>{@code number}: fragments are appended, root first.</li>
 *     <li>{@code msg}, {@code label}: the nearest declaration wins.</li>
 *     <li>{@code nested}: applies to the marked node only, never inherited.</li>
 * </ul>
 * Leaves with identical codes are not rejected here.
 */
public class AttributeResolver {

    static final String KIND = "kind";
    static final String NUMBER = "number";
    static final String MSG = "msg";
    static final String LABEL = "label";
    static final String NESTED = "nested";

    private final Deque<Frame> stack = new ArrayDeque<>();
    private final NodeConfig rootConfig;

    /**
     * Starts a walk over the given taxonomy.
     * @param taxonomy The parsed taxonomy.
     * @throws AttributeException if the root attributes are invalid.
     */
    public AttributeResolver(TaxonomyNode taxonomy) throws AttributeException {
        this.rootConfig = merge(NodeConfig.initial(), taxonomy.attributes(), null);
        stack.push(new Frame(taxonomy.roots().iterator(), rootConfig));
    }

    /**
     * @return The configuration resolved from the root attributes alone.
     */
    public NodeConfig rootConfig() {
        return rootConfig;
    }

    /**
     * @return Whether another node remains to be visited.
     */
    public boolean hasNext() {
        while (!stack.isEmpty() && !stack.peek().siblings().hasNext()) {
            stack.pop();
        }
        return !stack.isEmpty();
    }

    /**
     * Resolves the next node in pre-order.
     * @return The next node with its configuration, or null when the walk is complete.
     * @throws AttributeException if the node's attributes are invalid. The walk cannot continue afterwards.
     */
    public ResolvedNode next() throws AttributeException {
        if (!hasNext()) {
            return null;
        }
        Frame frame = stack.peek();
        ErrorTree node = frame.siblings().next();
        NodeConfig config;
        try {
            SpanField spanField = node instanceof LeafNode leaf ? leaf.spanField() : null;
            config = merge(frame.inherited(), node.attributes(), spanField);
        } catch (AttributeException e) {
            stack.clear();
            throw e;
        }
        if (node instanceof GroupNode group) {
            stack.push(new Frame(group.children().iterator(), config));
        }
        return new ResolvedNode(config, node);
    }

    /**
     * Resolves the next leaf in pre-order, passing over groups.
     * @return The next leaf with its configuration, or null when no leaf remains.
     * @throws AttributeException if a node on the way has invalid attributes.
     */
    public ResolvedNode nextLeaf() throws AttributeException {
        ResolvedNode node;
        while ((node = next()) != null) {
            if (node.isLeaf()) {
                return node;
            }
        }
        return null;
    }

    /**
     * Feeds every remaining node to a visitor, in pre-order.
     * @param visitor The visitor.
     * @throws CompilationException the first attribute error, or whatever the visitor throws.
     */
    public void forEach(NodeVisitor visitor) throws CompilationException {
        ResolvedNode node;
        while ((node = next()) != null) {
            visitor.visit(node);
        }
    }

    /**
     * Resolves every remaining node.
     * @return All nodes with their configurations, in pre-order.
     * @throws AttributeException the first attribute error.
     */
    public List<ResolvedNode> resolveAll() throws AttributeException {
        List<ResolvedNode> nodes = new ArrayList<>();
        ResolvedNode node;
        while ((node = next()) != null) {
            nodes.add(node);
        }
        return nodes;
    }

    /**
     * Derives the configuration of a node from the one it inherits.
     *
     * @param inherited The parent's configuration.
     * @param attributes The node's own attributes, in declaration order.
     * @param spanField The span-carrying field if the node is a leaf, or null.
     * @return A new configuration; {@code inherited} is left untouched.
     * @throws AttributeException at the first unknown key or malformed value.
     */
    static NodeConfig merge(NodeConfig inherited, List<AttributeNode> attributes, SpanField spanField) throws AttributeException {
        Severity kind = inherited.kind();
        StringBuilder number = new StringBuilder(inherited.number());
        TemplateSource msg = inherited.msg();
        TemplateSource ownMsg = null;
        TemplateSource label = inherited.label();
        // Not inherited.
        boolean nested = false;

        for (AttributeNode attribute : attributes) {
            switch (attribute.name()) {
                case KIND -> kind = severity(attribute);
                case NUMBER -> number.append(numberFragment(attribute));
                case MSG -> {
                    ownMsg = template(attribute);
                    msg = ownMsg;
                }
                case LABEL -> label = template(attribute);
                case NESTED -> {
                    if (attribute.hasValue()) {
                        throw new AttributeException(CompilerErrorCode.UNEXPECTED_ATTRIBUTE_VALUE,
                                "'nested' is a flag and takes no value.", attribute.sourceInfo());
                    }
                    nested = true;
                }
                default -> throw new AttributeException(CompilerErrorCode.UNKNOWN_ATTRIBUTE_KEY,
                        "Unknown attribute key '" + attribute.name() + "'.", attribute.sourceInfo());
            }
        }
        return new NodeConfig(kind, number.toString(), msg, ownMsg, label, spanField, inherited.depth() + 1, nested);
    }

    private static Severity severity(AttributeNode attribute) throws AttributeException {
        String literal = stringValue(attribute);
        Severity severity = Severity.fromLiteral(literal);
        if (severity == null) {
            throw new AttributeException(CompilerErrorCode.INVALID_KIND,
                    "Kind must be either `Error` or `Warn`, but was \"" + literal + "\".", attribute.sourceInfo());
        }
        return severity;
    }

    private static String numberFragment(AttributeNode attribute) throws AttributeException {
        requireValue(attribute);
        String fragment = attribute.value().type() == TokenType.NUMBER
                ? attribute.value().text()
                : (String) attribute.value().value();
        for (int i = 0; i < fragment.length(); i++) {
            char c = fragment.charAt(i);
            if (c < '0' || c > '9') {
                throw new AttributeException(CompilerErrorCode.INVALID_NUMBER,
                        "Number fragment must consist of digits, but was \"" + fragment + "\".", attribute.sourceInfo());
            }
        }
        return fragment;
    }

    private static TemplateSource template(AttributeNode attribute) throws AttributeException {
        return new TemplateSource(stringValue(attribute), attribute.value().sourceInfo());
    }

    private static String stringValue(AttributeNode attribute) throws AttributeException {
        requireValue(attribute);
        if (attribute.value().type() != TokenType.STRING) {
            throw new AttributeException(CompilerErrorCode.INVALID_ATTRIBUTE_VALUE,
                    "'" + attribute.name() + "' expects a string literal, but got " + attribute.value().text() + ".",
                    attribute.sourceInfo());
        }
        return (String) attribute.value().value();
    }

    private static void requireValue(AttributeNode attribute) throws AttributeException {
        if (!attribute.hasValue()) {
            throw new AttributeException(CompilerErrorCode.MISSING_ATTRIBUTE_VALUE,
                    "'" + attribute.name() + "' requires a value, e.g. #[diag(" + attribute.name() + " = \"...\")].",
                    attribute.sourceInfo());
        }
    }

    private record Frame(Iterator<ErrorTree> siblings, NodeConfig inherited) {}
}
