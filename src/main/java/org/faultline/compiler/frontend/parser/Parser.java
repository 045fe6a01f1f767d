package org.faultline.compiler.frontend.parser;

import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.FieldShape;
import org.faultline.compiler.api.ParseException;
import org.faultline.compiler.frontend.lexer.Token;
import org.faultline.compiler.frontend.lexer.TokenType;
import org.faultline.compiler.frontend.parser.ast.AttributeNode;
import org.faultline.compiler.frontend.parser.ast.ErrorTree;
import org.faultline.compiler.frontend.parser.ast.FieldNode;
import org.faultline.compiler.frontend.parser.ast.GroupNode;
import org.faultline.compiler.frontend.parser.ast.LeafNode;
import org.faultline.compiler.frontend.parser.ast.SpanField;
import org.faultline.compiler.frontend.parser.ast.TaxonomyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The parser for the taxonomy language. It consumes the tokens produced by the
 * {@link org.faultline.compiler.frontend.lexer.Lexer} and builds a {@link TaxonomyNode}.
 * <p>
 * Compiler attributes are captured verbatim; their keys and values are interpreted later by the
 * attribute resolver. The only attribute understood here is the span marker on fields.
 * There is no error recovery: the first syntax error ends parsing.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    static final String COMPILER_ATTRIBUTE = "diag";
    static final String SPAN_MARKER = "span";

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an end-of-file token.
     */
    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses the whole token stream as one taxonomy.
     * @return The parsed taxonomy.
     * @throws ParseException at the first syntax error.
     */
    public TaxonomyNode parse() throws ParseException {
        Attributes attributes = attributes();

        String visibility = "";
        if (check(TokenType.IDENTIFIER) && "pub".equals(peek().text()) && checkNext(TokenType.IDENTIFIER)) {
            visibility = advance().text();
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected taxonomy name.");
        String generics = check(TokenType.LESS) ? generics() : "";

        consume(TokenType.LEFT_BRACE, "Expected '{' after taxonomy name.");
        List<ErrorTree> roots = nodeList();
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close taxonomy '" + name.text() + "'.");

        if (!isAtEnd()) {
            throw error(peek(), "Unexpected input after taxonomy '" + name.text() + "': '" + peek().text() + "'.");
        }
        LOG.debug("Parsed taxonomy {} with {} top-level nodes", name.text(), roots.size());
        return new TaxonomyNode(name, visibility, generics, attributes.compiler, attributes.host, roots);
    }

    private List<ErrorTree> nodeList() throws ParseException {
        List<ErrorTree> nodes = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            nodes.add(node());
            if (!match(TokenType.COMMA)) {
                if (!check(TokenType.RIGHT_BRACE)) {
                    throw error(peek(), "Expected ',' or '}' after node, but got '" + peek().text() + "'.");
                }
                break;
            }
        }
        return nodes;
    }

    private ErrorTree node() throws ParseException {
        Attributes attributes = attributes();
        if (check(TokenType.IDENTIFIER)) {
            return leaf(attributes);
        }
        if (check(TokenType.LEFT_BRACE)) {
            Token open = advance();
            List<ErrorTree> children = nodeList();
            consume(TokenType.RIGHT_BRACE, "Expected '}' to close group.");
            return new GroupNode(open, attributes.compiler, attributes.host, children);
        }
        throw error(peek(), "Expected a variant name or '{', but got '" + peek().text() + "'.");
    }

    private LeafNode leaf(Attributes attributes) throws ParseException {
        Token identifier = advance();
        List<FieldNode> fields = new ArrayList<>();
        FieldShape shape;
        if (match(TokenType.LEFT_BRACE)) {
            fields = fieldList(TokenType.RIGHT_BRACE, true);
            shape = new FieldShape.Named(fields.stream().map(FieldNode::name).toList());
        } else if (match(TokenType.LEFT_PAREN)) {
            fields = fieldList(TokenType.RIGHT_PAREN, false);
            shape = new FieldShape.Positional(fields.size());
        } else {
            shape = FieldShape.Unit.INSTANCE;
        }

        SpanField spanField = null;
        for (int i = 0; i < fields.size(); i++) {
            FieldNode field = fields.get(i);
            if (field.spanMarked()) {
                if (spanField != null) {
                    throw new ParseException(CompilerErrorCode.DUPLICATE_SPAN_MARKER,
                            "Variant '" + identifier.text() + "' marks more than one field as span.", field.sourceInfo());
                }
                spanField = new SpanField(field.name() != null ? field.name() : "_" + i, i);
            }
        }
        return new LeafNode(identifier, attributes.compiler, attributes.host, shape, fields, spanField);
    }

    private List<FieldNode> fieldList(TokenType closing, boolean named) throws ParseException {
        List<FieldNode> fields = new ArrayList<>();
        while (!check(closing) && !isAtEnd()) {
            Token first = peek();
            boolean spanMarked = fieldAttributes();
            String name = null;
            if (named) {
                name = consume(TokenType.IDENTIFIER, "Expected field name.").text();
                consume(TokenType.COLON, "Expected ':' after field name '" + name + "'.");
            }
            String type = type(closing);
            fields.add(new FieldNode(name, type, spanMarked, first.sourceInfo()));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(closing, "Expected '" + (closing == TokenType.RIGHT_BRACE ? "}" : ")") + "' to close field list.");
        return fields;
    }

    private boolean fieldAttributes() throws ParseException {
        boolean spanMarked = false;
        Attributes attributes = attributes();
        for (AttributeNode attribute : attributes.compiler) {
            if (!SPAN_MARKER.equals(attribute.name()) || attribute.hasValue()) {
                throw new ParseException(CompilerErrorCode.UNKNOWN_FIELD_ATTRIBUTE,
                        "Unknown field attribute '" + attribute.name() + "'. Only 'span' is allowed on fields.",
                        attribute.sourceInfo());
            }
            if (spanMarked) {
                throw new ParseException(CompilerErrorCode.DUPLICATE_SPAN_MARKER,
                        "Field is marked as span more than once.", attribute.sourceInfo());
            }
            spanMarked = true;
        }
        return spanMarked;
    }

    /**
     * Captures a field type verbatim up to the next top-level ',' or the closing delimiter.
     */
    private String type(TokenType closing) throws ParseException {
        List<Token> parts = new ArrayList<>();
        int depth = 0;
        while (!isAtEnd()) {
            TokenType t = peek().type();
            if (depth == 0 && (t == TokenType.COMMA || t == closing)) {
                break;
            }
            if (t == TokenType.LESS || t == TokenType.LEFT_PAREN || t == TokenType.LEFT_BRACKET) {
                depth++;
            } else if (t == TokenType.GREATER || t == TokenType.RIGHT_PAREN || t == TokenType.RIGHT_BRACKET) {
                depth--;
                if (depth < 0) {
                    throw error(peek(), "Unbalanced '" + peek().text() + "' in field type.");
                }
            } else if (t == TokenType.LEFT_BRACE || t == TokenType.RIGHT_BRACE) {
                throw error(peek(), "Unexpected '" + peek().text() + "' in field type.");
            }
            parts.add(advance());
        }
        if (parts.isEmpty()) {
            throw error(peek(), "Expected a field type, but got '" + peek().text() + "'.");
        }
        if (depth != 0) {
            throw error(peek(), "Unclosed delimiter in field type.");
        }
        return joinTokens(parts);
    }

    private String generics() throws ParseException {
        List<Token> parts = new ArrayList<>();
        int depth = 0;
        do {
            Token t = advance();
            if (t.type() == TokenType.END_OF_FILE) {
                throw error(t, "Unclosed generic parameter list.");
            }
            if (t.type() == TokenType.LESS) depth++;
            if (t.type() == TokenType.GREATER) depth--;
            parts.add(t);
        } while (depth > 0);
        return joinTokens(parts);
    }

    private Attributes attributes() throws ParseException {
        Attributes attributes = new Attributes();
        while (match(TokenType.HASH)) {
            consume(TokenType.LEFT_BRACKET, "Expected '[' after '#'.");
            Token path = consume(TokenType.IDENTIFIER, "Expected attribute name after '#['.");
            if (COMPILER_ATTRIBUTE.equals(path.text())) {
                consume(TokenType.LEFT_PAREN, "Expected '(' after '" + COMPILER_ATTRIBUTE + "'.");
                do {
                    if (check(TokenType.RIGHT_PAREN)) {
                        break;
                    }
                    Token key = consume(TokenType.IDENTIFIER, "Expected attribute key.");
                    Token value = null;
                    if (match(TokenType.EQUALS)) {
                        if (!check(TokenType.STRING) && !check(TokenType.NUMBER)) {
                            throw error(peek(), "Expected a literal value for '" + key.text() + "', but got '" + peek().text() + "'.");
                        }
                        value = advance();
                    }
                    attributes.compiler.add(new AttributeNode(key, value));
                } while (match(TokenType.COMMA));
                consume(TokenType.RIGHT_PAREN, "Expected ')' to close attribute.");
                consume(TokenType.RIGHT_BRACKET, "Expected ']' to close attribute.");
            } else {
                attributes.host.add("#[" + path.text() + hostAttributeRest() + "]");
            }
        }
        return attributes;
    }

    private String hostAttributeRest() throws ParseException {
        List<Token> parts = new ArrayList<>();
        int depth = 0;
        while (depth > 0 || !check(TokenType.RIGHT_BRACKET)) {
            Token t = advance();
            if (t.type() == TokenType.END_OF_FILE) {
                throw error(t, "Unclosed attribute.");
            }
            if (t.type() == TokenType.LEFT_BRACKET) depth++;
            if (t.type() == TokenType.RIGHT_BRACKET) depth--;
            parts.add(t);
        }
        advance();
        return joinTokens(parts);
    }

    private static String joinTokens(List<Token> parts) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token t : parts) {
            if (prev != null && isWord(prev) && isWord(t)) {
                sb.append(' ');
            }
            sb.append(t.text());
            prev = t;
        }
        return sb.toString();
    }

    private static boolean isWord(Token t) {
        return t.type() == TokenType.IDENTIFIER || t.type() == TokenType.NUMBER || t.type() == TokenType.STRING;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token consume(TokenType type, String errorMessage) throws ParseException {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseException error(Token at, String message) {
        return new ParseException(CompilerErrorCode.UNEXPECTED_TOKEN, message, at.sourceInfo());
    }

    /**
     * Attributes read in front of a node, split by addressee.
     */
    private static final class Attributes {
        final List<AttributeNode> compiler = new ArrayList<>();
        final List<String> host = new ArrayList<>();
    }
}
