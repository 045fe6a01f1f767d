package org.faultline.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '#' character, starting an attribute. */
    HASH,
    /** '[' */
    LEFT_BRACKET,
    /** ']' */
    RIGHT_BRACKET,
    /** '{' */
    LEFT_BRACE,
    /** '}' */
    RIGHT_BRACE,
    /** '(' */
    LEFT_PAREN,
    /** ')' */
    RIGHT_PAREN,
    /** '&lt;', opening a generic argument list. */
    LESS,
    /** '&gt;', closing a generic argument list. */
    GREATER,
    /** ',' separating nodes, fields and attribute items. */
    COMMA,
    /** ':' between a field name and its type, and in type paths. */
    COLON,
    /** '=' between an attribute key and its value. */
    EQUALS,
    /** Any other punctuation that may appear inside a field type, such as '&amp;' or '.'. */
    SYMBOL,

    // Literals.
    /** An identifier, such as a variant, field or attribute name. */
    IDENTIFIER,
    /** An unsigned integer literal. */
    NUMBER,
    /** A string literal. */
    STRING,

    // Miscellaneous.
    /** Represents the end of the source. */
    END_OF_FILE
}
