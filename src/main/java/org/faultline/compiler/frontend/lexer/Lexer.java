package org.faultline.compiler.frontend.lexer;

import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.ParseException;
import org.faultline.compiler.api.SourceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer converts taxonomy source text into a sequence of tokens.
 * Scanning stops at the first malformed character sequence.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     * @throws ParseException at the first character sequence that is not a valid token.
     */
    public List<Token> scanTokens() throws ParseException {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName, current));
        LOG.debug("Scanned {} tokens from {}", tokens.size(), logicalFileName);
        return tokens;
    }

    private void scanToken() throws ParseException {
        char c = advance();
        switch (c) {
            case '#': addToken(TokenType.HASH); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '<': addToken(TokenType.LESS); break;
            case '>': addToken(TokenType.GREATER); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '=': addToken(TokenType.EQUALS); break;
            case '"': string(); break;
            case '/':
                if (peek() == '/') {
                    // A comment goes until the end of the line; doc comments included.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.SYMBOL);
                }
                break;
            case '&', '\'', '*', '.', '!', '?', ';', '+', '-':
                addToken(TokenType.SYMBOL);
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                newLine();
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        addToken(TokenType.NUMBER);
    }

    private void string() throws ParseException {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                newLine();
                value.append(c);
            } else if (c == '\\') {
                value.append(escape());
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            throw error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string.");
        }

        // The closing "
        advance();
        // The text of the token is the string *with* quotes, the value is the content.
        addToken(TokenType.STRING, value.toString());
    }

    private String escape() throws ParseException {
        if (isAtEnd()) {
            throw error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string.");
        }
        char e = advance();
        return switch (e) {
            case '"' -> "\"";
            case '\\' -> "\\";
            case '\'' -> "'";
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case '0' -> "\0";
            case 'x' -> asciiEscape();
            case 'u' -> unicodeEscape();
            default -> throw error(CompilerErrorCode.INVALID_ESCAPE, "Invalid escape sequence: \\" + e);
        };
    }

    /** ASCII escape: exactly two hex digits, at most {@code 7F}. */
    private String asciiEscape() throws ParseException {
        int value = 0;
        for (int i = 0; i < 2; i++) {
            int digit = isAtEnd() ? -1 : Character.digit(peek(), 16);
            if (digit < 0) {
                throw error(CompilerErrorCode.INVALID_ESCAPE, "Expected two hex digits after \\x.");
            }
            advance();
            value = value * 16 + digit;
        }
        if (value > 0x7F) {
            throw error(CompilerErrorCode.INVALID_ESCAPE, "\\x escape must be at most 7F, but was " + Integer.toHexString(value).toUpperCase() + ".");
        }
        return String.valueOf((char) value);
    }

    /** Braced Unicode escape: one to six hex digits naming a Unicode scalar value. */
    private String unicodeEscape() throws ParseException {
        if (peek() != '{') {
            throw error(CompilerErrorCode.INVALID_ESCAPE, "Expected '{' after \\u.");
        }
        advance();
        int value = 0;
        int digits = 0;
        while (!isAtEnd() && peek() != '}') {
            int digit = Character.digit(peek(), 16);
            if (digit < 0 || ++digits > 6) {
                throw error(CompilerErrorCode.INVALID_ESCAPE, "Expected one to six hex digits in \\u{...}.");
            }
            advance();
            value = value * 16 + digit;
        }
        if (isAtEnd() || digits == 0) {
            throw error(CompilerErrorCode.INVALID_ESCAPE, "Expected one to six hex digits in \\u{...}.");
        }
        // The closing }
        advance();
        if (value > Character.MAX_CODE_POINT || (value >= Character.MIN_SURROGATE && value <= Character.MAX_SURROGATE)) {
            throw error(CompilerErrorCode.INVALID_ESCAPE, "\\u{" + Integer.toHexString(value).toUpperCase() + "} is not a Unicode scalar value.");
        }
        return new String(Character.toChars(value));
    }

    private ParseException error(CompilerErrorCode code, String message) {
        SourceInfo where = new SourceInfo(logicalFileName, tokenLine, tokenColumn, start, current);
        return new ParseException(code, message, where);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn, logicalFileName, start));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || c == '$';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
