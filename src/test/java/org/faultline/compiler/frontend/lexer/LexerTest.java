package org.faultline.compiler.frontend.lexer;

import org.faultline.compiler.api.CompilerErrorCode;
import org.faultline.compiler.api.ParseException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link Lexer}.
 */
public class LexerTest {

    /**
     * A compiler attribute followed by a variant is split into its punctuation, keys and literals.
     */
    @Test
    @Tag("unit")
    void scansAttributeAndIdentifier() throws Exception {
        // Arrange
        Lexer lexer = new Lexer("#[diag(kind = \"Error\")] Foo");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.HASH, TokenType.LEFT_BRACKET, TokenType.IDENTIFIER, TokenType.LEFT_PAREN,
                TokenType.IDENTIFIER, TokenType.EQUALS, TokenType.STRING, TokenType.RIGHT_PAREN,
                TokenType.RIGHT_BRACKET, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        Token literal = tokens.get(6);
        assertThat(literal.text()).isEqualTo("\"Error\"");
        assertThat(literal.value()).isEqualTo("Error");
    }

    /**
     * Tokens remember their one-based line and column, and their offset in the source.
     */
    @Test
    @Tag("unit")
    void tracksLinesAndColumns() throws Exception {
        List<Token> tokens = new Lexer("A\n  B", "errors.fl").scanTokens();

        Token b = tokens.get(1);
        assertThat(b.text()).isEqualTo("B");
        assertThat(b.line()).isEqualTo(2);
        assertThat(b.column()).isEqualTo(3);
        assertThat(b.offset()).isEqualTo(4);
        assertThat(b.sourceInfo().toString()).isEqualTo("errors.fl:2:3");
    }

    /**
     * Line comments are skipped up to the end of the line.
     */
    @Test
    @Tag("unit")
    void skipsLineComments() throws Exception {
        List<Token> tokens = new Lexer("Foo // not a token\nBar").scanTokens();

        assertThat(tokens).extracting(Token::text).containsExactly("Foo", "Bar", "");
    }

    /**
     * Escape sequences are resolved in the value but kept in the text of a string token.
     */
    @Test
    @Tag("unit")
    void resolvesEscapesInStrings() throws Exception {
        List<Token> tokens = new Lexer("\"a\\\"b\\n{{}}\"").scanTokens();

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).value()).isEqualTo("a\"b\n{{}}");
    }

    /**
     * ASCII and braced Unicode escapes resolve to their characters, including supplementary ones.
     */
    @Test
    @Tag("unit")
    void resolvesHexAndUnicodeEscapes() throws Exception {
        List<Token> tokens = new Lexer("\"\\x41-\\u{e9}-\\u{1F600}\"").scanTokens();

        String expected = new StringBuilder("A-").appendCodePoint(0xE9).append('-').appendCodePoint(0x1F600).toString();
        assertThat(tokens.get(0).value()).isEqualTo(expected);
    }

    /**
     * Out-of-range or malformed hex and Unicode escapes are rejected.
     */
    @Test
    @Tag("unit")
    void rejectsMalformedHexAndUnicodeEscapes() {
        for (String literal : List.of("\"\\x80\"", "\"\\x4\"", "\"\\u41\"", "\"\\u{}\"",
                "\"\\u{1234567}\"", "\"\\u{D800}\"", "\"\\u{110000}\"")) {
            assertThatThrownBy(() -> new Lexer(literal).scanTokens())
                    .as(literal)
                    .isInstanceOf(ParseException.class)
                    .extracting(e -> ((ParseException) e).getErrorCode())
                    .isEqualTo(CompilerErrorCode.INVALID_ESCAPE);
        }
    }

    /**
     * Path separators and references inside field types become symbol tokens.
     */
    @Test
    @Tag("unit")
    void scansTypePunctuationAsSymbols() throws Exception {
        List<Token> tokens = new Lexer("&'static std::io::Error").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.SYMBOL, TokenType.SYMBOL, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.COLON, TokenType.COLON, TokenType.IDENTIFIER, TokenType.COLON, TokenType.COLON,
                TokenType.IDENTIFIER, TokenType.END_OF_FILE);
    }

    /**
     * A string without closing quote fails with its starting position.
     */
    @Test
    @Tag("unit")
    void rejectsUnterminatedString() {
        assertThatThrownBy(() -> new Lexer("Foo \"open").scanTokens())
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException pe = (ParseException) e;
                    assertThat(pe.getErrorCode()).isEqualTo(CompilerErrorCode.UNTERMINATED_STRING);
                    assertThat(pe.getSourceInfo().lineNumber()).isEqualTo(1);
                    assertThat(pe.getSourceInfo().columnNumber()).isEqualTo(5);
                });
    }

    /**
     * Unknown escape sequences are rejected.
     */
    @Test
    @Tag("unit")
    void rejectsInvalidEscape() {
        assertThatThrownBy(() -> new Lexer("\"\\q\"").scanTokens())
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.INVALID_ESCAPE);
    }

    /**
     * A character outside the language fails the scan at its position.
     */
    @Test
    @Tag("unit")
    void rejectsUnexpectedCharacter() {
        assertThatThrownBy(() -> new Lexer("Foo @").scanTokens())
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unexpected character: @")
                .satisfies(e -> assertThat(((ParseException) e).getSourceInfo().columnNumber()).isEqualTo(5));
    }
}
