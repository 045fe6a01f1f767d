package org.faultline.compiler.frontend.lexer;

import org.faultline.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the taxonomy source by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param value The processed value of the token (the unescaped content of a string literal), or null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the source.
 * @param offset The zero-based offset of the first character of the token.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName,
        int offset
) {
    /**
     * @return The position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column, offset, offset + text.length());
    }
}
