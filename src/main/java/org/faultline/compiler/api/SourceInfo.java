package org.faultline.compiler.api;

/**
 * A pure data class representing a position in the taxonomy source.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The logical name of the source the position belongs to.
 * @param lineNumber The one-based line number.
 * @param columnNumber The one-based column number, counted in UTF-16 {@code char}s.
 * @param startOffset The zero-based UTF-16 {@code char} offset of the first character.
 * @param endOffset The zero-based UTF-16 {@code char} offset just past the last character.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, int startOffset, int endOffset) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
