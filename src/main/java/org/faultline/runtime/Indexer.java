package org.faultline.runtime;

/**
 * Maps character offsets of a source text to lines and columns.
 * Lines and columns are zero-based. Offsets and columns count UTF-16 {@code char}s, as
 * {@link String#charAt(int)} does, so a supplementary character occupies two positions.
 */
public interface Indexer {

    /**
     * @param pos A character offset.
     * @return The line and column of the offset.
     */
    LineCol lineColAt(int pos);

    /**
     * @param pos A character offset.
     * @return The start and end offset of the line containing {@code pos}, trailing newline included.
     */
    Bounds lineSpanAt(int pos);

    /**
     * Widens a range to whole lines, plus the requested number of lines before and after it.
     * Where fewer lines exist, as many as possible are included.
     *
     * @param start The start offset of the range.
     * @param end The end offset of the range.
     * @param contextLinesBefore Number of extra lines before the range.
     * @param contextLinesAfter Number of extra lines after the range.
     * @return The widened range.
     */
    Bounds spanWithContextLines(int start, int end, int contextLinesBefore, int contextLinesAfter);

    /**
     * A zero-based line and column.
     * @param line The line.
     * @param column The column.
     */
    record LineCol(int line, int column) {}

    /**
     * A range of character offsets.
     * @param start The first offset.
     * @param end The offset just past the range.
     */
    record Bounds(int start, int end) {}
}
