package org.faultline.runtime;

/**
 * A range of a source text, together with the text itself and where it came from.
 * Offsets are UTF-16 {@code char} indices into {@link #sourceText()}.
 */
public interface Span {

    /**
     * @return The offset of the first character.
     */
    int start();

    /**
     * @return The offset just past the last character.
     */
    int end();

    /**
     * @return The identifier of the source, e.g. a file path.
     */
    String uri();

    /**
     * @return The complete source text the span points into.
     */
    String sourceText();

    /**
     * @return The line index of {@link #sourceText()}.
     */
    Indexer sourceIndex();

    /**
     * @return The text covered by the span, clamped to the source.
     */
    default String text() {
        String source = sourceText();
        int from = Math.min(start(), source.length());
        int to = Math.max(from, Math.min(end(), source.length()));
        return source.substring(from, to);
    }
}
