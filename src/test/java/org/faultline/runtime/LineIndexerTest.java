package org.faultline.runtime;

import org.faultline.runtime.Indexer.Bounds;
import org.faultline.runtime.Indexer.LineCol;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LineIndexer}.
 */
public class LineIndexerTest {

    private static final String TEXT = "Hello\nWorld\nThis is a test.";

    private final LineIndexer indexer = new LineIndexer(TEXT);

    /**
     * Offsets map to zero-based lines and columns; the offset past the text starts an implicit empty line.
     */
    @Test
    @Tag("unit")
    void mapsOffsetsToLinesAndColumns() {
        assertThat(indexer.lineColAt(0)).isEqualTo(new LineCol(0, 0));
        assertThat(indexer.lineColAt(3)).isEqualTo(new LineCol(0, 3));
        assertThat(indexer.lineColAt(6)).isEqualTo(new LineCol(1, 0));
        assertThat(indexer.lineColAt(11)).isEqualTo(new LineCol(1, 5));
        assertThat(indexer.lineColAt(12)).isEqualTo(new LineCol(2, 0));
        assertThat(indexer.lineColAt(21)).isEqualTo(new LineCol(2, 9));
        assertThat(indexer.lineColAt(26)).isEqualTo(new LineCol(2, 14));
        assertThat(indexer.lineColAt(27)).isEqualTo(new LineCol(3, 0));
        assertThat(indexer.lineColAt(30)).isEqualTo(new LineCol(3, 3));
        assertThat(indexer.lineCount()).isEqualTo(4);
    }

    /**
     * The line span includes the trailing newline; offsets at or beyond the end yield an empty span.
     */
    @Test
    @Tag("unit")
    void returnsLineSpans() {
        assertThat(indexer.lineSpanAt(0)).isEqualTo(new Bounds(0, 6));
        assertThat(indexer.lineSpanAt(3)).isEqualTo(new Bounds(0, 6));
        assertThat(indexer.lineSpanAt(6)).isEqualTo(new Bounds(6, 12));
        assertThat(indexer.lineSpanAt(11)).isEqualTo(new Bounds(6, 12));
        assertThat(indexer.lineSpanAt(12)).isEqualTo(new Bounds(12, 27));
        assertThat(indexer.lineSpanAt(21)).isEqualTo(new Bounds(12, 27));
        assertThat(indexer.lineSpanAt(26)).isEqualTo(new Bounds(12, 27));
        assertThat(indexer.lineSpanAt(27)).isEqualTo(new Bounds(27, 27));
        assertThat(indexer.lineSpanAt(30)).isEqualTo(new Bounds(27, 27));
    }

    /**
     * Context lines widen the range and are clamped at both ends of the text.
     */
    @Test
    @Tag("unit")
    void widensRangeByContextLines() {
        assertThat(indexer.spanWithContextLines(7, 11, 0, 0)).isEqualTo(new Bounds(6, 12));
        assertThat(indexer.spanWithContextLines(7, 11, 1, 0)).isEqualTo(new Bounds(0, 12));
        assertThat(indexer.spanWithContextLines(7, 11, 2, 2)).isEqualTo(new Bounds(0, 27));
        assertThat(indexer.spanWithContextLines(0, 5, 1, 1)).isEqualTo(new Bounds(0, 12));
        assertThat(indexer.spanWithContextLines(0, 5, 2, 2)).isEqualTo(new Bounds(0, 27));
        assertThat(indexer.spanWithContextLines(22, 26, 1, 1)).isEqualTo(new Bounds(6, 27));
        assertThat(indexer.spanWithContextLines(22, 26, 2, 2)).isEqualTo(new Bounds(0, 27));
    }

    /**
     * An empty text has a single empty line.
     */
    @Test
    @Tag("unit")
    void indexesEmptyText() {
        LineIndexer empty = new LineIndexer("");

        assertThat(empty.lineCount()).isEqualTo(1);
        assertThat(empty.lineColAt(0)).isEqualTo(new LineCol(0, 0));
        assertThat(empty.lineSpanAt(0)).isEqualTo(new Bounds(0, 0));
    }

    /**
     * Offsets count UTF-16 chars: an accented letter takes one position, an emoji two.
     */
    @Test
    @Tag("unit")
    void countsOffsetsInChars() {
        String text = "h\u00e9llo\n" + new String(Character.toChars(0x1F600)) + "x";
        LineIndexer unicode = new LineIndexer(text);
        SimpleSpan emoji = new SimpleSpan("u", text, 6, 8);

        assertThat(unicode.lineColAt(2)).isEqualTo(new LineCol(0, 2));
        assertThat(unicode.lineSpanAt(0)).isEqualTo(new Bounds(0, 6));
        assertThat(unicode.lineColAt(8)).isEqualTo(new LineCol(1, 2));
        assertThat(emoji.text()).isEqualTo(new String(Character.toChars(0x1F600)));
    }
}
