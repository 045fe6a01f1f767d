package org.faultline.runtime;

import java.util.Objects;

/**
 * A self-contained {@link Span} that owns its source text and line index.
 */
public final class SimpleSpan implements Span {

    /** The span used when no location is known: empty uri, empty source, offsets 0. */
    public static final SimpleSpan EMPTY = new SimpleSpan("", "", 0, 0);

    private final String uri;
    private final String source;
    private final LineIndexer indexer;
    private final int start;
    private final int end;

    /**
     * @param uri The identifier of the source.
     * @param source The source text.
     * @param start The offset of the first character.
     * @param end The offset just past the last character.
     */
    public SimpleSpan(String uri, String source, int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span range " + start + ".." + end);
        }
        this.uri = Objects.requireNonNull(uri, "uri");
        this.source = Objects.requireNonNull(source, "source");
        this.indexer = new LineIndexer(source);
        this.start = start;
        this.end = end;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int end() {
        return end;
    }

    @Override
    public String uri() {
        return uri;
    }

    @Override
    public String sourceText() {
        return source;
    }

    @Override
    public Indexer sourceIndex() {
        return indexer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleSpan other)) return false;
        return start == other.start && end == other.end && uri.equals(other.uri) && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri, source, start, end);
    }

    @Override
    public String toString() {
        return uri + "[" + start + ".." + end + "]";
    }
}
