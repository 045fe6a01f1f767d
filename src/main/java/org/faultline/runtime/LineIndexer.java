package org.faultline.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An {@link Indexer} that stores the end offset of every line, newline included.
 * <p>
 * The text is treated as if it ended with an implicit newline: the offset just past the last
 * character starts a final, empty line. Offsets beyond the text are clamped to that line.
 */
public final class LineIndexer implements Indexer {

    private final int[] lineEnds;

    /**
     * Indexes the given text.
     * @param text The source text.
     */
    public LineIndexer(String text) {
        List<Integer> ends = new ArrayList<>();
        int from = 0;
        int nl;
        while ((nl = text.indexOf('\n', from)) >= 0) {
            ends.add(nl + 1);
            from = nl + 1;
        }
        ends.add(text.length());
        this.lineEnds = ends.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public LineCol lineColAt(int pos) {
        int i = Arrays.binarySearch(lineEnds, pos);
        int line;
        int lineStart;
        if (i >= 0) {
            line = i + 1;
            lineStart = lineEnds[i];
        } else {
            int insertion = -i - 1;
            line = insertion;
            lineStart = insertion == 0 ? 0 : lineEnds[insertion - 1];
        }
        return new LineCol(line, pos - lineStart);
    }

    @Override
    public Bounds lineSpanAt(int pos) {
        int i = Arrays.binarySearch(lineEnds, pos);
        if (i >= 0) {
            return i + 1 == lineEnds.length
                    ? new Bounds(lineEnds[i], lineEnds[i])
                    : new Bounds(lineEnds[i], lineEnds[i + 1]);
        }
        int insertion = -i - 1;
        if (insertion == 0) {
            return new Bounds(0, lineEnds[0]);
        }
        if (insertion == lineEnds.length) {
            int last = lineEnds[insertion - 1];
            return new Bounds(last, last);
        }
        return new Bounds(lineEnds[insertion - 1], lineEnds[insertion]);
    }

    @Override
    public Bounds spanWithContextLines(int start, int end, int contextLinesBefore, int contextLinesAfter) {
        int from;
        if (contextLinesBefore == 0) {
            from = lineStartAt(start);
        } else {
            int firstLine = Math.max(0, lineAt(start) - contextLinesBefore);
            from = firstLine == 0 ? 0 : lineEnds[firstLine - 1];
        }
        int to;
        if (contextLinesAfter == 0) {
            to = lineSpanAt(end).end();
        } else {
            long lastLine = (long) lineAt(end) + contextLinesAfter;
            to = lineEnds[(int) Math.min(lastLine, lineEnds.length - 1)];
        }
        return new Bounds(from, to);
    }

    /**
     * @return The number of lines, the implicit final line included.
     */
    public int lineCount() {
        return lineEnds.length;
    }

    private int lineStartAt(int pos) {
        int i = Arrays.binarySearch(lineEnds, pos);
        if (i >= 0) {
            return lineEnds[i];
        }
        int insertion = -i - 1;
        return insertion == 0 ? 0 : lineEnds[insertion - 1];
    }

    private int lineAt(int pos) {
        int i = Arrays.binarySearch(lineEnds, pos);
        return i >= 0 ? i + 1 : -i - 1;
    }
}
