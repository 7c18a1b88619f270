package org.learningjava.hpes.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Normalized text of one ingested file plus its line-offset index.
 * Line endings are already folded to {@code \n}; lines are 1-based.
 */
public final class SourceDocument {

    private final String sourceFileId;
    private final String text;
    private final int[] lineStarts;

    public SourceDocument(String sourceFileId, String text) {
        this.sourceFileId = Objects.requireNonNull(sourceFileId, "sourceFileId");
        this.text = Objects.requireNonNull(text, "text");
        this.lineStarts = indexLines(text);
    }

    private static int[] indexLines(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public String sourceFileId() {
        return sourceFileId;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** 1-based line containing {@code offset}; the end offset maps to the last line. */
    public int lineOf(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside [0, " + text.length() + "]");
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    /** Offset of the first character of a 1-based line. */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /** Offset just past the last character of a 1-based line, excluding its {@code \n}. */
    public int lineEnd(int line) {
        return line < lineStarts.length ? lineStarts[line] - 1 : text.length();
    }

    public String line(int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }

    public String slice(TextSpan span) {
        return text.substring(span.start(), span.end());
    }

    public TextSpan fullSpan() {
        return new TextSpan(0, text.length());
    }

    public int startLine(TextSpan span) {
        return lineOf(span.start());
    }

    public int endLine(TextSpan span) {
        return span.isEmpty() ? lineOf(span.start()) : lineOf(span.end() - 1);
    }
}
