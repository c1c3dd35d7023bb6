package org.learningjava.reorderfields.domain.model.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One file of the source corpus: its path (used as the file identity in ranges and plans)
 * and its full text. Lines and columns are 1-based and counted in chars.
 */
public final class SourceFile {

    private final String path;
    private final String content;
    private final int[] lineStarts;

    public SourceFile(String path, String content) {
        this.path = Objects.requireNonNull(path, "path");
        this.content = Objects.requireNonNull(content, "content");
        this.lineStarts = computeLineStarts(content);
    }

    public String path() {
        return path;
    }

    public String content() {
        return content;
    }

    public int length() {
        return content.length();
    }

    public String text(SourceRange range) {
        if (!path.equals(range.file())) {
            throw new IllegalArgumentException("Range " + range + " does not belong to " + path);
        }
        return content.substring(range.begin(), range.end());
    }

    public int line(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    public int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }

    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Offset of the newline that ends the logical line containing {@code offset}, following
     * backslash continuations; the file length when the last line has no newline.
     */
    public int logicalLineEnd(int offset) {
        int i = offset;
        while (i < content.length()) {
            int nl = content.indexOf('\n', i);
            if (nl < 0) {
                return content.length();
            }
            int before = nl - 1;
            if (before >= 0 && content.charAt(before) == '\r') {
                before--;
            }
            if (before >= offset && content.charAt(before) == '\\') {
                i = nl + 1;
                continue;
            }
            return nl;
        }
        return content.length();
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceFile other)) return false;
        return path.equals(other.path) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, content);
    }

    @Override
    public String toString() {
        return "SourceFile[" + path + ", " + content.length() + " chars]";
    }
}
