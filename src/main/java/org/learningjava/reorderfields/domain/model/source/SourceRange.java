package org.learningjava.reorderfields.domain.model.source;

/**
 * Half-open char range {@code [begin, end)} inside one file of the corpus.
 */
public record SourceRange(String file, int begin, int end) {

    public SourceRange {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null");
        }
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("Invalid range [" + begin + ", " + end + ") in " + file);
        }
    }

    public int length() {
        return end - begin;
    }

    public boolean overlaps(SourceRange other) {
        return file.equals(other.file) && begin < other.end && other.begin < end;
    }

    @Override
    public String toString() {
        return file + "[" + begin + ", " + end + ")";
    }
}
