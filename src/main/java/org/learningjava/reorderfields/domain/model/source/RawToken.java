package org.learningjava.reorderfields.domain.model.source;

/**
 * A token of the raw (unpreprocessed) token stream. Keywords are plain identifiers.
 * {@code begin}/{@code end} are char offsets, {@code line}/{@code column} are 1-based.
 */
public record RawToken(RawTokenKind kind, String text, int begin, int end, int line, int column) {

    public boolean is(String spelling) {
        return kind != RawTokenKind.COMMENT && text.equals(spelling);
    }

    public boolean isIdentifier() {
        return kind == RawTokenKind.IDENTIFIER;
    }

    public boolean isComment() {
        return kind == RawTokenKind.COMMENT;
    }
}
