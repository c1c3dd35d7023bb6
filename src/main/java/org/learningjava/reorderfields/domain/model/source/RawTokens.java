package org.learningjava.reorderfields.domain.model.source;

import java.util.List;

/**
 * Offset lookups over a raw token list sorted by position.
 */
public final class RawTokens {

    private RawTokens() {
    }

    /** Index of the first token starting at or after {@code offset}; {@code tokens.size()} if none. */
    public static int indexAtOrAfter(List<RawToken> tokens, int offset) {
        int lo = 0;
        int hi = tokens.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).begin() < offset) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** Index of the last token ending at or before {@code offset}; {@code -1} if none. */
    public static int indexEndingBefore(List<RawToken> tokens, int offset) {
        int i = indexAtOrAfter(tokens, offset) - 1;
        while (i >= 0 && tokens.get(i).end() > offset) {
            i--;
        }
        return i;
    }
}
