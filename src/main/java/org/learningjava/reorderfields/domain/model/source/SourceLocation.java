package org.learningjava.reorderfields.domain.model.source;

/**
 * A point in the corpus. File locations have {@code macroSpelling == -1}; locations inside a
 * macro expansion carry the expansion's start offset plus the index of the spelled token
 * within the expanded token sequence, so two statements produced by one expansion still
 * have distinct locations.
 */
public record SourceLocation(String file, int offset, int macroSpelling) {

    public static SourceLocation fileLocation(String file, int offset) {
        return new SourceLocation(file, offset, -1);
    }

    public static SourceLocation macroLocation(String file, int expansionOffset, int spellingIndex) {
        return new SourceLocation(file, expansionOffset, spellingIndex);
    }

    public boolean isMacroLocation() {
        return macroSpelling >= 0;
    }
}
