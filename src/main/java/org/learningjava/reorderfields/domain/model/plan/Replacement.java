package org.learningjava.reorderfields.domain.model.plan;

import org.learningjava.reorderfields.domain.model.source.SourceRange;

/**
 * Replace the text of {@code range} with {@code text}.
 */
public record Replacement(SourceRange range, String text) {

    public String file() {
        return range.file();
    }
}
