package org.learningjava.reorderfields.domain.model.record;

import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.List;

/**
 * A brace initializer of the record, e.g. {@code {1, "x", 3.0}}.
 *
 * @param file         file holding the expression
 * @param range        the braces and everything between them
 * @param explicit     whether the list is written in source
 * @param initializers ranges of the element expressions, in order
 */
public record AggregateInitModel(
        SourceFile file,
        SourceRange range,
        boolean explicit,
        List<SourceRange> initializers
) {

    public AggregateInitModel {
        initializers = List.copyOf(initializers);
    }
}
