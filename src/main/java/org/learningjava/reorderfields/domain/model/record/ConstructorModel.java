package org.learningjava.reorderfields.domain.model.record;

import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.List;

/**
 * A constructor definition of the record with its initializers in source order.
 */
public record ConstructorModel(
        String name,
        SourceFile file,
        SourceRange range,
        boolean implicit,
        List<InitializerModel> initializers
) {

    public ConstructorModel {
        initializers = List.copyOf(initializers);
    }

    public int totalInitializers() {
        return initializers.size();
    }
}
