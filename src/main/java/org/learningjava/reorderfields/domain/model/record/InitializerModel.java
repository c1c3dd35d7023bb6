package org.learningjava.reorderfields.domain.model.record;

import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.List;

/**
 * One clause of a constructor's member-initializer list, e.g. {@code b(a + 1)}.
 *
 * @param name       the initializer's name as written
 * @param target     the initialized field; {@code null} for base-class and delegating initializers
 * @param range      the whole clause, name through closing parenthesis or brace
 * @param written    whether the clause appears in source
 * @param usedFields fields of the record read by the initializer expression, without duplicates
 */
public record InitializerModel(
        String name,
        FieldModel target,
        SourceRange range,
        boolean written,
        List<FieldModel> usedFields
) {

    public InitializerModel {
        usedFields = List.copyOf(usedFields);
    }

    public boolean isMemberInitializer() {
        return target != null;
    }
}
