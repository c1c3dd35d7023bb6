package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.source.RawToken;

import java.util.List;

/**
 * One written clause of a member-initializer list before it is bound to a record.
 *
 * @param name       the clause name as written, e.g. {@code b_} or {@code Base<int>}
 * @param simpleName the name when it is a single identifier, {@code null} otherwise
 * @param begin      offset of the first name token
 * @param end        end offset of the closing parenthesis or brace
 * @param expression code tokens between the parentheses or braces
 */
record RawInitializer(String name, String simpleName, int begin, int end, List<RawToken> expression) {

    RawInitializer {
        expression = List.copyOf(expression);
    }
}
