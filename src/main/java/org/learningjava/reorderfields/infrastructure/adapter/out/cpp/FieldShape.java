package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import java.util.Set;

/**
 * What a field holds, as far as brace initialization cares.
 *
 * @param typeName   last identifier of the declared type, {@code null} for builtin types
 * @param indirect   pointer, reference or function pointer
 * @param dimensions number of array bounds after the name
 */
record FieldShape(String typeName, boolean indirect, int dimensions) {

    static final FieldShape UNKNOWN = new FieldShape(null, false, 0);

    /** Holds a value of one of {@code types} inline, so its brace list nests theirs. */
    boolean holdsValueOf(Set<String> types) {
        return typeName != null && !indirect && types.contains(typeName);
    }
}
