package org.learningjava.reorderfields.domain.model.diagnostic;

import org.learningjava.reorderfields.domain.model.source.SourceRange;

/**
 * The new order initializes {@code initializedField} before {@code usedField}, although the
 * initializer of {@code initializedField} reads {@code usedField}.
 */
public record InitializationOrderWarning(SourceRange location, String usedField, String initializedField) {

    public String message() {
        return "reordering field " + usedField + " after " + initializedField + " makes "
                + usedField + " uninitialized when used in init expression";
    }
}
