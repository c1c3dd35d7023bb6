package org.learningjava.reorderfields.domain.model.record;

import org.learningjava.reorderfields.domain.model.source.SourceLocation;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

/**
 * A non-static data member as captured from source.
 *
 * @param name           field name, empty for unnamed bit-fields and anonymous struct/union members
 * @param index          0-based declaration index within the record
 * @param access         access level in effect at the declaration
 * @param range          declaration text from the start of the declaration to the end of the declarator
 * @param typeLocation   where the declaration's type starts; shared by all declarators of one statement
 * @param macroExpansion range of the macro invocation that produced the field, or {@code null}
 */
public record FieldModel(
        String name,
        int index,
        AccessLevel access,
        SourceRange range,
        SourceLocation typeLocation,
        SourceRange macroExpansion
) {

    public boolean isFromMacro() {
        return macroExpansion != null;
    }

    /** The range as written in the file: the outermost macro invocation for macro-produced fields. */
    public SourceRange spelledRange() {
        return macroExpansion != null ? macroExpansion : range;
    }
}
