package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.SourceFile;

import java.util.List;
import java.util.Set;

/**
 * Everything {@link CppUnitParser} found in one file.
 *
 * @param codeTokens            tokens outside comments and directive lines
 * @param records               record definitions, outer records before the records nested in them
 * @param outOfLineConstructors {@code X::X(...) {...}} definitions
 * @param bodyBraces            offsets of the {@code {} opening record and enum bodies
 * @param aliases               {@code typedef} and alias-declaration names
 */
record ParsedUnit(
        SourceFile file,
        boolean plainC,
        List<RawToken> codeTokens,
        List<ParsedRecord> records,
        List<RawConstructor> outOfLineConstructors,
        Set<Integer> bodyBraces,
        List<Alias> aliases
) {

    ParsedUnit {
        codeTokens = List.copyOf(codeTokens);
        records = List.copyOf(records);
        outOfLineConstructors = List.copyOf(outOfLineConstructors);
        bodyBraces = Set.copyOf(bodyBraces);
        aliases = List.copyOf(aliases);
    }

    /** {@code name} refers to the type spelled {@code target} (last identifier of the spelling). */
    record Alias(String name, String target) {
    }
}
