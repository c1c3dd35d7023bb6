package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.application.port.RawTokenScannerPort;
import org.learningjava.reorderfields.config.ReorderProperties;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses every file of a corpus. Macros defined in any file are visible in all of them,
 * since headers are not followed.
 */
final class CppCorpusParser {

    private static final Logger log = LoggerFactory.getLogger(CppCorpusParser.class);

    private final RawTokenScannerPort scanner;
    private final ReorderProperties properties;

    CppCorpusParser(RawTokenScannerPort scanner, ReorderProperties properties) {
        this.scanner = scanner;
        this.properties = properties;
    }

    ParsedCorpus parse(SourceCorpus corpus) {
        Map<SourceFile, PreprocessorIndex> indexes = new LinkedHashMap<>();
        List<MacroDefinition> definitions = new ArrayList<>();
        for (SourceFile file : corpus.files()) {
            PreprocessorIndex index = PreprocessorIndex.of(file, scanner.scan(file));
            indexes.put(file, index);
            definitions.addAll(index.macros());
        }
        MacroTable macros = MacroTable.of(definitions);

        List<ParsedUnit> units = new ArrayList<>();
        indexes.forEach((file, index) -> units.add(
                CppUnitParser.parse(file, index.codeTokens(), macros, properties.isC(file.path()))));
        log.debug("Parsed {} files, {} macros", units.size(), definitions.size());
        return new ParsedCorpus(units);
    }

    record ParsedCorpus(List<ParsedUnit> units) {

        ParsedCorpus {
            units = List.copyOf(units);
        }

        /** Every name that refers to {@code name}, through chains of typedefs and aliases. */
        Set<String> aliasesOf(String name) {
            Set<String> names = new HashSet<>();
            names.add(name);
            boolean grew = true;
            while (grew) {
                grew = false;
                for (ParsedUnit unit : units) {
                    for (ParsedUnit.Alias alias : unit.aliases()) {
                        if (names.contains(alias.target()) && names.add(alias.name())) {
                            grew = true;
                        }
                    }
                }
            }
            names.remove(name);
            return names;
        }
    }
}
