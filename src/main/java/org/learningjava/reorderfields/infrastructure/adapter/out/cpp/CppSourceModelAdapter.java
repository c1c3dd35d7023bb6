package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.application.port.RawTokenScannerPort;
import org.learningjava.reorderfields.application.port.SourceModelPort;
import org.learningjava.reorderfields.config.ReorderProperties;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.record.AggregateInitModel;
import org.learningjava.reorderfields.domain.model.record.ConstructorModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.CppCorpusParser.ParsedCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Source model over raw C/C++ tokens. Each corpus is parsed once; the three queries of
 * one reorder run share the result.
 */
@Component
public class CppSourceModelAdapter implements SourceModelPort {

    private static final Logger log = LoggerFactory.getLogger(CppSourceModelAdapter.class);

    private final CppCorpusParser parser;
    private volatile Parsed last;

    public CppSourceModelAdapter(RawTokenScannerPort scanner, ReorderProperties properties) {
        this.parser = new CppCorpusParser(scanner, properties);
    }

    @Override
    public RecordModel findDefinition(String recordName, SourceCorpus corpus) {
        ParsedCorpus parsed = parsed(corpus);
        boolean exact = recordName.startsWith("::");
        String wanted = exact ? recordName.substring(2) : recordName;

        List<Match> matches = new ArrayList<>();
        for (ParsedUnit unit : parsed.units()) {
            for (ParsedRecord rec : unit.records()) {
                if (!rec.name().isEmpty() && nameMatches(rec.qualifiedName(), wanted, exact)) {
                    matches.add(new Match(unit, rec));
                }
            }
        }
        if (matches.isEmpty()) {
            throw new ReorderException(ReorderErrorKind.DEFINITION_NOT_FOUND,
                    "Definition of " + recordName + " not found");
        }
        if (matches.size() > 1) {
            throw new ReorderException(ReorderErrorKind.AMBIGUOUS_DEFINITION,
                    "The name " + recordName + " is ambiguous, several definitions found");
        }
        Match match = matches.get(0);
        RecordModel record = match.record().toModel(match.unit().plainC(), parsed.aliasesOf(match.record().name()));
        log.info("Found definition of {} in {} with {} fields", record.qualifiedName(),
                record.file().path(), record.fieldCount());
        return record;
    }

    @Override
    public List<ConstructorModel> constructorsOf(RecordModel record, SourceCorpus corpus) {
        ParsedCorpus parsed = parsed(corpus);
        List<ConstructorModel> constructors = new ArrayList<>();
        for (ParsedUnit unit : parsed.units()) {
            for (ParsedRecord rec : unit.records()) {
                if (isDefinitionOf(rec, record)) {
                    rec.constructors().forEach(c -> constructors.add(ConstructorBinder.bind(c, record)));
                }
            }
            for (RawConstructor ctor : unit.outOfLineConstructors()) {
                if (nameMatches(record.qualifiedName(), ctor.qualifiedName(), false)) {
                    constructors.add(ConstructorBinder.bind(ctor, record));
                }
            }
        }
        log.debug("{} constructors of {}", constructors.size(), record.qualifiedName());
        return constructors;
    }

    @Override
    public List<AggregateInitModel> aggregateInitializersOf(RecordModel record, SourceCorpus corpus) {
        ParsedCorpus parsed = parsed(corpus);
        AggregateTypes types = AggregateTypes.of(record, parsed);
        List<AggregateInitModel> inits = new ArrayList<>();
        for (ParsedUnit unit : parsed.units()) {
            inits.addAll(AggregateInitScanner.scan(unit, types));
        }
        log.debug("{} aggregate initializers of {}, followed through {}", inits.size(), record.qualifiedName(),
                types.names());
        return inits;
    }

    private ParsedCorpus parsed(SourceCorpus corpus) {
        Parsed cached = last;
        if (cached != null && cached.corpus() == corpus) {
            return cached.result();
        }
        ParsedCorpus result = parser.parse(corpus);
        last = new Parsed(corpus, result);
        return result;
    }

    /** {@code qualified} is {@code wanted} itself or ends with it at a {@code ::} boundary. */
    static boolean nameMatches(String qualified, String wanted, boolean exact) {
        if (qualified.equals(wanted)) {
            return true;
        }
        return !exact && qualified.endsWith("::" + wanted);
    }

    private static boolean isDefinitionOf(ParsedRecord rec, RecordModel record) {
        return rec.file().path().equals(record.file().path())
                && rec.begin() == record.definition().begin();
    }

    private record Match(ParsedUnit unit, ParsedRecord record) {
    }

    private record Parsed(SourceCorpus corpus, ParsedCorpus result) {
    }
}
