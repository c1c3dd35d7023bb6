package org.learningjava.reorderfields;

import org.learningjava.reorderfields.config.ReorderProperties;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.service.order.OrderResolver;
import org.learningjava.reorderfields.domain.service.rewrite.AggregateInitializerRewriter;
import org.learningjava.reorderfields.domain.service.rewrite.ConstructorInitializerRewriter;
import org.learningjava.reorderfields.domain.service.rewrite.DefinitionRewriter;
import org.learningjava.reorderfields.domain.service.rewrite.FieldRangeResolver;
import org.learningjava.reorderfields.domain.service.safety.SafetyAnalyzer;
import org.learningjava.reorderfields.application.usecase.ReorderFieldsUseCase;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.CppSourceModelAdapter;
import org.learningjava.reorderfields.infrastructure.adapter.out.edit.InMemoryTextEditor;
import org.learningjava.reorderfields.infrastructure.adapter.out.lexer.AntlrRawTokenScanner;

import java.util.List;

/**
 * Real lexer and source model wired by hand, for tests that start from C/C++ text.
 */
public final class CppFixtures {

    public static final AntlrRawTokenScanner SCANNER = new AntlrRawTokenScanner();

    private CppFixtures() {
    }

    public static CppSourceModelAdapter sourceModel() {
        return new CppSourceModelAdapter(SCANNER, new ReorderProperties());
    }

    public static SourceCorpus corpus(String path, String content) {
        return SourceCorpus.of(new SourceFile(path, content));
    }

    public static RecordModel record(String name, SourceCorpus corpus) {
        return sourceModel().findDefinition(name, corpus);
    }

    public static List<RawToken> tokens(SourceFile file) {
        return SCANNER.scan(file);
    }

    public static ReorderFieldsUseCase reorderUseCase() {
        return new ReorderFieldsUseCase(sourceModel(), SCANNER, new SafetyAnalyzer(), new OrderResolver(),
                new DefinitionRewriter(new FieldRangeResolver()), new ConstructorInitializerRewriter(),
                new AggregateInitializerRewriter());
    }

    /** Applies {@code plan} and returns the new text of {@code path}. */
    public static String apply(ReplacementPlan plan, SourceCorpus corpus, String path) {
        return new InMemoryTextEditor().apply(plan, corpus).getOrDefault(path, corpus.file(path).content());
    }
}
