package org.learningjava.reorderfields.application.usecase;

import org.learningjava.reorderfields.application.port.RawTokenScannerPort;
import org.learningjava.reorderfields.application.port.SourceModelPort;
import org.learningjava.reorderfields.domain.model.diagnostic.InitializationOrderWarning;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.diagnostic.UnsafeSyntaxKind;
import org.learningjava.reorderfields.domain.model.plan.DesiredOrder;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.plan.ReorderOutcome;
import org.learningjava.reorderfields.domain.model.plan.ReorderState;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.record.AggregateInitModel;
import org.learningjava.reorderfields.domain.model.record.ConstructorModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.service.order.OrderResolver;
import org.learningjava.reorderfields.domain.service.rewrite.AggregateInitializerRewriter;
import org.learningjava.reorderfields.domain.service.rewrite.ConstructorInitializerRewriter;
import org.learningjava.reorderfields.domain.service.rewrite.ConstructorInitializerRewriter.ConstructorRewrite;
import org.learningjava.reorderfields.domain.service.rewrite.DefinitionRewriter;
import org.learningjava.reorderfields.domain.service.safety.SafetyAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one reorder request from record lookup to a complete replacement plan.
 * Components return plans that are merged here; any error drops everything merged so far,
 * so a caller only ever sees a complete plan or none.
 */
@Service
public class ReorderFieldsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReorderFieldsUseCase.class);

    private final SourceModelPort sourceModel;
    private final RawTokenScannerPort scanner;
    private final SafetyAnalyzer safetyAnalyzer;
    private final OrderResolver orderResolver;
    private final DefinitionRewriter definitionRewriter;
    private final ConstructorInitializerRewriter constructorRewriter;
    private final AggregateInitializerRewriter aggregateRewriter;

    public ReorderFieldsUseCase(SourceModelPort sourceModel,
                                RawTokenScannerPort scanner,
                                SafetyAnalyzer safetyAnalyzer,
                                OrderResolver orderResolver,
                                DefinitionRewriter definitionRewriter,
                                ConstructorInitializerRewriter constructorRewriter,
                                AggregateInitializerRewriter aggregateRewriter) {
        this.sourceModel = sourceModel;
        this.scanner = scanner;
        this.safetyAnalyzer = safetyAnalyzer;
        this.orderResolver = orderResolver;
        this.definitionRewriter = definitionRewriter;
        this.constructorRewriter = constructorRewriter;
        this.aggregateRewriter = aggregateRewriter;
    }

    public ReorderOutcome reorderFields(String recordName, List<String> desiredOrder, SourceCorpus corpus) {
        ReorderState state = ReorderState.START;
        try {
            RecordModel record = sourceModel.findDefinition(recordName, corpus);
            state = advance(state, ReorderState.DEFINITION_FOUND);
            log.info("Found {} in {} with fields {}", record.qualifiedName(), record.file().path(), record.fieldNames());

            List<RawToken> tokens = scanner.scan(record.file());
            Optional<UnsafeSyntaxKind> unsafe = safetyAnalyzer.check(record, tokens);
            if (unsafe.isPresent()) {
                log.warn("{} is not safe to rewrite ({}); nothing to do", record.qualifiedName(), unsafe.get());
                return ReorderOutcome.ineligible(unsafe.get());
            }
            state = advance(state, ReorderState.SAFETY_CHECKED);

            Permutation permutation = orderResolver.resolve(record, new DesiredOrder(desiredOrder));
            state = advance(state, ReorderState.ORDER_RESOLVED);

            ReplacementPlan plan = definitionRewriter.rewrite(record, permutation, tokens);
            state = advance(state, ReorderState.DEFINITION_REWRITTEN);

            List<InitializationOrderWarning> warnings = new ArrayList<>();
            if (record.hasConstructors()) {
                for (ConstructorModel ctor : sourceModel.constructorsOf(record, corpus)) {
                    ConstructorRewrite rewrite = constructorRewriter.rewrite(ctor, permutation);
                    plan = plan.merge(rewrite.plan());
                    warnings.addAll(rewrite.warnings());
                }
            }
            state = advance(state, ReorderState.CONSTRUCTORS_PROCESSED);

            if (record.isAggregate()) {
                for (AggregateInitModel init : sourceModel.aggregateInitializersOf(record, corpus)) {
                    plan = plan.merge(aggregateRewriter.rewrite(init, permutation));
                }
            }
            state = advance(state, ReorderState.AGGREGATES_PROCESSED);

            log.info("Reordering {} planned {} replacement(s) in {} file(s), {} warning(s)",
                    record.qualifiedName(), plan.size(), plan.files().size(), warnings.size());
            return ReorderOutcome.done(plan, warnings);
        } catch (ReorderException e) {
            log.warn("Reordering {} aborted after {}: {}", recordName, state, e.getMessage());
            return ReorderOutcome.failed(state, e);
        }
    }

    private static ReorderState advance(ReorderState from, ReorderState to) {
        log.debug("{} -> {}", from, to);
        return to;
    }
}
