package org.learningjava.reorderfields.application.usecase;

import org.learningjava.reorderfields.application.port.SourceCorpusPort;
import org.learningjava.reorderfields.application.port.TextEditorPort;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.ReorderOutcome;
import org.learningjava.reorderfields.domain.model.plan.ReorderState;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reorders a record and applies the resulting plan to the sources, optionally writing the
 * changed files back.
 */
@Service
public class RewriteSourcesUseCase {

    private static final Logger log = LoggerFactory.getLogger(RewriteSourcesUseCase.class);

    private final ReorderFieldsUseCase reorder;
    private final TextEditorPort editor;
    private final SourceCorpusPort corpusPort;

    public RewriteSourcesUseCase(ReorderFieldsUseCase reorder, TextEditorPort editor, SourceCorpusPort corpusPort) {
        this.reorder = reorder;
        this.editor = editor;
        this.corpusPort = corpusPort;
    }

    public RewriteResult rewrite(String recordName, List<String> fieldsOrder, SourceCorpus corpus) {
        ReorderOutcome outcome = reorder.reorderFields(recordName, fieldsOrder, corpus);
        if (!outcome.isDone() || outcome.plan().isEmpty()) {
            return new RewriteResult(outcome, Map.of());
        }
        try {
            return new RewriteResult(outcome, editor.apply(outcome.plan(), corpus));
        } catch (ReorderException e) {
            log.warn("Could not apply plan for {}: {}", recordName, e.getMessage());
            return new RewriteResult(ReorderOutcome.failed(ReorderState.AGGREGATES_PROCESSED, e), Map.of());
        }
    }

    public RewriteResult rewriteFiles(String recordName, List<String> fieldsOrder, List<Path> paths, boolean inPlace) {
        SourceCorpus corpus = corpusPort.read(paths);
        log.info("Read {} source file(s) from {}", corpus.size(), paths);

        RewriteResult result = rewrite(recordName, fieldsOrder, corpus);
        if (inPlace && !result.rewritten().isEmpty()) {
            corpusPort.write(result.rewritten());
            log.info("Wrote {} file(s) in place", result.rewritten().size());
        }
        return result;
    }

    /**
     * @param outcome   the reorder outcome
     * @param rewritten new contents of the changed files, empty unless the plan was applied
     */
    public record RewriteResult(ReorderOutcome outcome, Map<String, String> rewritten) {

        public RewriteResult {
            rewritten = Map.copyOf(rewritten);
        }
    }
}
