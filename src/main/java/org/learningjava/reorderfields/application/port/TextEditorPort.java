package org.learningjava.reorderfields.application.port;

import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;

import java.util.Map;

public interface TextEditorPort {
    /**
     * Applies the plan and returns the new contents of every file it touches, keyed by path.
     * Overlapping replacements are rejected with {@code CONFLICTING_REPLACEMENTS}.
     */
    Map<String, String> apply(ReplacementPlan plan, SourceCorpus corpus);
}
