package org.learningjava.reorderfields.domain.model.plan;

import org.learningjava.reorderfields.domain.model.diagnostic.InitializationOrderWarning;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderError;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.diagnostic.UnsafeSyntaxKind;

import java.util.List;

/**
 * Result of one reorder request: either a complete plan plus warnings, or no plan plus
 * the reason. An ineligible record (unsafe syntax) is aborted without an error.
 *
 * @param state        {@link ReorderState#DONE} or {@link ReorderState#ABORTED}
 * @param lastReached  the last state passed before finishing or aborting
 * @param plan         the plan, {@code null} unless done
 * @param warnings     initialization-order warnings of a completed request
 * @param error        why the request failed, {@code null} otherwise
 * @param unsafeSyntax why the record was ineligible, {@code null} otherwise
 */
public record ReorderOutcome(
        ReorderState state,
        ReorderState lastReached,
        ReplacementPlan plan,
        List<InitializationOrderWarning> warnings,
        ReorderError error,
        UnsafeSyntaxKind unsafeSyntax
) {

    public ReorderOutcome {
        warnings = List.copyOf(warnings);
    }

    public static ReorderOutcome done(ReplacementPlan plan, List<InitializationOrderWarning> warnings) {
        return new ReorderOutcome(ReorderState.DONE, ReorderState.AGGREGATES_PROCESSED, plan, warnings, null, null);
    }

    public static ReorderOutcome ineligible(UnsafeSyntaxKind reason) {
        return new ReorderOutcome(ReorderState.ABORTED, ReorderState.DEFINITION_FOUND, null, List.of(), null, reason);
    }

    public static ReorderOutcome failed(ReorderState lastReached, ReorderException cause) {
        return new ReorderOutcome(ReorderState.ABORTED, lastReached, null, List.of(), ReorderError.from(cause), null);
    }

    public boolean isDone() {
        return state == ReorderState.DONE;
    }

    public boolean isFailed() {
        return error != null;
    }
}
