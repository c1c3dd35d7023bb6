package org.learningjava.reorderfields.infrastructure.adapter.in.web;

import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase.RewriteResult;
import org.learningjava.reorderfields.domain.model.diagnostic.InitializationOrderWarning;
import org.learningjava.reorderfields.domain.model.plan.Replacement;
import org.learningjava.reorderfields.domain.model.plan.ReorderOutcome;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Wire form of a reorder outcome, shared by the REST endpoints and the JSON output of the
 * command line.
 */
public record ReorderReport(
        String state,
        String lastReached,
        String unsafeSyntax,
        ErrorDTO error,
        List<WarningDTO> warnings,
        List<ReplacementDTO> replacements,
        Map<String, String> rewritten
) {

    public static ReorderReport from(RewriteResult result) {
        ReorderOutcome o = result.outcome();
        return new ReorderReport(
                o.state().name(),
                o.lastReached().name(),
                o.unsafeSyntax() == null ? null : o.unsafeSyntax().name(),
                o.error() == null ? null : new ErrorDTO(o.error().kind().name(), o.error().message()),
                o.warnings().stream().map(WarningDTO::from).toList(),
                o.plan() == null ? List.of() : o.plan().all().stream().map(ReplacementDTO::from).toList(),
                new TreeMap<>(result.rewritten())
        );
    }

    public record ErrorDTO(String kind, String message) {
    }

    public record WarningDTO(String file, int offset, String usedField, String initializedField, String message) {
        static WarningDTO from(InitializationOrderWarning w) {
            return new WarningDTO(w.location().file(), w.location().begin(), w.usedField(),
                    w.initializedField(), w.message());
        }
    }

    public record ReplacementDTO(String file, int offset, int length, String text) {
        static ReplacementDTO from(Replacement r) {
            return new ReplacementDTO(r.file(), r.range().begin(), r.range().length(), r.text());
        }
    }
}
