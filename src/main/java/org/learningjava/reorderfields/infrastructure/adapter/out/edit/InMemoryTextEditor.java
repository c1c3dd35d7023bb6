package org.learningjava.reorderfields.infrastructure.adapter.out.edit;

import org.learningjava.reorderfields.application.port.TextEditorPort;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.Replacement;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class InMemoryTextEditor implements TextEditorPort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTextEditor.class);

    @Override
    public Map<String, String> apply(ReplacementPlan plan, SourceCorpus corpus) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String path : plan.files()) {
            SourceFile file = corpus.file(path);
            List<Replacement> replacements = plan.replacementsFor(path);
            checkDisjoint(replacements);

            StringBuilder text = new StringBuilder(file.content());
            // sorted by begin, so editing from the end keeps earlier offsets valid
            for (int i = replacements.size() - 1; i >= 0; i--) {
                Replacement r = replacements.get(i);
                if (r.range().end() > file.length()) {
                    throw new IllegalArgumentException("Replacement " + r.range() + " is past the end of " + path);
                }
                text.replace(r.range().begin(), r.range().end(), r.text());
            }
            out.put(path, text.toString());
            log.debug("Applied {} replacement(s) to {}", replacements.size(), path);
        }
        return out;
    }

    private static void checkDisjoint(List<Replacement> replacements) {
        for (int i = 1; i < replacements.size(); i++) {
            Replacement prev = replacements.get(i - 1);
            Replacement next = replacements.get(i);
            if (prev.range().overlaps(next.range())
                    || (prev.range().begin() == next.range().begin() && prev.range().end() == next.range().end())) {
                throw new ReorderException(ReorderErrorKind.CONFLICTING_REPLACEMENTS,
                        "Conflicting replacements at " + prev.range() + " and " + next.range());
            }
        }
    }
}
