package org.learningjava.reorderfields.domain.service.rewrite;

import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.plan.Replacement;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.record.AggregateInitModel;
import org.learningjava.reorderfields.domain.model.source.SourceRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reorders the elements of one brace initializer of the record. Only initializers that
 * list every field are supported.
 */
@Component
public class AggregateInitializerRewriter {

    public ReplacementPlan rewrite(AggregateInitModel init, Permutation permutation) {
        if (!init.explicit() || init.initializers().isEmpty()) {
            return ReplacementPlan.empty();
        }
        List<SourceRange> elements = init.initializers();
        if (elements.size() != permutation.size()) {
            throw new ReorderException(ReorderErrorKind.PARTIAL_AGGREGATE_INIT_UNSUPPORTED,
                    "Currently only full initialization is supported (" + elements.size() + " of "
                            + permutation.size() + " fields initialized at " + init.file().path()
                            + ":" + init.file().line(init.range().begin()) + ")");
        }
        List<Replacement> replacements = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            int from = permutation.get(i);
            if (from != i) {
                replacements.add(new Replacement(elements.get(i), init.file().text(elements.get(from))));
            }
        }
        return ReplacementPlan.of(replacements);
    }
}
