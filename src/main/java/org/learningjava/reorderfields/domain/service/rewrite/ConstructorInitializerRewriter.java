package org.learningjava.reorderfields.domain.service.rewrite;

import org.learningjava.reorderfields.domain.model.diagnostic.InitializationOrderWarning;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.plan.Replacement;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.record.ConstructorModel;
import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.record.InitializerModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reorders the written member initializers of one constructor so they follow the new field
 * order. Base-class, delegating and unwritten initializers stay where they are.
 * Never fails: a clause that reads a field which would be initialized later only yields
 * a warning.
 */
@Component
public class ConstructorInitializerRewriter {

    private static final Logger log = LoggerFactory.getLogger(ConstructorInitializerRewriter.class);

    public ConstructorRewrite rewrite(ConstructorModel ctor, Permutation permutation) {
        if (ctor.implicit() || ctor.totalInitializers() <= 1) {
            return ConstructorRewrite.NONE;
        }

        int[] newPositions = permutation.newPositions();
        List<InitializerModel> oldOrder = new ArrayList<>();
        List<InitializationOrderWarning> warnings = new ArrayList<>();

        for (InitializerModel init : ctor.initializers()) {
            if (!init.isMemberInitializer() || !init.written()) {
                continue;
            }
            FieldModel target = init.target();
            for (FieldModel used : init.usedFields()) {
                if (newPositions[used.index()] > newPositions[target.index()]) {
                    var warning = new InitializationOrderWarning(init.range(), used.name(), target.name());
                    log.warn("{}: {}", ctor.name(), warning.message());
                    warnings.add(warning);
                }
            }
            oldOrder.add(init);
        }

        List<InitializerModel> newOrder = new ArrayList<>(oldOrder);
        newOrder.sort(Comparator.comparingInt(init -> newPositions[init.target().index()]));

        List<Replacement> replacements = new ArrayList<>();
        for (int i = 0; i < oldOrder.size(); i++) {
            if (oldOrder.get(i) != newOrder.get(i)) {
                replacements.add(new Replacement(oldOrder.get(i).range(),
                        ctor.file().text(newOrder.get(i).range())));
            }
        }
        log.debug("{}: {} of {} written initializers move", ctor.name(), replacements.size(), oldOrder.size());
        return new ConstructorRewrite(ReplacementPlan.of(replacements), warnings);
    }

    public record ConstructorRewrite(ReplacementPlan plan, List<InitializationOrderWarning> warnings) {

        static final ConstructorRewrite NONE = new ConstructorRewrite(ReplacementPlan.empty(), List.of());

        public ConstructorRewrite {
            warnings = List.copyOf(warnings);
        }
    }
}
