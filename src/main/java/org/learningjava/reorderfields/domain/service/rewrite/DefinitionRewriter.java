package org.learningjava.reorderfields.domain.service.rewrite;

import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.plan.Replacement;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.SourceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plans the replacements that reorder the field declarations of a record definition.
 * Fields keep their access region: a field may only take the slot of a field with the
 * same access level.
 */
@Component
public class DefinitionRewriter {

    private static final Logger log = LoggerFactory.getLogger(DefinitionRewriter.class);

    private final FieldRangeResolver ranges;

    public DefinitionRewriter(FieldRangeResolver ranges) {
        this.ranges = ranges;
    }

    public ReplacementPlan rewrite(RecordModel record, Permutation permutation, List<RawToken> rawTokens) {
        for (FieldModel field : record.fields()) {
            FieldModel incoming = record.field(permutation.get(field.index()));
            if (field.access() != incoming.access()) {
                throw new ReorderException(ReorderErrorKind.ACCESS_LEVEL_VIOLATION,
                        "Currently reordering of fields with different accesses is not supported ("
                                + incoming.name() + " is " + incoming.access().name().toLowerCase(Locale.ROOT)
                                + ", " + field.name() + " is " + field.access().name().toLowerCase(Locale.ROOT) + ")");
            }
        }

        List<SourceRange> full = new ArrayList<>(record.fieldCount());
        for (FieldModel field : record.fields()) {
            full.add(ranges.fullRange(field, record.file(), rawTokens));
        }

        List<Replacement> replacements = new ArrayList<>();
        for (int i = 0; i < record.fieldCount(); i++) {
            int from = permutation.get(i);
            if (from == i) {
                continue;
            }
            log.debug("{}: slot {} ({}) <- {}", record.qualifiedName(), i, record.field(i).name(),
                    record.field(from).name());
            replacements.add(new Replacement(full.get(i), record.file().text(full.get(from))));
        }
        return ReplacementPlan.of(replacements);
    }
}
