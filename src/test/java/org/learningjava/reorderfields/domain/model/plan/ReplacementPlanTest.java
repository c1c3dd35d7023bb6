package org.learningjava.reorderfields.domain.model.plan;

import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplacementPlanTest {

    private static Replacement r(String file, int begin, int end, String text) {
        return new Replacement(new SourceRange(file, begin, end), text);
    }

    @Test
    void groups_by_file_and_sorts_by_offset() {
        ReplacementPlan plan = ReplacementPlan.of(List.of(
                r("b.h", 10, 12, "x"),
                r("a.h", 30, 31, "y"),
                r("a.h", 5, 7, "z")));

        assertEquals(List.of("a.h", "b.h"), List.copyOf(plan.files()));
        assertEquals(5, plan.replacementsFor("a.h").get(0).range().begin());
        assertEquals(30, plan.replacementsFor("a.h").get(1).range().begin());
        assertEquals(3, plan.size());
    }

    @Test
    void merge_collapses_identical_replacements() {
        ReplacementPlan left = ReplacementPlan.of(List.of(r("a.h", 0, 3, "int")));
        ReplacementPlan right = ReplacementPlan.of(List.of(r("a.h", 0, 3, "int"), r("a.h", 4, 5, "b")));

        ReplacementPlan merged = left.merge(right);

        assertEquals(2, merged.size());
        assertSame(left, left.merge(ReplacementPlan.empty()));
    }

    @Test
    void merge_keeps_conflicting_replacements_for_the_editor() {
        ReplacementPlan merged = ReplacementPlan.of(List.of(r("a.h", 0, 3, "int")))
                .merge(ReplacementPlan.of(List.of(r("a.h", 0, 3, "char"))));

        assertEquals(2, merged.size());
    }

    @Test
    void empty_plan_has_no_files() {
        assertTrue(ReplacementPlan.of(List.of()).isEmpty());
        assertTrue(ReplacementPlan.empty().files().isEmpty());
    }
}
