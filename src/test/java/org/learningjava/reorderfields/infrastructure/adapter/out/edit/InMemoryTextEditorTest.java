package org.learningjava.reorderfields.infrastructure.adapter.out.edit;

import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.Replacement;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTextEditorTest {

    private final InMemoryTextEditor editor = new InMemoryTextEditor();

    private final SourceCorpus corpus = SourceCorpus.of(
            new SourceFile("a.h", "int a; char b;"),
            new SourceFile("b.h", "untouched"));

    private static Replacement r(int begin, int end, String text) {
        return new Replacement(new SourceRange("a.h", begin, end), text);
    }

    @Test
    void applies_replacements_of_different_lengths() {
        ReplacementPlan plan = ReplacementPlan.of(List.of(r(0, 6, "char b;"), r(7, 14, "int a;")));

        Map<String, String> out = editor.apply(plan, corpus);

        assertEquals(Map.of("a.h", "char b; int a;"), out);
    }

    @Test
    void overlapping_replacements_are_rejected() {
        ReplacementPlan plan = ReplacementPlan.of(List.of(r(0, 6, "x"), r(4, 10, "y")));

        ReorderException e = assertThrows(ReorderException.class, () -> editor.apply(plan, corpus));

        assertEquals(ReorderErrorKind.CONFLICTING_REPLACEMENTS, e.kind());
    }

    @Test
    void same_range_with_different_text_is_rejected() {
        ReplacementPlan plan = ReplacementPlan.of(List.of(r(0, 6, "x"), r(0, 6, "y")));

        assertThrows(ReorderException.class, () -> editor.apply(plan, corpus));
    }

    @Test
    void adjacent_replacements_are_fine() {
        ReplacementPlan plan = ReplacementPlan.of(List.of(r(0, 3, "long"), r(3, 6, " z;")));

        assertEquals("long z; char b;", editor.apply(plan, corpus).get("a.h"));
    }

    @Test
    void empty_plan_changes_nothing() {
        assertTrue(editor.apply(ReplacementPlan.empty(), corpus).isEmpty());
    }
}
