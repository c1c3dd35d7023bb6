package org.learningjava.reorderfields.domain.service.rewrite;

import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.reorderfields.CppFixtures.apply;
import static org.learningjava.reorderfields.CppFixtures.corpus;
import static org.learningjava.reorderfields.CppFixtures.record;
import static org.learningjava.reorderfields.CppFixtures.tokens;

class DefinitionRewriterTest {

    private final DefinitionRewriter rewriter = new DefinitionRewriter(new FieldRangeResolver());

    private String rewrite(String source, int... order) {
        SourceCorpus corpus = corpus("foo.h", source);
        RecordModel record = record("Foo", corpus);
        ReplacementPlan plan = rewriter.rewrite(record, Permutation.of(order), tokens(record.file()));
        return apply(plan, corpus, "foo.h");
    }

    @Test
    void swaps_declarations_in_place() {
        String src = "struct Foo {\n  int a;\n  char *b;\n  double c[4];\n};\n";

        assertEquals("struct Foo {\n  double c[4];\n  char *b;\n  int a;\n};\n", rewrite(src, 2, 1, 0));
    }

    @Test
    void comments_move_with_their_field() {
        String src = "struct Foo {\n  // the a\n  int a; // trailing a\n  int b;\n};\n";

        assertEquals("struct Foo {\n  int b;\n  // the a\n  int a; // trailing a\n};\n", rewrite(src, 1, 0));
    }

    @Test
    void identity_produces_no_replacements() {
        SourceCorpus corpus = corpus("foo.h", "struct Foo { int a; int b; };\n");
        RecordModel record = record("Foo", corpus);

        assertTrue(rewriter.rewrite(record, Permutation.identity(2), tokens(record.file())).isEmpty());
    }

    @Test
    void fields_swap_within_one_access_region() {
        String src = "class Foo {\npublic:\n  int a;\n  int b;\nprivate:\n  int c;\n  int d;\n};\n";

        assertEquals("class Foo {\npublic:\n  int b;\n  int a;\nprivate:\n  int d;\n  int c;\n};\n",
                rewrite(src, 1, 0, 3, 2));
    }

    @Test
    void moving_a_field_across_access_levels_fails() {
        SourceCorpus corpus = corpus("foo.h", "class Foo {\npublic:\n  int a;\nprivate:\n  int b;\n};\n");
        RecordModel record = record("Foo", corpus);

        ReorderException e = assertThrows(ReorderException.class,
                () -> rewriter.rewrite(record, Permutation.of(1, 0), tokens(record.file())));

        assertEquals(ReorderErrorKind.ACCESS_LEVEL_VIOLATION, e.kind());
        assertTrue(e.getMessage().startsWith("Currently reordering of fields with different accesses is not supported"));
    }

    @Test
    void macro_field_moves_as_its_invocation() {
        String src = "#define FIELD(t, n) t n;\nstruct Foo {\n  FIELD(int, a)\n  int b;\n};\n";

        assertEquals("#define FIELD(t, n) t n;\nstruct Foo {\n  int b;\n  FIELD(int, a)\n};\n", rewrite(src, 1, 0));
    }
}
