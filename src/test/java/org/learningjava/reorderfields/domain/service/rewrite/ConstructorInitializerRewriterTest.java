package org.learningjava.reorderfields.domain.service.rewrite;

import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.domain.model.diagnostic.InitializationOrderWarning;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.record.ConstructorModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.service.rewrite.ConstructorInitializerRewriter.ConstructorRewrite;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.CppSourceModelAdapter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.reorderfields.CppFixtures.apply;
import static org.learningjava.reorderfields.CppFixtures.corpus;
import static org.learningjava.reorderfields.CppFixtures.sourceModel;

class ConstructorInitializerRewriterTest {

    private final ConstructorInitializerRewriter rewriter = new ConstructorInitializerRewriter();

    private record Run(String text, List<InitializationOrderWarning> warnings) {
    }

    private Run rewrite(String source, int... order) {
        SourceCorpus corpus = corpus("foo.h", source);
        CppSourceModelAdapter model = sourceModel();
        RecordModel record = model.findDefinition("Foo", corpus);
        List<ConstructorModel> ctors = model.constructorsOf(record, corpus);
        assertEquals(1, ctors.size());
        ConstructorRewrite result = rewriter.rewrite(ctors.get(0), Permutation.of(order));
        return new Run(apply(result.plan(), corpus, "foo.h"), result.warnings());
    }

    @Test
    void initializers_follow_the_new_field_order() {
        String src = """
                class Foo {
                public:
                  Foo(int x, int y) : a(x), b(y), c(x + y) {}
                private:
                  int a;
                  int b;
                  int c;
                };
                """;

        Run run = rewrite(src, 2, 0, 1);

        assertTrue(run.text().contains("Foo(int x, int y) : c(x + y), a(x), b(y) {}"));
        assertTrue(run.warnings().isEmpty());
    }

    @Test
    void reading_a_field_that_is_now_initialized_later_warns() {
        String src = """
                class Foo {
                public:
                  Foo() : a(1), b(a) {}
                  int a;
                  int b;
                };
                """;

        Run run = rewrite(src, 1, 0);

        assertTrue(run.text().contains("Foo() : b(a), a(1) {}"));
        assertEquals(1, run.warnings().size());
        InitializationOrderWarning w = run.warnings().get(0);
        assertEquals("a", w.usedField());
        assertEquals("b", w.initializedField());
        assertEquals("reordering field a after b makes a uninitialized when used in init expression", w.message());
    }

    @Test
    void this_arrow_counts_as_a_use() {
        String src = """
                struct Foo {
                  Foo() : a(1), b(this->a * 2) {}
                  int a;
                  int b;
                };
                """;

        assertEquals(1, rewrite(src, 1, 0).warnings().size());
    }

    @Test
    void parameter_shadowing_a_field_is_not_a_use() {
        String src = """
                struct Foo {
                  Foo(int a) : a(a), b(a) {}
                  int a;
                  int b;
                };
                """;

        Run run = rewrite(src, 1, 0);

        assertTrue(run.text().contains("Foo(int a) : b(a), a(a) {}"));
        assertTrue(run.warnings().isEmpty());
    }

    @Test
    void base_initializer_keeps_its_place() {
        String src = """
                struct Foo : Base {
                  Foo() : Base(7), a(1), b(2) {}
                  int a;
                  int b;
                };
                """;

        assertTrue(rewrite(src, 1, 0).text().contains("Foo() : Base(7), b(2), a(1) {}"));
    }

    @Test
    void single_initializer_is_left_alone() {
        String src = """
                struct Foo {
                  Foo() : b(2) {}
                  int a;
                  int b;
                };
                """;

        Run run = rewrite(src, 1, 0);

        assertTrue(run.text().contains("Foo() : b(2) {}"));
        assertTrue(run.warnings().isEmpty());
    }
}
