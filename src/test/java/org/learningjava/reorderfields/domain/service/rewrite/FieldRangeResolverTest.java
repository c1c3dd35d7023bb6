package org.learningjava.reorderfields.domain.service.rewrite;

import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.domain.model.record.RecordModel;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.reorderfields.CppFixtures.corpus;
import static org.learningjava.reorderfields.CppFixtures.record;
import static org.learningjava.reorderfields.CppFixtures.tokens;

class FieldRangeResolverTest {

    private final FieldRangeResolver resolver = new FieldRangeResolver();

    private String fullText(String source, int fieldIndex) {
        RecordModel record = record("Foo", corpus("foo.h", source));
        return record.file().text(resolver.fullRange(record.field(fieldIndex), record.file(), tokens(record.file())));
    }

    @Test
    void range_runs_through_the_semicolon() {
        assertEquals("int a;", fullText("struct Foo {\n  int a;\n  int b;\n};\n", 0));
    }

    @Test
    void trailing_comment_on_the_same_line_is_included() {
        assertEquals("int a; // note", fullText("struct Foo {\n  int a; // note\n  int b;\n};\n", 0));
    }

    @Test
    void aligned_leading_comment_is_included() {
        assertEquals("/* doc */\n  int b;", fullText("struct Foo {\n  int a;\n  /* doc */\n  int b;\n};\n", 1));
    }

    @Test
    void unaligned_comment_on_another_line_stays() {
        assertEquals("int b;", fullText("struct Foo {\n  int a;\n// banner\n  int b;\n};\n", 1));
    }

    @Test
    void attribute_macro_after_the_declarator_travels_with_the_field() {
        assertEquals("int a GUARDED_BY(mu);",
                fullText("struct Foo {\n  int a GUARDED_BY(mu);\n  int b;\n};\n", 0));
    }

    @Test
    void default_member_initializer_is_part_of_the_field() {
        assertEquals("int a = 1 + 2;", fullText("struct Foo {\n  int a = 1 + 2;\n  int b;\n};\n", 0));
    }

    @Test
    void macro_field_covers_the_invocation() {
        String src = "#define FIELD(t, n) t n;\nstruct Foo {\n  FIELD(int, a)\n  int b;\n};\n";
        assertEquals("FIELD(int, a)", fullText(src, 0));
    }
}
