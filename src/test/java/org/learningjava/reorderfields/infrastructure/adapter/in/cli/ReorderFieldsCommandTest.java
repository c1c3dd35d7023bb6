package org.learningjava.reorderfields.infrastructure.adapter.in.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase.RewriteResult;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.diagnostic.UnsafeSyntaxKind;
import org.learningjava.reorderfields.domain.model.plan.ReorderOutcome;
import org.learningjava.reorderfields.domain.model.plan.ReorderState;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReorderFieldsCommandTest {

    private RewriteSourcesUseCase useCase;
    private ByteArrayOutputStream buffer;
    private ReorderFieldsCommand command;

    @BeforeEach
    void setUp() {
        useCase = mock(RewriteSourcesUseCase.class);
        buffer = new ByteArrayOutputStream();
        command = new ReorderFieldsCommand(useCase, new ObjectMapper(),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private void run(String... args) throws Exception {
        command.run(new DefaultApplicationArguments(args));
    }

    private static RewriteResult done(Map<String, String> rewritten) {
        return new RewriteResult(ReorderOutcome.done(ReplacementPlan.empty(), List.of()), rewritten);
    }

    @Test
    void does_nothing_without_record_name() throws Exception {
        run("--server.port=0", "foo.h");

        verifyNoInteractions(useCase);
        assertEquals("", output());
    }

    @Test
    void prints_rewritten_single_file_without_header() throws Exception {
        when(useCase.rewriteFiles(any(), any(), any(), anyBoolean()))
                .thenReturn(done(Map.of("foo.h", "struct Foo { int b; int a; };\n")));

        run("--record-name=Foo", "--fields-order=b,a", "foo.h");

        verify(useCase).rewriteFiles("Foo", List.of("b", "a"), List.of(Path.of("foo.h")), false);
        assertEquals("struct Foo { int b; int a; };\n", output());
    }

    @Test
    void prints_a_header_per_file_when_several_files_change() throws Exception {
        when(useCase.rewriteFiles(any(), any(), any(), anyBoolean()))
                .thenReturn(done(Map.of("b.cpp", "B\n", "a.h", "A\n")));

        run("--record-name=Foo", "--fields-order=b,a", "a.h", "b.cpp");

        String out = output();
        assertTrue(out.indexOf("==> a.h <==") < out.indexOf("==> b.cpp <=="), out);
        assertTrue(out.contains("==> a.h <==" + System.lineSeparator() + "A\n"), out);
    }

    @Test
    void in_place_flag_writes_files_and_prints_nothing() throws Exception {
        when(useCase.rewriteFiles(any(), any(), any(), anyBoolean()))
                .thenReturn(done(Map.of("foo.h", "changed")));

        run("--record-name=Foo", "--fields-order=b,a", "-i", "foo.h");

        verify(useCase).rewriteFiles("Foo", List.of("b", "a"), List.of(Path.of("foo.h")), true);
        assertEquals("", output());
    }

    @Test
    void json_format_prints_the_report() throws Exception {
        when(useCase.rewriteFiles(any(), any(), any(), anyBoolean()))
                .thenReturn(done(Map.of("foo.h", "changed")));

        run("--record-name=Foo", "--fields-order=b,a", "--format=json", "foo.h");

        JsonNode report = new ObjectMapper().readTree(output());
        assertEquals("DONE", report.get("state").asText());
        assertEquals("changed", report.get("rewritten").get("foo.h").asText());
        assertTrue(report.get("error").isNull());
    }

    @Test
    void failed_outcome_is_raised_after_reporting() throws Exception {
        var failure = ReorderOutcome.failed(ReorderState.START,
                new ReorderException(ReorderErrorKind.DEFINITION_NOT_FOUND, "Definition of Foo not found"));
        when(useCase.rewriteFiles(any(), any(), any(), anyBoolean()))
                .thenReturn(new RewriteResult(failure, Map.of()));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> run("--record-name=Foo", "--fields-order=b,a", "foo.h"));

        assertEquals("Definition of Foo not found", ex.getMessage());
    }

    @Test
    void ineligible_record_is_not_an_error() throws Exception {
        when(useCase.rewriteFiles(any(), any(), any(), anyBoolean()))
                .thenReturn(new RewriteResult(ReorderOutcome.ineligible(UnsafeSyntaxKind.MULTIPLE_FIELDS_IN_STATEMENT),
                        Map.of("foo.h", "struct Foo { int a, b; };")));

        assertDoesNotThrow(() -> run("--record-name=Foo", "--fields-order=b,a", "foo.h"));
    }

    @Test
    void unknown_format_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> run("--record-name=Foo", "--fields-order=b,a", "--format=xml", "foo.h"));
        verifyNoInteractions(useCase);
    }

    @Test
    void missing_paths_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> run("--record-name=Foo", "--fields-order=b,a", "-i"));
        verifyNoInteractions(useCase);
    }
}
