package org.learningjava.reorderfields.infrastructure.adapter.in.web;

import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase.RewriteResult;
import org.learningjava.reorderfields.domain.model.diagnostic.InitializationOrderWarning;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.ReorderOutcome;
import org.learningjava.reorderfields.domain.model.plan.ReorderState;
import org.learningjava.reorderfields.domain.model.plan.Replacement;
import org.learningjava.reorderfields.domain.model.plan.ReplacementPlan;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.model.source.SourceRange;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.FileNotFoundException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * MVC slice tests for ReorderController.
 */
@WebMvcTest(ReorderController.class)
class ReorderControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private RewriteSourcesUseCase useCase;

    private static final String BODY = """
            {"recordName": "Foo",
             "fieldsOrder": ["b", "a"],
             "sources": [{"path": "foo.h", "content": "struct Foo { int a; int b; };"}]}
            """;

    private static RewriteResult done() {
        ReplacementPlan plan = ReplacementPlan.of(List.of(
                new Replacement(new SourceRange("foo.h", 13, 19), "int b;"),
                new Replacement(new SourceRange("foo.h", 20, 26), "int a;")));
        var warning = new InitializationOrderWarning(new SourceRange("foo.h", 40, 44), "a", "b");
        return new RewriteResult(ReorderOutcome.done(plan, List.of(warning)),
                Map.of("foo.h", "struct Foo { int b; int a; };"));
    }

    // ---------- /reorder ----------

    @Test
    void reorder_returns_plan_rewritten_sources_and_warnings() throws Exception {
        given(useCase.rewrite(eq("Foo"), eq(List.of("b", "a")), any(SourceCorpus.class))).willReturn(done());

        mvc.perform(post("/reorder").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.state", equalTo("DONE")))
                .andExpect(jsonPath("$.error", nullValue()))
                .andExpect(jsonPath("$.replacements", hasSize(2)))
                .andExpect(jsonPath("$.replacements[0].offset", equalTo(13)))
                .andExpect(jsonPath("$.replacements[0].length", equalTo(6)))
                .andExpect(jsonPath("$.rewritten['foo.h']", equalTo("struct Foo { int b; int a; };")))
                .andExpect(jsonPath("$.warnings[0].message",
                        equalTo("reordering field a after b makes a uninitialized when used in init expression")));

        ArgumentCaptor<SourceCorpus> corpus = ArgumentCaptor.forClass(SourceCorpus.class);
        verify(useCase).rewrite(eq("Foo"), eq(List.of("b", "a")), corpus.capture());
        assertEquals("struct Foo { int a; int b; };", corpus.getValue().file("foo.h").content());
    }

    @Test
    void reorder_failed_request_is_unprocessable() throws Exception {
        var failure = ReorderOutcome.failed(ReorderState.SAFETY_CHECKED,
                new ReorderException(ReorderErrorKind.UNKNOWN_FIELD_NAME, "Field z not found in definition"));
        given(useCase.rewrite(any(), any(), any())).willReturn(new RewriteResult(failure, Map.of()));

        mvc.perform(post("/reorder").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.state", equalTo("ABORTED")))
                .andExpect(jsonPath("$.lastReached", equalTo("SAFETY_CHECKED")))
                .andExpect(jsonPath("$.error.kind", equalTo("UNKNOWN_FIELD_NAME")))
                .andExpect(jsonPath("$.error.message", equalTo("Field z not found in definition")));
    }

    @Test
    void reorder_blank_record_name_is_bad_request() throws Exception {
        String body = """
                {"recordName": " ", "fieldsOrder": ["a"], "sources": [{"path": "foo.h", "content": ""}]}
                """;

        mvc.perform(post("/reorder").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(useCase);
    }

    @Test
    void reorder_without_sources_is_bad_request() throws Exception {
        String body = """
                {"recordName": "Foo", "fieldsOrder": ["a"], "sources": []}
                """;

        mvc.perform(post("/reorder").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(useCase);
    }

    @Test
    void reorder_duplicate_paths_are_bad_request() throws Exception {
        String body = """
                {"recordName": "Foo", "fieldsOrder": ["a"],
                 "sources": [{"path": "foo.h", "content": "x"}, {"path": "foo.h", "content": "y"}]}
                """;

        mvc.perform(post("/reorder").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(useCase);
    }

    // ---------- /reorder/files ----------

    @Test
    void reorder_files_passes_paths_and_in_place_flag() throws Exception {
        given(useCase.rewriteFiles(any(), any(), any(), anyBoolean())).willReturn(done());
        String body = """
                {"recordName": "Foo", "fieldsOrder": ["b", "a"], "paths": ["/src/foo.h", "/src/lib"], "inPlace": true}
                """;

        mvc.perform(post("/reorder/files").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state", equalTo("DONE")));

        verify(useCase).rewriteFiles("Foo", List.of("b", "a"), List.of(Path.of("/src/foo.h"), Path.of("/src/lib")), true);
    }

    @Test
    void reorder_files_unreadable_path_is_bad_request() throws Exception {
        given(useCase.rewriteFiles(any(), any(), any(), anyBoolean()))
                .willThrow(new UncheckedIOException(new FileNotFoundException("nope.h")));
        String body = """
                {"recordName": "Foo", "fieldsOrder": ["a"], "paths": ["nope.h"]}
                """;

        mvc.perform(post("/reorder/files").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }
}
