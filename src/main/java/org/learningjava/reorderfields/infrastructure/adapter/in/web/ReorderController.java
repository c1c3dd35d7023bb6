package org.learningjava.reorderfields.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase;
import org.learningjava.reorderfields.application.usecase.RewriteSourcesUseCase.RewriteResult;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/reorder")
public class ReorderController {

    private static final Logger log = LoggerFactory.getLogger(ReorderController.class);

    private final RewriteSourcesUseCase useCase;

    public ReorderController(RewriteSourcesUseCase useCase) {
        this.useCase = useCase;
    }

    // --- Sources sent in the request body
    @PostMapping
    public ResponseEntity<ReorderReport> reorder(@Valid @RequestBody ReorderRequest req) {
        SourceCorpus corpus;
        try {
            corpus = SourceCorpus.of(req.sources().stream()
                    .map(s -> new SourceFile(s.path(), s.content()))
                    .toList());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return respond(useCase.rewrite(req.recordName(), req.fieldsOrder(), corpus));
    }

    // --- Sources read from server-side paths
    @PostMapping("/files")
    public ResponseEntity<ReorderReport> reorderFiles(@Valid @RequestBody FilesRequest req) {
        List<Path> paths = req.paths().stream().map(Path::of).toList();
        try {
            return respond(useCase.rewriteFiles(req.recordName(), req.fieldsOrder(), paths, req.inPlace()));
        } catch (UncheckedIOException e) {
            log.warn("Reorder of {} failed on I/O: {}", req.recordName(), e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    private static ResponseEntity<ReorderReport> respond(RewriteResult result) {
        HttpStatus status = result.outcome().isFailed() ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.OK;
        return ResponseEntity.status(status).body(ReorderReport.from(result));
    }

    public record ReorderRequest(
            @NotBlank String recordName,
            @NotEmpty List<@NotBlank String> fieldsOrder,
            @NotEmpty List<@Valid SourceDTO> sources
    ) {
    }

    public record SourceDTO(@NotBlank String path, @NotNull String content) {
    }

    public record FilesRequest(
            @NotBlank String recordName,
            @NotEmpty List<@NotBlank String> fieldsOrder,
            @NotEmpty List<@NotBlank String> paths,
            boolean inPlace
    ) {
    }
}
