package org.learningjava.reorderfields.infrastructure.adapter.out.fs;

import org.learningjava.reorderfields.application.port.SourceCorpusPort;
import org.learningjava.reorderfields.config.ReorderProperties;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads files and directory trees into a corpus keyed by the path as given. Directories
 * contribute the files whose extension is a configured source extension; files named
 * explicitly are always read.
 */
@Component
public class FileSystemSourceCorpus implements SourceCorpusPort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSourceCorpus.class);

    private final ReorderProperties properties;

    public FileSystemSourceCorpus(ReorderProperties properties) {
        this.properties = properties;
    }

    @Override
    public SourceCorpus read(List<Path> paths) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path p : paths) {
            if (Files.isDirectory(p)) {
                try (Stream<Path> s = Files.walk(p)) {
                    s.filter(Files::isRegularFile)
                            .filter(f -> properties.isSource(f.getFileName().toString()))
                            .sorted()
                            .forEach(files::add);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to walk " + p, e);
                }
            } else if (Files.isRegularFile(p)) {
                files.add(p);
            } else {
                throw new UncheckedIOException(new FileNotFoundException("No such file or directory: " + p));
            }
        }

        List<SourceFile> sources = new ArrayList<>();
        for (Path f : files) {
            sources.add(new SourceFile(f.toString(), readFile(f)));
            log.debug("Read {}", f);
        }
        return SourceCorpus.of(sources);
    }

    @Override
    public void write(Map<String, String> contents) {
        contents.forEach((path, text) -> {
            try {
                Files.writeString(Path.of(path), text, StandardCharsets.UTF_8);
                log.info("Rewrote {}", path);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + path, e);
            }
        });
    }

    private static String readFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
