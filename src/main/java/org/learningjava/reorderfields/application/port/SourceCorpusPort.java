package org.learningjava.reorderfields.application.port;

import org.learningjava.reorderfields.domain.model.source.SourceCorpus;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public interface SourceCorpusPort {
    SourceCorpus read(List<Path> paths); // files or directories

    void write(Map<String, String> contents);
}
