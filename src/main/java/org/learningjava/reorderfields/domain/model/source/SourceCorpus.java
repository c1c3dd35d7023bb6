package org.learningjava.reorderfields.domain.model.source;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of files one reorder request works on, keyed by path in input order.
 */
public final class SourceCorpus {

    private final Map<String, SourceFile> files;

    private SourceCorpus(Map<String, SourceFile> files) {
        this.files = Collections.unmodifiableMap(files);
    }

    public static SourceCorpus of(Collection<SourceFile> files) {
        Map<String, SourceFile> byPath = new LinkedHashMap<>();
        for (SourceFile f : files) {
            if (byPath.putIfAbsent(f.path(), f) != null) {
                throw new IllegalArgumentException("Duplicate file in corpus: " + f.path());
            }
        }
        return new SourceCorpus(byPath);
    }

    public static SourceCorpus of(SourceFile... files) {
        return of(List.of(files));
    }

    public SourceFile file(String path) {
        SourceFile f = files.get(path);
        if (f == null) {
            throw new IllegalArgumentException("Unknown file: " + path);
        }
        return f;
    }

    public boolean contains(String path) {
        return files.containsKey(path);
    }

    public Collection<SourceFile> files() {
        return files.values();
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
