package org.learningjava.reorderfields.domain.model.plan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable set of text replacements grouped by file. Each component returns its own plan and
 * the orchestration merges them; nothing is shared or mutated between components.
 * Identical replacements collapse into one; overlapping ones are kept and left for the
 * text editor to reject.
 */
public final class ReplacementPlan {

    private static final Comparator<Replacement> BY_POSITION = Comparator
            .comparingInt((Replacement r) -> r.range().begin())
            .thenComparingInt(r -> r.range().end())
            .thenComparing(Replacement::text);

    private static final ReplacementPlan EMPTY = new ReplacementPlan(Map.of());

    private final Map<String, List<Replacement>> byFile;

    private ReplacementPlan(Map<String, List<Replacement>> byFile) {
        this.byFile = byFile;
    }

    public static ReplacementPlan empty() {
        return EMPTY;
    }

    public static ReplacementPlan of(Collection<Replacement> replacements) {
        if (replacements.isEmpty()) {
            return EMPTY;
        }
        Map<String, Set<Replacement>> sorted = new TreeMap<>();
        for (Replacement r : replacements) {
            sorted.computeIfAbsent(r.file(), f -> new TreeSet<>(BY_POSITION)).add(r);
        }
        Map<String, List<Replacement>> frozen = new TreeMap<>();
        sorted.forEach((file, set) -> frozen.put(file, List.copyOf(set)));
        return new ReplacementPlan(Collections.unmodifiableMap(frozen));
    }

    public ReplacementPlan merge(ReplacementPlan other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<Replacement> all = new ArrayList<>(all());
        all.addAll(other.all());
        return of(all);
    }

    public Set<String> files() {
        return byFile.keySet();
    }

    public List<Replacement> replacementsFor(String file) {
        return byFile.getOrDefault(file, List.of());
    }

    public List<Replacement> all() {
        List<Replacement> all = new ArrayList<>();
        byFile.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return byFile.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return byFile.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReplacementPlan other)) return false;
        return byFile.equals(other.byFile);
    }

    @Override
    public int hashCode() {
        return byFile.hashCode();
    }

    @Override
    public String toString() {
        return "ReplacementPlan" + byFile;
    }
}
