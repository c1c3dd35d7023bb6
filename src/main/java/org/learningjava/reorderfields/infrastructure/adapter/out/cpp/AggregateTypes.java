package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.CppCorpusParser.ParsedCorpus;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Type names whose brace lists can hold an initializer of one record: the record with its
 * aliases, and every aggregate that holds it by value, directly or through another such
 * aggregate.
 */
final class AggregateTypes {

    private final Set<String> target;
    private final Map<String, ParsedRecord> containers;

    private AggregateTypes(Set<String> target, Map<String, ParsedRecord> containers) {
        this.target = Set.copyOf(target);
        this.containers = containers;
    }

    static AggregateTypes of(RecordModel record, ParsedCorpus corpus) {
        Set<String> known = new HashSet<>(record.typeNames());
        Map<String, ParsedRecord> containers = new LinkedHashMap<>();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (ParsedUnit unit : corpus.units()) {
                for (ParsedRecord rec : unit.records()) {
                    if (rec.name().isEmpty() || known.contains(rec.name()) || !rec.isAggregate(unit.plainC())) {
                        continue;
                    }
                    if (rec.shapes().stream().anyMatch(s -> s.holdsValueOf(known))) {
                        Set<String> names = new HashSet<>(corpus.aliasesOf(rec.name()));
                        names.add(rec.name());
                        for (String name : names) {
                            known.add(name);
                            containers.putIfAbsent(name, rec);
                        }
                        grew = true;
                    }
                }
            }
        }
        return new AggregateTypes(record.typeNames(), containers);
    }

    boolean isTarget(String name) {
        return target.contains(name);
    }

    /** The aggregate named {@code name} that holds the record, or {@code null}. */
    ParsedRecord container(String name) {
        return containers.get(name);
    }

    boolean contains(String name) {
        return target.contains(name) || containers.containsKey(name);
    }

    Set<String> names() {
        Set<String> names = new HashSet<>(target);
        names.addAll(containers.keySet());
        return names;
    }
}
