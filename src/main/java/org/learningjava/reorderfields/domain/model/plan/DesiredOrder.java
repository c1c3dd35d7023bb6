package org.learningjava.reorderfields.domain.model.plan;

import java.util.Arrays;
import java.util.List;

/**
 * Field names in the order the caller wants them declared.
 */
public record DesiredOrder(List<String> names) {

    public DesiredOrder {
        names = List.copyOf(names);
    }

    public static DesiredOrder of(String... names) {
        return new DesiredOrder(List.of(names));
    }

    /** Parses a comma separated list such as {@code "c, b,a"}. */
    public static DesiredOrder parse(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return new DesiredOrder(List.of());
        }
        return new DesiredOrder(Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
    }

    public int size() {
        return names.size();
    }
}
