package org.learningjava.reorderfields.domain.model.record;

import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A record definition: its fields in declaration order plus the capabilities the
 * orchestration needs, resolved once by the source model.
 *
 * @param name            simple name, or the typedef name of an anonymous record
 * @param qualifiedName   name including enclosing namespaces and classes
 * @param file            file holding the definition (all fields live there)
 * @param definition      range from the class-key to the closing brace
 * @param fields          fields in declaration order
 * @param hasConstructors whether any constructor is user-declared
 * @param isAggregate     whether brace initialization is positional over the fields
 * @param aliases         typedef / alias-declaration names referring to this record
 */
public record RecordModel(
        String name,
        String qualifiedName,
        SourceFile file,
        SourceRange definition,
        List<FieldModel> fields,
        boolean hasConstructors,
        boolean isAggregate,
        Set<String> aliases
) {

    public RecordModel {
        fields = List.copyOf(fields);
        aliases = Set.copyOf(aliases);
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).index() != i) {
                throw new IllegalArgumentException("Field " + fields.get(i).name()
                        + " has index " + fields.get(i).index() + " but is declared at position " + i);
            }
        }
    }

    public int fieldCount() {
        return fields.size();
    }

    public FieldModel field(int index) {
        return fields.get(index);
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldModel::name).toList();
    }

    /** Names under which an initializer of this record can be spelled. */
    public Set<String> typeNames() {
        Set<String> names = new LinkedHashSet<>();
        if (!name.isEmpty()) {
            names.add(name);
        }
        names.addAll(aliases);
        return names;
    }
}
