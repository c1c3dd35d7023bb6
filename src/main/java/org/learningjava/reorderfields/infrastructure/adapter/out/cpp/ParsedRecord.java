package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.record.AccessLevel;
import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceLocation;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A record definition as collected by {@link CppUnitParser}, before it becomes a
 * {@link RecordModel}.
 */
final class ParsedRecord {

    private final List<String> scope;
    private final SourceFile file;
    private final int begin;
    private String name;
    private int end;
    private final List<FieldModel> fields = new ArrayList<>();
    private final List<FieldShape> shapes = new ArrayList<>();
    private final List<RawConstructor> constructors = new ArrayList<>();
    private boolean userConstructors;
    private boolean virtualFunctions;
    private boolean restrictedBases;

    ParsedRecord(String name, List<String> scope, SourceFile file, int begin) {
        this.name = name;
        this.scope = List.copyOf(scope);
        this.file = file;
        this.begin = begin;
    }

    String name() {
        return name;
    }

    /** Gives an anonymous record the name it is declared with by {@code typedef}. */
    void nameFromTypedef(String typedefName) {
        if (name.isEmpty()) {
            name = typedefName;
        }
    }

    List<String> scope() {
        return scope;
    }

    String qualifiedName() {
        return scope.isEmpty() ? name : String.join("::", scope) + "::" + name;
    }

    SourceFile file() {
        return file;
    }

    int begin() {
        return begin;
    }

    void end(int end) {
        this.end = end;
    }

    void addField(String fieldName, AccessLevel access, SourceRange range,
                  SourceLocation typeLocation, SourceRange macroExpansion, FieldShape shape) {
        fields.add(new FieldModel(fieldName, fields.size(), access, range, typeLocation, macroExpansion));
        shapes.add(shape);
    }

    List<FieldModel> fields() {
        return fields;
    }

    /** Shapes of {@link #fields()}, index for index. */
    List<FieldShape> shapes() {
        return shapes;
    }

    /** Index of the field named {@code fieldName}, or -1. */
    int indexOf(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(fieldName)) return i;
        }
        return -1;
    }

    void addConstructor(RawConstructor ctor) {
        constructors.add(ctor);
    }

    List<RawConstructor> constructors() {
        return constructors;
    }

    void markUserConstructor() {
        userConstructors = true;
    }

    void markVirtualFunction() {
        virtualFunctions = true;
    }

    void markRestrictedBase() {
        restrictedBases = true;
    }

    boolean isAggregate(boolean plainC) {
        return plainC || (!userConstructors && !virtualFunctions && !restrictedBases
                && fields.stream().allMatch(f -> f.access() == AccessLevel.PUBLIC));
    }

    RecordModel toModel(boolean plainC, Set<String> aliases) {
        return new RecordModel(name, qualifiedName(), file, new SourceRange(file.path(), begin, end),
                fields, !plainC && userConstructors, isAggregate(plainC), aliases);
    }
}
