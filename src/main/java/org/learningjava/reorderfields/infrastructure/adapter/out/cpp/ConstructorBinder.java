package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.record.ConstructorModel;
import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.record.InitializerModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the clauses of a constructor against the fields of its record.
 */
final class ConstructorBinder {

    private ConstructorBinder() {
    }

    static ConstructorModel bind(RawConstructor raw, RecordModel record) {
        Map<String, FieldModel> fields = new HashMap<>();
        for (FieldModel f : record.fields()) {
            if (!f.name().isEmpty()) {
                fields.put(f.name(), f);
            }
        }
        String path = raw.file().path();
        List<InitializerModel> initializers = new ArrayList<>();
        for (RawInitializer init : raw.initializers()) {
            FieldModel target = init.simpleName() == null ? null : fields.get(init.simpleName());
            List<FieldModel> used = target == null
                    ? List.of()
                    : usedFields(init.expression(), fields, raw.paramNames());
            initializers.add(new InitializerModel(init.name(), target,
                    new SourceRange(path, init.begin(), init.end()), true, used));
        }
        return new ConstructorModel(raw.qualifiedName(), raw.file(), new SourceRange(path, raw.begin(), raw.end()),
                false, initializers);
    }

    /**
     * Fields of this object read by an initializer expression: {@code this->f}, {@code (*this).f},
     * or a bare {@code f} that no parameter shadows. Members of other objects ({@code o.f},
     * {@code p->f}) and qualified names are not fields of this object.
     */
    static List<FieldModel> usedFields(List<RawToken> expr, Map<String, FieldModel> fields, Set<String> params) {
        Map<Integer, FieldModel> used = new LinkedHashMap<>();
        for (int k = 0; k < expr.size(); k++) {
            RawToken t = expr.get(k);
            if (t.is("this") && Tokens.is(expr, k + 1, "->") && Tokens.isIdentifier(expr, k + 2)) {
                addIfField(used, fields, expr.get(k + 2).text());
                k += 2;
            } else if (t.is("(") && Tokens.is(expr, k + 1, "*") && Tokens.is(expr, k + 2, "this")
                    && Tokens.is(expr, k + 3, ")") && Tokens.is(expr, k + 4, ".") && Tokens.isIdentifier(expr, k + 5)) {
                addIfField(used, fields, expr.get(k + 5).text());
                k += 5;
            } else if (t.isIdentifier()
                    && !Tokens.is(expr, k - 1, ".") && !Tokens.is(expr, k - 1, "->") && !Tokens.is(expr, k - 1, "::")
                    && !Tokens.is(expr, k + 1, "::")
                    && !params.contains(t.text())) {
                addIfField(used, fields, t.text());
            }
        }
        return new ArrayList<>(used.values());
    }

    private static void addIfField(Map<Integer, FieldModel> used, Map<String, FieldModel> fields, String name) {
        FieldModel f = fields.get(name);
        if (f != null) {
            used.putIfAbsent(f.index(), f);
        }
    }
}
