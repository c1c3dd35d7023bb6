package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.record.AggregateInitModel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.RawTokenKind;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds brace initializers of one record type in a file:
 * {@code T v = {...}}, {@code T v{...}}, the braced elements of {@code T v[] = {{...}, {...}}},
 * {@code T{...}}, compound literals {@code (struct T){...}} and {@code return {...};} in a
 * function returning {@code T}. Lists of aggregates holding {@code T} by value are followed
 * field by field to the nested lists of {@code T}.
 */
final class AggregateInitScanner {

    private final ParsedUnit unit;
    private final List<RawToken> toks;
    private final AggregateTypes types;
    private final Set<Integer> seen = new HashSet<>();
    private final List<AggregateInitModel> found = new ArrayList<>();

    private AggregateInitScanner(ParsedUnit unit, AggregateTypes types) {
        this.unit = unit;
        this.toks = unit.codeTokens();
        this.types = types;
    }

    static List<AggregateInitModel> scan(ParsedUnit unit, AggregateTypes types) {
        AggregateInitScanner scanner = new AggregateInitScanner(unit, types);
        scanner.run();
        return scanner.found;
    }

    private void run() {
        for (int t = 0; t < toks.size(); t++) {
            RawToken tok = toks.get(t);
            if (!tok.isIdentifier() || !types.contains(tok.text()) || Tokens.is(toks, t - 1, ".")) {
                continue;
            }
            String type = tok.text();
            if (Tokens.is(toks, t - 1, "->")) {
                // auto f() -> T {...}
                if (Tokens.is(toks, t - 2, ")") && Tokens.is(toks, t + 1, "{")) {
                    returns(t + 1, type);
                }
                continue;
            }
            if (Tokens.is(toks, t + 1, "{")) {
                typed(t + 1, type);
            } else if (Tokens.is(toks, t + 1, ")") && Tokens.is(toks, t + 2, "{")) {
                int p = t - 1;
                if (Tokens.is(toks, p, "struct") || Tokens.is(toks, p, "union")) p--;
                if (Tokens.is(toks, p, "(")) {
                    typed(t + 2, type);
                }
            } else {
                declarations(t + 1, type);
            }
        }
    }

    private void declarations(int k, String type) {
        while (k < toks.size()) {
            boolean indirect = false;
            while (Tokens.is(toks, k, "*") || Tokens.is(toks, k, "&") || Tokens.is(toks, k, "&&")
                    || Tokens.is(toks, k, "const") || Tokens.is(toks, k, "volatile")) {
                if (!toks.get(k).is("const") && !toks.get(k).is("volatile")) indirect = true;
                k++;
            }
            if (!Tokens.isIdentifier(toks, k)) {
                return;
            }
            k++;
            while (Tokens.is(toks, k, "::") && Tokens.isIdentifier(toks, k + 1)) {
                k += 2;
            }
            int dimensions = 0;
            while (Tokens.is(toks, k, "[")) {
                dimensions++;
                k = Tokens.closing(toks, k) + 1;
            }
            int brace = Tokens.is(toks, k, "=") && Tokens.is(toks, k + 1, "{") ? k + 1
                    : Tokens.is(toks, k, "{") ? k : -1;
            if (brace >= 0) {
                if (!indirect) {
                    if (dimensions == 0) {
                        typed(brace, type);
                    } else {
                        typedElements(brace, dimensions, type);
                    }
                }
                k = Tokens.closing(toks, brace) + 1;
            } else if (Tokens.is(toks, k, "=")) {
                k = skipExpression(k + 1);
            } else if (Tokens.is(toks, k, "(")) {
                int close = Tokens.closing(toks, k);
                int body = functionBody(close + 1);
                if (body >= 0) {
                    if (!indirect && dimensions == 0) {
                        returns(body, type);
                    }
                    return;
                }
                k = close + 1;
            }
            if (!Tokens.is(toks, k, ",")) {
                return;
            }
            k++;
        }
    }

    /** The body brace when {@code k} follows the parameter list of a function definition, else -1. */
    private int functionBody(int k) {
        while (k < toks.size()) {
            RawToken t = toks.get(k);
            if (t.is("noexcept") || t.is("throw")) {
                k = Tokens.is(toks, k + 1, "(") ? Tokens.closing(toks, k + 1) + 1 : k + 1;
            } else if (t.is("const") || t.is("volatile") || t.is("override") || t.is("final")
                    || t.is("&") || t.is("&&")) {
                k++;
            } else {
                return t.is("{") ? k : -1;
            }
        }
        return -1;
    }

    /** {@code return {...};} statements of the function body opening at {@code body}. */
    private void returns(int body, String type) {
        int close = Math.min(Tokens.closing(toks, body), toks.size());
        for (int k = body + 1; k < close; k++) {
            if (toks.get(k).is("return") && Tokens.is(toks, k + 1, "{")) {
                typed(k + 1, type);
            }
        }
    }

    private int skipExpression(int k) {
        while (k < toks.size() && !toks.get(k).is(",") && !toks.get(k).is(";")) {
            if (toks.get(k).is("(") || toks.get(k).is("[") || toks.get(k).is("{")) {
                k = Tokens.closing(toks, k);
            }
            k++;
        }
        return k;
    }

    /** A brace list whose type is {@code type}, either the record or an aggregate holding it. */
    private void typed(int brace, String type) {
        int begin = toks.get(brace).begin();
        if (unit.bodyBraces().contains(begin) || !seen.add(begin)) {
            return;
        }
        int close = Tokens.closing(toks, brace);
        if (close >= toks.size()) {
            return;
        }
        if (types.isTarget(type)) {
            add(brace, close);
            return;
        }
        ParsedRecord container = types.container(type);
        if (container != null) {
            members(brace, close, container);
        }
    }

    private void typedElements(int brace, int dimensions, String type) {
        int close = Tokens.closing(toks, brace);
        if (close >= toks.size()) {
            return;
        }
        for (int[] element : elements(brace, close)) {
            if (isBraced(element[0], element[1])) {
                if (dimensions > 1) {
                    typedElements(element[0], dimensions - 1, type);
                } else {
                    typed(element[0], type);
                }
            } else if (isLiteral(element[0])) {
                throw elided(brace, type);
            }
        }
    }

    /** Walks the list of {@code container} and follows the elements of fields holding the record. */
    private void members(int brace, int close, ParsedRecord container) {
        List<FieldShape> shapes = container.shapes();
        int index = 0;
        for (int[] element : elements(brace, close)) {
            int start = element[0];
            if (Tokens.is(toks, start, ".") && Tokens.isIdentifier(toks, start + 1)) {
                index = container.indexOf(toks.get(start + 1).text());
                start += Tokens.is(toks, start + 2, "=") ? 3 : 2;
                if (index < 0 || start > element[1]) {
                    return;
                }
            }
            if (index >= shapes.size()) {
                throw elided(brace, container.name());
            }
            FieldShape shape = shapes.get(index);
            if (shape.typeName() != null && !shape.indirect() && types.contains(shape.typeName())) {
                if (isBraced(start, element[1])) {
                    if (shape.dimensions() == 0) {
                        typed(start, shape.typeName());
                    } else {
                        typedElements(start, shape.dimensions(), shape.typeName());
                    }
                } else if (isLiteral(start)) {
                    throw elided(brace, container.name());
                }
            }
            index++;
        }
    }

    private boolean isBraced(int first, int last) {
        return toks.get(first).is("{") && Tokens.closing(toks, first) == last;
    }

    /** A scalar literal where a whole record value belongs means braces were elided. */
    private boolean isLiteral(int first) {
        int k = Tokens.is(toks, first, "-") || Tokens.is(toks, first, "+") ? first + 1 : first;
        if (k >= toks.size()) {
            return false;
        }
        RawTokenKind kind = toks.get(k).kind();
        return kind == RawTokenKind.NUMBER || kind == RawTokenKind.STRING || kind == RawTokenKind.CHAR;
    }

    private ReorderException elided(int brace, String type) {
        int offset = toks.get(brace).begin();
        return new ReorderException(ReorderErrorKind.BRACE_ELISION_UNSUPPORTED,
                "Initializer of " + type + " at " + unit.file().path() + ":" + unit.file().line(offset)
                        + " omits the braces of a nested record; brace its elements to reorder");
    }

    private void add(int brace, int close) {
        String path = unit.file().path();
        List<SourceRange> initializers = new ArrayList<>();
        for (int[] element : elements(brace, close)) {
            initializers.add(new SourceRange(path, toks.get(element[0]).begin(), toks.get(element[1]).end()));
        }
        found.add(new AggregateInitModel(unit.file(),
                new SourceRange(path, toks.get(brace).begin(), toks.get(close).end()), true, initializers));
    }

    /** Top-level elements between a brace pair; a trailing comma adds no element. */
    private List<int[]> elements(int open, int close) {
        List<int[]> out = new ArrayList<>();
        int start = open + 1;
        for (int k = open + 1; k <= close; k++) {
            RawToken t = toks.get(k);
            if (k == close || t.is(",")) {
                if (start <= k - 1) {
                    out.add(new int[]{start, k - 1});
                }
                start = k + 1;
            } else if (t.is("(") || t.is("[") || t.is("{")) {
                k = Tokens.closing(toks, k);
            }
        }
        return out;
    }
}
