package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.source.RawToken;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Heuristic reading of one member declaration: where it ends, whether it declares data or a
 * function, and the names of its declarators. Works on any token list, so the same code
 * reads class bodies and macro expansions.
 */
final class Declarations {

    enum Kind { FIELD, FUNCTION, CONSTRUCTOR, DESTRUCTOR, SKIPPED }

    /**
     * Extent of a member.
     *
     * @param last       index of the last declaration token, before {@code ;} or the body
     * @param next       index where the following member starts
     * @param paren      first top-level parenthesis that opens a parameter list, or -1
     * @param initColon  the {@code :} starting a constructor initializer list, or -1
     * @param bodyOpen   the {@code {} of a function body, or -1
     */
    record Extent(int last, int next, int paren, int initColon, int bodyOpen) {
    }

    /** A declarator: its name ({@code ""} when unnamed) and its token span. */
    record Declarator(String name, int first, int last) {
    }

    /** One item of a constructor initializer list. */
    record InitItem(int nameFirst, int nameLast, int open, int close) {
    }

    private Declarations() {
    }

    static Extent extent(List<RawToken> toks, int from, int end) {
        int paren = -1;
        boolean assigned = false;
        int k = from;
        while (k < end) {
            RawToken t = toks.get(k);
            if (t.is(";")) {
                return new Extent(k - 1, k + 1, paren, -1, -1);
            }
            if (t.is("}")) {
                return new Extent(k - 1, k, paren, -1, -1);
            }
            if (t.is("(")) {
                int close = Tokens.closing(toks, k);
                if (!assigned && paren < 0) {
                    if (isPointerDeclarator(toks, k)) {
                        // (*fp)(int): the second group belongs to the pointed-to function type
                        if (Tokens.is(toks, close + 1, "(")) {
                            close = Tokens.closing(toks, close + 1);
                        }
                    } else if (isParameterList(toks, from, k)) {
                        paren = k;
                    }
                }
                k = close + 1;
                continue;
            }
            if (t.is("[")) {
                k = Tokens.closing(toks, k) + 1;
                continue;
            }
            if (t.is("=")) {
                assigned = true;
            } else if (t.is("<") && !assigned && Tokens.isIdentifier(toks, k - 1)) {
                int close = Tokens.closingAngle(toks, k);
                if (close > k) {
                    k = close + 1;
                    continue;
                }
            } else if (t.is(":") && paren >= 0 && !assigned) {
                List<InitItem> items = new ArrayList<>();
                int body = initializers(toks, k, end, items);
                if (body < end && toks.get(body).is("{")) {
                    return new Extent(k - 1, Tokens.closing(toks, body) + 1, paren, k, body);
                }
                k = body;
                continue;
            } else if (t.is("{")) {
                if (paren >= 0 && !assigned) {
                    return new Extent(k - 1, Tokens.closing(toks, k) + 1, paren, -1, k);
                }
                k = Tokens.closing(toks, k) + 1;
                continue;
            }
            k++;
        }
        return new Extent(end - 1, end, paren, -1, -1);
    }

    /**
     * Parses a constructor initializer list starting at the {@code :} and returns the index
     * of the token after the last item (the body brace when well formed).
     */
    static int initializers(List<RawToken> toks, int colon, int end, List<InitItem> items) {
        int k = colon + 1;
        while (k < end) {
            int nameFirst = k;
            if (Tokens.is(toks, k, "::")) k++;
            while (Tokens.isIdentifier(toks, k)) {
                k++;
                if (Tokens.is(toks, k, "<")) {
                    int close = Tokens.closingAngle(toks, k);
                    if (close == k) return k;
                    k = close + 1;
                }
                if (Tokens.is(toks, k, "::")) {
                    k++;
                } else {
                    break;
                }
            }
            if (k == nameFirst || !(Tokens.is(toks, k, "(") || Tokens.is(toks, k, "{"))) {
                return k;
            }
            int close = Tokens.closing(toks, k);
            if (close >= end) return end;
            items.add(new InitItem(nameFirst, k - 1, k, close));
            k = close + 1;
            if (Tokens.is(toks, k, "...")) k++;
            if (!Tokens.is(toks, k, ",")) {
                return k;
            }
            k++;
        }
        return end;
    }

    static Kind classify(List<RawToken> toks, int first, Extent extent, String recordName) {
        int stop = extent.paren >= 0 ? extent.paren : extent.last + 1;
        for (int k = first; k < stop; k++) {
            RawToken t = toks.get(k);
            if (t.is("(") || t.is("[") || t.is("{")) {
                k = Tokens.closing(toks, k);
                continue;
            }
            if (t.is("=")) break;
            switch (t.text()) {
                case "template", "typedef", "using", "friend", "static_assert", "static" -> {
                    return Kind.SKIPPED;
                }
                case "operator" -> {
                    return Kind.FUNCTION;
                }
                default -> {
                }
            }
        }
        if (extent.paren < 0) {
            return Kind.FIELD;
        }
        int nameIdx = extent.paren - 1;
        if (nameIdx >= first && toks.get(nameIdx).is(">")) {
            return Kind.FUNCTION;
        }
        if (Tokens.is(toks, nameIdx - 1, "~")) {
            return Kind.DESTRUCTOR;
        }
        if (nameIdx >= first && toks.get(nameIdx).is(recordName) && onlyConstructorSpecifiers(toks, first, nameIdx)) {
            return Kind.CONSTRUCTOR;
        }
        return Kind.FUNCTION;
    }

    static boolean hasVirtual(List<RawToken> toks, int first, int last) {
        for (int k = first; k <= last; k++) {
            if (toks.get(k).is("virtual")) return true;
            if (toks.get(k).is("(")) return false;
        }
        return false;
    }

    /** Declarators of a data member whose tokens span {@code [first, last]}. */
    static List<Declarator> declarators(List<RawToken> toks, int first, int last) {
        List<Declarator> out = new ArrayList<>();
        int segment = first;
        boolean assigned = false;
        for (int k = first; k <= last + 1; k++) {
            if (k == last + 1 || toks.get(k).is(",")) {
                Declarator d = declarator(toks, first, segment, k - 1);
                if (d != null) {
                    out.add(d);
                }
                segment = k + 1;
                assigned = false;
                continue;
            }
            RawToken t = toks.get(k);
            if (t.is("(") || t.is("[") || t.is("{")) {
                k = Tokens.closing(toks, k);
            } else if (t.is("=")) {
                assigned = true;
            } else if (t.is("<") && !assigned && Tokens.isIdentifier(toks, k - 1)) {
                int close = Tokens.closingAngle(toks, k);
                if (close > k) k = close;
            }
        }
        return out;
    }

    /** Declarator names of a declaration list such as {@code a, *b, c[3]} following a class body. */
    static List<Declarator> trailingDeclarators(List<RawToken> toks, int first, int last) {
        List<Declarator> out = new ArrayList<>();
        if (first > last) {
            return out;
        }
        int segment = first;
        for (int k = first; k <= last + 1; k++) {
            if (k == last + 1 || toks.get(k).is(",")) {
                String name = nameBefore(toks, segment, declaratorEnd(toks, segment, k - 1));
                if (name != null) {
                    out.add(new Declarator(name, segment, k - 1));
                }
                segment = k + 1;
                continue;
            }
            if (toks.get(k).is("(") || toks.get(k).is("[") || toks.get(k).is("{")) {
                k = Tokens.closing(toks, k);
            }
        }
        return out;
    }

    /** Last identifier of the first type spelled in {@code [from, to]}; {@code null} for builtin types. */
    static String typeName(List<RawToken> toks, int from, int to) {
        for (int k = from; k <= to; k++) {
            RawToken t = toks.get(k);
            if (t.is("[")) {
                k = Tokens.closing(toks, k);
                continue;
            }
            if (!t.isIdentifier() || Tokens.DECL_SPECIFIERS.contains(t.text())) continue;
            if (Tokens.BUILTIN_TYPES.contains(t.text())) return null;
            if (Tokens.is(toks, k + 1, "(")) {
                // alignas(...), __attribute__((...)) and attribute macros
                k = Tokens.closing(toks, k + 1);
                continue;
            }
            String name = t.text();
            while (true) {
                if (Tokens.is(toks, k + 1, "<")) {
                    int close = Tokens.closingAngle(toks, k + 1);
                    if (close == k + 1) break;
                    k = close;
                }
                if (Tokens.is(toks, k + 1, "::") && Tokens.isIdentifier(toks, k + 2)) {
                    k += 2;
                    name = toks.get(k).text();
                } else {
                    break;
                }
            }
            return name;
        }
        return null;
    }

    /** Shape of declarator {@code d} of a member whose type is {@code typeName}. */
    static FieldShape shape(List<RawToken> toks, String typeName, Declarator d) {
        int end = declaratorEnd(toks, d.first(), d.last());
        boolean indirect = functionPointerGroup(toks, d.first(), end) >= 0;
        int dimensions = 0;
        for (int k = d.first(); k < end; k++) {
            RawToken t = toks.get(k);
            if (t.is("*") || t.is("&") || t.is("&&")) {
                indirect = true;
            } else if (t.is("[")) {
                if (!Tokens.is(toks, k + 1, "[")) dimensions++;
                k = Tokens.closing(toks, k);
            } else if (t.is("(")) {
                k = Tokens.closing(toks, k);
            } else if (t.is("<") && Tokens.isIdentifier(toks, k - 1)) {
                int close = Tokens.closingAngle(toks, k);
                if (close > k) k = close;
            }
        }
        return new FieldShape(typeName, indirect, dimensions);
    }

    private static Declarator declarator(List<RawToken> toks, int memberFirst, int first, int last) {
        int end = declaratorEnd(toks, first, last);
        int pointerGroup = functionPointerGroup(toks, first, end);
        if (pointerGroup >= 0) {
            String name = lastIdentifierIn(toks, pointerGroup + 1, Tokens.closing(toks, pointerGroup) - 1);
            return new Declarator(name == null ? "" : name, first, last);
        }
        if (first == memberFirst && units(toks, first, end - 1) < 2) {
            // only a bit-field may go without a name
            return end <= last && toks.get(end).is(":") ? new Declarator("", first, last) : null;
        }
        String name = nameBefore(toks, first, end);
        return name == null ? null : new Declarator(name, first, last);
    }

    /**
     * Index just past the declarator name and array bounds: the first top-level {@code =},
     * {@code {}, bit-field {@code :} or trailing attribute macro.
     */
    private static int declaratorEnd(List<RawToken> toks, int first, int last) {
        for (int k = first; k <= last; k++) {
            RawToken t = toks.get(k);
            if (t.is("=") || t.is("{") || t.is(":")) {
                return k;
            }
            if (t.is("(")) {
                if (k > first && Tokens.isIdentifier(toks, k - 1) && Tokens.isAllCaps(toks.get(k - 1).text())
                        && units(toks, first, k - 2) >= 2) {
                    return k - 1;
                }
                k = Tokens.closing(toks, k);
            } else if (t.is("[")) {
                if (Tokens.is(toks, k + 1, "[") && k > first) {
                    return k;
                }
                k = Tokens.closing(toks, k);
            } else if (t.is("<") && Tokens.isIdentifier(toks, k - 1)) {
                int close = Tokens.closingAngle(toks, k);
                if (close > k) k = close;
            }
        }
        return last + 1;
    }

    private static String nameBefore(List<RawToken> toks, int first, int end) {
        int k = end - 1;
        while (k >= first && toks.get(k).is("]")) {
            k = openingBracket(toks, k, first) - 1;
        }
        if (k >= first && toks.get(k).isIdentifier()
                && !Tokens.DECL_SPECIFIERS.contains(toks.get(k).text())
                && !Tokens.BUILTIN_TYPES.contains(toks.get(k).text())) {
            return toks.get(k).text();
        }
        return null;
    }

    private static int functionPointerGroup(List<RawToken> toks, int first, int end) {
        for (int k = first; k < end; k++) {
            if (toks.get(k).is("(")) {
                if (isPointerDeclarator(toks, k)) return k;
                k = Tokens.closing(toks, k);
            } else if (toks.get(k).is("[")) {
                k = Tokens.closing(toks, k);
            }
        }
        return -1;
    }

    private static String lastIdentifierIn(List<RawToken> toks, int from, int to) {
        String name = null;
        for (int k = from; k <= to; k++) {
            if (toks.get(k).is("(") || toks.get(k).is("[")) {
                k = Tokens.closing(toks, k);
            } else if (toks.get(k).isIdentifier() && !Tokens.DECL_SPECIFIERS.contains(toks.get(k).text())
                    && !Tokens.is(toks, k + 1, "::")) {
                name = toks.get(k).text();
            }
        }
        return name;
    }

    /** Whether the parenthesis at {@code paren} opens a parameter list rather than a declarator or a macro. */
    static boolean isParameterList(List<RawToken> toks, int first, int paren) {
        if (isPointerDeclarator(toks, paren)) {
            return false;
        }
        int nameIdx = paren - 1;
        if (nameIdx > first && Tokens.isIdentifier(toks, nameIdx) && Tokens.isAllCaps(toks.get(nameIdx).text())
                && units(toks, first, nameIdx - 1) >= 2) {
            return false;
        }
        return true;
    }

    private static boolean isPointerDeclarator(List<RawToken> toks, int paren) {
        int k = paren + 1;
        if (Tokens.is(toks, k, "*") || Tokens.is(toks, k, "&") || Tokens.is(toks, k, "&&") || Tokens.is(toks, k, "^")) {
            return true;
        }
        while (Tokens.isIdentifier(toks, k) || Tokens.is(toks, k, "::")) {
            k++;
        }
        return k > paren + 1 && Tokens.is(toks, k, "*") && Tokens.is(toks, k - 1, "::");
    }

    /**
     * Number of type and name units in {@code [from, to]}: {@code unsigned long} is one unit,
     * {@code std::map<K, V>} is one unit, specifiers and attributes count for nothing.
     */
    static int units(List<RawToken> toks, int from, int to) {
        int count = 0;
        boolean builtinRun = false;
        for (int k = from; k <= to && k < toks.size(); k++) {
            RawToken t = toks.get(k);
            if (t.is("[") && Tokens.is(toks, k + 1, "[")) {
                k = Tokens.closing(toks, k);
                continue;
            }
            if (!t.isIdentifier()) {
                if (t.is("(") || t.is("[")) {
                    k = Tokens.closing(toks, k);
                }
                builtinRun = false;
                continue;
            }
            String text = t.text();
            if (Set.of("alignas", "_Alignas", "__attribute__", "__declspec", "decltype").contains(text)
                    && Tokens.is(toks, k + 1, "(")) {
                if (text.equals("decltype")) count++;
                k = Tokens.closing(toks, k + 1);
                builtinRun = false;
                continue;
            }
            if (Tokens.DECL_SPECIFIERS.contains(text)) {
                continue;
            }
            if (Tokens.BUILTIN_TYPES.contains(text)) {
                if (!builtinRun) count++;
                builtinRun = true;
                continue;
            }
            builtinRun = false;
            count++;
            while (true) {
                if (Tokens.is(toks, k + 1, "<")) {
                    int close = Tokens.closingAngle(toks, k + 1);
                    if (close == k + 1) break;
                    k = close;
                }
                if (Tokens.is(toks, k + 1, "::") && Tokens.isIdentifier(toks, k + 2)) {
                    k += 2;
                } else {
                    break;
                }
            }
        }
        return count;
    }

    /** Names of the parameters declared between {@code open} and its closing parenthesis. */
    static Set<String> parameterNames(List<RawToken> toks, int open) {
        Set<String> names = new LinkedHashSet<>();
        int close = Tokens.closing(toks, open);
        for (int[] segment : topLevelSegments(toks, open + 1, close - 1)) {
            int first = segment[0];
            int end = first;
            while (end <= segment[1] && !toks.get(end).is("=")) {
                end++;
            }
            int pointerGroup = functionPointerGroup(toks, first, end);
            String name = pointerGroup >= 0
                    ? lastIdentifierIn(toks, pointerGroup + 1, Tokens.closing(toks, pointerGroup) - 1)
                    : nameBefore(toks, first, end);
            if (name != null && (pointerGroup >= 0 || units(toks, first, end - 1) >= 2)) {
                names.add(name);
            }
        }
        return names;
    }

    /** Comma separated spans {@code [first, last]} of {@code [from, to]}, skipping nested brackets and template arguments. */
    static List<int[]> topLevelSegments(List<RawToken> toks, int from, int to) {
        List<int[]> out = new ArrayList<>();
        if (from > to) {
            return out;
        }
        int segment = from;
        for (int k = from; k <= to; k++) {
            RawToken t = toks.get(k);
            if (t.is(",")) {
                out.add(new int[]{segment, k - 1});
                segment = k + 1;
            } else if (t.is("(") || t.is("[") || t.is("{")) {
                k = Math.min(Tokens.closing(toks, k), to);
            } else if (t.is("<") && Tokens.isIdentifier(toks, k - 1)) {
                int angle = Tokens.closingAngle(toks, k);
                if (angle > k && angle <= to) k = angle;
            }
        }
        out.add(new int[]{segment, to});
        return out;
    }

    private static boolean onlyConstructorSpecifiers(List<RawToken> toks, int first, int nameIdx) {
        for (int k = first; k < nameIdx; k++) {
            RawToken t = toks.get(k);
            if (t.is("explicit") && Tokens.is(toks, k + 1, "(")) {
                k = Tokens.closing(toks, k + 1);
                continue;
            }
            if (t.is("[") && Tokens.is(toks, k + 1, "[")) {
                k = Tokens.closing(toks, k);
                continue;
            }
            if (!(t.is("explicit") || t.is("constexpr") || t.is("consteval") || t.is("inline")
                    || (t.isIdentifier() && Tokens.isAllCaps(t.text())))) {
                return false;
            }
        }
        return true;
    }

    private static int openingBracket(List<RawToken> toks, int close, int floor) {
        int depth = 0;
        for (int k = close; k >= floor; k--) {
            if (toks.get(k).is("]")) depth++;
            if (toks.get(k).is("[") && --depth == 0) return k;
        }
        return floor;
    }
}
