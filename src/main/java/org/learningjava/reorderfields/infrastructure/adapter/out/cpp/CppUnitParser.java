package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.record.AccessLevel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.RawTokenKind;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceLocation;
import org.learningjava.reorderfields.domain.model.source.SourceRange;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.Declarations.Declarator;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.Declarations.Extent;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.Declarations.InitItem;
import org.learningjava.reorderfields.infrastructure.adapter.out.cpp.MacroTable.Invocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent reader for the declarations of one C/C++ file. It understands enough of
 * the language to find record definitions with their fields, constructors and aliases; it
 * does not type-check and skips what it does not recognize.
 */
final class CppUnitParser {

    private static final Logger log = LoggerFactory.getLogger(CppUnitParser.class);

    private final SourceFile file;
    private final List<RawToken> toks;
    private final MacroTable macros;

    private final List<ParsedRecord> records = new ArrayList<>();
    private final List<RawConstructor> outOfLine = new ArrayList<>();
    private final Set<Integer> bodyBraces = new HashSet<>();
    private final List<ParsedUnit.Alias> aliases = new ArrayList<>();

    private CppUnitParser(SourceFile file, List<RawToken> codeTokens, MacroTable macros) {
        this.file = file;
        this.toks = codeTokens;
        this.macros = macros;
    }

    static ParsedUnit parse(SourceFile file, List<RawToken> codeTokens, MacroTable macros, boolean plainC) {
        CppUnitParser parser = new CppUnitParser(file, codeTokens, macros);
        parser.parseScope(0, codeTokens.size(), List.of());
        log.debug("{}: {} record(s), {} out-of-line constructor(s), {} alias(es)", file.path(),
                parser.records.size(), parser.outOfLine.size(), parser.aliases.size());
        return new ParsedUnit(file, plainC, codeTokens, parser.records, parser.outOfLine,
                parser.bodyBraces, parser.aliases);
    }

    // ---------- namespace and block scope ----------

    private void parseScope(int from, int to, List<String> scope) {
        int i = from;
        while (i < to) {
            RawToken t = toks.get(i);
            if (t.is("{")) {
                int close = Tokens.closing(toks, i);
                parseScope(i + 1, Math.min(close, to), scope);
                i = close + 1;
            } else if (!t.isIdentifier()) {
                i++;
            } else if (t.is("namespace")) {
                i = parseNamespace(i, to, scope);
            } else if (t.is("extern") && Tokens.is(toks, i + 2, "{") && toks.get(i + 1).kind() == RawTokenKind.STRING) {
                int close = Tokens.closing(toks, i + 2);
                parseScope(i + 3, Math.min(close, to), scope);
                i = close + 1;
            } else if (t.is("template")) {
                int angle = Tokens.is(toks, i + 1, "<") ? Tokens.closingAngle(toks, i + 1) : i;
                i = angle > i + 1 ? angle + 1 : i + 1;
            } else if (t.is("typedef")) {
                i = parseTypedef(i, to, scope);
            } else if (t.is("using")) {
                i = parseUsing(i, to);
            } else if (Tokens.CLASS_KEYS.contains(t.text()) || t.is("enum")) {
                Head head = parseHead(i, to);
                if (head.bodyOpen() < 0) {
                    i = Math.max(head.next(), i + 1);
                } else {
                    if (t.is("enum")) {
                        bodyBraces.add(toks.get(head.bodyOpen()).begin());
                    } else {
                        parseRecord(i, head, scope);
                    }
                    i = Tokens.closing(toks, head.bodyOpen()) + 1;
                }
            } else {
                int next = outOfLineConstructor(i, to, scope);
                i = next > i ? next : i + 1;
            }
        }
    }

    private int parseNamespace(int i, int to, List<String> scope) {
        List<String> names = new ArrayList<>(scope);
        int j = i + 1;
        while (j < to && (toks.get(j).isIdentifier() || toks.get(j).is("::"))) {
            if (toks.get(j).isIdentifier() && !toks.get(j).is("inline")) {
                names.add(toks.get(j).text());
            }
            j++;
        }
        j = Tokens.skipAttributes(toks, j, to);
        if (Tokens.is(toks, j, "{")) {
            int close = Tokens.closing(toks, j);
            parseScope(j + 1, Math.min(close, to), names);
            return close + 1;
        }
        return semicolon(j, to) + 1;
    }

    private int parseTypedef(int i, int to, List<String> scope) {
        int j = i + 1;
        while (Tokens.is(toks, j, "const") || Tokens.is(toks, j, "volatile")) {
            j++;
        }
        if (j < to && (Tokens.CLASS_KEYS.contains(toks.get(j).text()) || toks.get(j).is("enum"))) {
            Head head = parseHead(j, to);
            if (head.bodyOpen() >= 0) {
                ParsedRecord rec = null;
                if (toks.get(j).is("enum")) {
                    bodyBraces.add(toks.get(head.bodyOpen()).begin());
                } else {
                    rec = parseRecord(j, head, scope);
                }
                int close = Tokens.closing(toks, head.bodyOpen());
                int semi = semicolon(close + 1, to);
                for (Declarator d : Declarations.trailingDeclarators(toks, close + 1, semi - 1)) {
                    if (isPlainName(d.first(), d.last()) && rec != null) {
                        rec.nameFromTypedef(d.name());
                        if (!d.name().equals(rec.name())) {
                            aliases.add(new ParsedUnit.Alias(d.name(), rec.name()));
                        }
                    }
                }
                return semi + 1;
            }
        }
        int semi = semicolon(j, to);
        List<int[]> segments = Declarations.topLevelSegments(toks, j, semi - 1);
        String target = Declarations.typeName(toks, j, semi - 1);
        for (int s = 0; s < segments.size(); s++) {
            int[] seg = segments.get(s);
            int first = s == 0 ? j : seg[0];
            if (!isPlainName(first, seg[1]) || (s == 0 && Declarations.units(toks, first, seg[1]) < 2)) {
                continue;
            }
            RawToken name = toks.get(seg[1]);
            if (target != null && name.isIdentifier() && !name.is(target)) {
                aliases.add(new ParsedUnit.Alias(name.text(), target));
            }
        }
        return semi + 1;
    }

    private int parseUsing(int i, int to) {
        int semi = semicolon(i, to);
        if (Tokens.isIdentifier(toks, i + 1) && Tokens.is(toks, i + 2, "=") && isPlainName(i + 3, semi - 1)) {
            String target = Declarations.typeName(toks, i + 3, semi - 1);
            if (target != null) {
                aliases.add(new ParsedUnit.Alias(toks.get(i + 1).text(), target));
            }
        }
        return semi + 1;
    }

    /** No pointer, reference, array or function declarator in {@code [first, last]}. */
    private boolean isPlainName(int first, int last) {
        for (int k = first; k <= last; k++) {
            RawToken t = toks.get(k);
            if (t.is("*") || t.is("&") || t.is("&&") || t.is("(") || t.is("[")) return false;
            if (t.is("<")) {
                int close = Tokens.closingAngle(toks, k);
                if (close > k) k = close;
            }
        }
        return first <= last;
    }

    private int semicolon(int from, int to) {
        int k = from;
        while (k < to && !toks.get(k).is(";")) {
            if (toks.get(k).is("(") || toks.get(k).is("[") || toks.get(k).is("{")) {
                k = Tokens.closing(toks, k);
            }
            k++;
        }
        return Math.min(k, to);
    }

    // ---------- records ----------

    /**
     * Head of a class-key or {@code enum}: the name, optional qualifiers of an out-of-line
     * nested definition, and the body brace when this is a definition.
     */
    private record Head(String name, List<String> qualifiers, int bodyOpen, int baseColon, int next) {
    }

    private Head parseHead(int k, int to) {
        return parseHead(toks, k, to);
    }

    private static Head parseHead(List<RawToken> ts, int k, int to) {
        int j = k + 1;
        if (ts.get(k).is("enum") && (Tokens.is(ts, j, "class") || Tokens.is(ts, j, "struct"))) {
            j++;
        }
        j = Tokens.skipAttributes(ts, j, to);
        String name = "";
        List<String> qualifiers = List.of();
        List<String> chain = new ArrayList<>();
        while (j < to && ts.get(j).isIdentifier()) {
            if (ts.get(j).is("final") && (Tokens.is(ts, j + 1, "{") || Tokens.is(ts, j + 1, ":"))) {
                j++;
                break;
            }
            chain.add(ts.get(j).text());
            j++;
            if (Tokens.is(ts, j, "<")) {
                int close = Tokens.closingAngle(ts, j);
                if (close == j) break;
                j = close + 1;
            }
            if (Tokens.is(ts, j, "::")) {
                j++;
                continue;
            }
            // a name followed by another identifier was an export macro
            name = chain.get(chain.size() - 1);
            qualifiers = List.copyOf(chain.subList(0, chain.size() - 1));
            chain = new ArrayList<>();
            j = Tokens.skipAttributes(ts, j, to);
        }
        if (Tokens.is(ts, j, "{")) {
            return new Head(name, qualifiers, j, -1, j);
        }
        if (Tokens.is(ts, j, ":")) {
            for (int m = j + 1; m < to; m++) {
                RawToken t = ts.get(m);
                if (t.is("{")) return new Head(name, qualifiers, m, j, m);
                if (t.is(";") || t.is("}") || t.is("=")) break;
                if (t.is("(")) {
                    m = Tokens.closing(ts, m);
                } else if (t.is("<")) {
                    int close = Tokens.closingAngle(ts, m);
                    if (close > m) m = close;
                }
            }
        }
        return new Head(name, qualifiers, -1, -1, j);
    }

    private ParsedRecord parseRecord(int k, Head head, List<String> scope) {
        boolean isClass = toks.get(k).is("class");
        List<String> recordScope = new ArrayList<>(scope);
        recordScope.addAll(head.qualifiers());
        ParsedRecord rec = new ParsedRecord(head.name(), recordScope, file, toks.get(k).begin());
        records.add(rec);
        bodyBraces.add(toks.get(head.bodyOpen()).begin());

        if (head.baseColon() >= 0) {
            for (int[] base : Declarations.topLevelSegments(toks, head.baseColon() + 1, head.bodyOpen() - 1)) {
                AccessLevel access = isClass ? AccessLevel.PRIVATE : AccessLevel.PUBLIC;
                boolean virtual = false;
                for (int m = base[0]; m <= base[1]; m++) {
                    if (toks.get(m).is("virtual")) virtual = true;
                    if (AccessLevel.isKeyword(toks.get(m).text())) access = AccessLevel.fromKeyword(toks.get(m).text());
                }
                if (virtual || access != AccessLevel.PUBLIC) {
                    rec.markRestrictedBase();
                }
            }
        }

        int close = Tokens.closing(toks, head.bodyOpen());
        rec.end(close < toks.size() ? toks.get(close).end() : file.length());
        AccessLevel[] access = {isClass ? AccessLevel.PRIVATE : AccessLevel.PUBLIC};
        parseMembers(rec, toks, head.bodyOpen() + 1, Math.min(close, toks.size()), access, null);
        return rec;
    }

    /**
     * Reads the members of a class body, or of a macro expansion standing in a class body
     * when {@code expansion} is set.
     */
    private void parseMembers(ParsedRecord rec, List<RawToken> ts, int from, int to,
                              AccessLevel[] access, SourceRange expansion) {
        int i = from;
        while (i < to) {
            RawToken t = ts.get(i);
            if (t.is(";")) {
                i++;
                continue;
            }
            if (AccessLevel.isKeyword(t.text()) && Tokens.is(ts, i + 1, ":")) {
                access[0] = AccessLevel.fromKeyword(t.text());
                i += 2;
                continue;
            }
            if (expansion == null) {
                Invocation inv = macros.invocationAt(ts, i);
                if (inv != null && inv.last() < to && isMacroMember(ts, inv, to)) {
                    SourceRange range = new SourceRange(file.path(), ts.get(inv.first()).begin(), ts.get(inv.last()).end());
                    List<RawToken> expanded = synthesize(inv.expanded(), range);
                    log.debug("{}: member macro {} expands to {}", rec.qualifiedName(), inv.definition().name(), inv.expanded());
                    parseMembers(rec, expanded, 0, expanded.size(), access, range);
                    i = inv.last() + 1;
                    continue;
                }
            }
            int j = Tokens.skipAttributes(ts, i, to);
            if (j < to && (Tokens.CLASS_KEYS.contains(ts.get(j).text()) || ts.get(j).is("enum"))) {
                Head head = parseHead(ts, j, to);
                if (head.bodyOpen() >= 0) {
                    i = nestedDefinition(rec, ts, i, j, head, to, access[0], expansion);
                    continue;
                }
            }

            Extent extent = Declarations.extent(ts, i, to);
            switch (Declarations.classify(ts, i, extent, rec.name())) {
                case FIELD -> {
                    String type = Declarations.typeName(ts, i, extent.last());
                    for (Declarator d : Declarations.declarators(ts, i, extent.last())) {
                        addField(rec, ts, d.name(), access[0], ts.get(d.first()).begin(), ts.get(d.last()).end(),
                                i, expansion, Declarations.shape(ts, type, d));
                    }
                }
                case CONSTRUCTOR -> {
                    rec.markUserConstructor();
                    if (expansion == null && extent.bodyOpen() >= 0) {
                        rec.addConstructor(inClassConstructor(rec, i, extent, to));
                    }
                }
                case FUNCTION, DESTRUCTOR -> {
                    if (Declarations.hasVirtual(ts, i, extent.last())) {
                        rec.markVirtualFunction();
                    }
                }
                case SKIPPED -> {
                }
            }
            i = Math.max(extent.next(), i + 1);
        }
    }

    private static boolean isMacroMember(List<RawToken> ts, Invocation inv, int to) {
        int after = inv.last() + 1;
        return after >= to || ts.get(after).is(";") || inv.expanded().contains(";");
    }

    private int nestedDefinition(ParsedRecord rec, List<RawToken> ts, int i, int keyIdx, Head head, int to,
                                 AccessLevel access, SourceRange expansion) {
        boolean classKey = Tokens.CLASS_KEYS.contains(ts.get(keyIdx).text());
        if (expansion == null) {
            if (classKey) {
                List<String> scope = new ArrayList<>(rec.scope());
                if (!rec.name().isEmpty()) scope.add(rec.name());
                parseRecord(keyIdx, head, scope);
            } else {
                bodyBraces.add(ts.get(head.bodyOpen()).begin());
            }
        }
        int close = Math.min(Tokens.closing(ts, head.bodyOpen()), to);
        Extent rest = Declarations.extent(ts, close + 1, to);
        List<Declarator> declarators = Declarations.trailingDeclarators(ts, close + 1, rest.last());
        String type = head.name().isEmpty() ? null : head.name();
        for (Declarator d : declarators) {
            int begin = d == declarators.get(0) ? ts.get(i).begin() : ts.get(d.first()).begin();
            addField(rec, ts, d.name(), access, begin, ts.get(d.last()).end(), i, expansion,
                    Declarations.shape(ts, type, d));
        }
        if (declarators.isEmpty() && classKey && head.name().isEmpty() && close < ts.size()) {
            // anonymous struct or union member
            addField(rec, ts, "", access, ts.get(i).begin(), ts.get(close).end(), i, expansion, FieldShape.UNKNOWN);
        }
        return Math.max(rest.next(), close + 1);
    }

    private void addField(ParsedRecord rec, List<RawToken> ts, String name, AccessLevel access,
                          int begin, int end, int statementStart, SourceRange expansion, FieldShape shape) {
        if (expansion != null) {
            rec.addField(name, access, expansion,
                    SourceLocation.macroLocation(file.path(), expansion.begin(), statementStart), expansion, shape);
        } else {
            rec.addField(name, access, new SourceRange(file.path(), begin, end),
                    SourceLocation.fileLocation(file.path(), ts.get(statementStart).begin()), null, shape);
        }
    }

    /** Tokens standing for a macro expansion; all of them span the invocation. */
    private List<RawToken> synthesize(List<String> spellings, SourceRange invocation) {
        int line = file.line(invocation.begin());
        int column = file.column(invocation.begin());
        List<RawToken> out = new ArrayList<>(spellings.size());
        for (String s : spellings) {
            RawTokenKind kind;
            char c = s.isEmpty() ? ' ' : s.charAt(0);
            if (Character.isLetter(c) || c == '_' || c == '$') {
                kind = RawTokenKind.IDENTIFIER;
            } else if (Character.isDigit(c)) {
                kind = RawTokenKind.NUMBER;
            } else if (c == '"') {
                kind = RawTokenKind.STRING;
            } else if (c == '\'') {
                kind = RawTokenKind.CHAR;
            } else {
                kind = RawTokenKind.PUNCTUATOR;
            }
            out.add(new RawToken(kind, s, invocation.begin(), invocation.end(), line, column));
        }
        return out;
    }

    // ---------- constructors ----------

    private RawConstructor inClassConstructor(ParsedRecord rec, int i, Extent extent, int to) {
        List<InitItem> items = new ArrayList<>();
        if (extent.initColon() >= 0) {
            Declarations.initializers(toks, extent.initColon(), to, items);
        }
        int bodyClose = Math.min(extent.next() - 1, toks.size() - 1);
        return new RawConstructor(rec.name(), rec.scope(), file, toks.get(i).begin(), toks.get(bodyClose).end(),
                rawInitializers(items), Declarations.parameterNames(toks, extent.paren()));
    }

    /**
     * Recognizes {@code A::X::X(...) : ... {...}} at {@code i}. Returns the index after the
     * body, or -1 when the tokens are something else.
     */
    private int outOfLineConstructor(int i, int to, List<String> scope) {
        if (Tokens.is(toks, i - 1, "::") || Tokens.is(toks, i - 1, "~")
                || Tokens.is(toks, i - 1, ".") || Tokens.is(toks, i - 1, "->")) {
            return -1;
        }
        List<String> chain = new ArrayList<>();
        int j = i;
        while (Tokens.isIdentifier(toks, j)) {
            chain.add(toks.get(j).text());
            j++;
            if (Tokens.is(toks, j, "<")) {
                int close = Tokens.closingAngle(toks, j);
                if (close == j) return -1;
                j = close + 1;
            }
            if (Tokens.is(toks, j, "::") && Tokens.isIdentifier(toks, j + 1)) {
                j++;
                continue;
            }
            break;
        }
        int n = chain.size();
        if (n < 2 || !Tokens.is(toks, j, "(") || !chain.get(n - 1).equals(chain.get(n - 2))) {
            return -1;
        }
        int open = j;
        int close = Tokens.closing(toks, open);
        int k = close + 1;
        while (k < to && !(toks.get(k).is(":") || toks.get(k).is("{") || toks.get(k).is(";"))) {
            k = toks.get(k).is("(") ? Tokens.closing(toks, k) + 1 : k + 1;
        }
        if (k >= to || toks.get(k).is(";")) {
            return -1;
        }
        List<InitItem> items = new ArrayList<>();
        int body = toks.get(k).is(":") ? Declarations.initializers(toks, k, to, items) : k;
        if (!Tokens.is(toks, body, "{")) {
            return -1;
        }
        int bodyClose = Math.min(Tokens.closing(toks, body), toks.size() - 1);
        List<String> ctorScope = new ArrayList<>(scope);
        ctorScope.addAll(chain.subList(0, n - 2));
        outOfLine.add(new RawConstructor(chain.get(n - 1), ctorScope, file, toks.get(i).begin(),
                toks.get(bodyClose).end(), rawInitializers(items), Declarations.parameterNames(toks, open)));
        return bodyClose + 1;
    }

    private List<RawInitializer> rawInitializers(List<InitItem> items) {
        List<RawInitializer> out = new ArrayList<>(items.size());
        for (InitItem item : items) {
            StringBuilder name = new StringBuilder();
            for (int k = item.nameFirst(); k <= item.nameLast(); k++) {
                name.append(toks.get(k).text());
            }
            String simple = item.nameFirst() == item.nameLast() ? name.toString() : null;
            out.add(new RawInitializer(name.toString(), simple, toks.get(item.nameFirst()).begin(),
                    toks.get(item.close()).end(), toks.subList(item.open() + 1, item.close())));
        }
        return out;
    }
}
