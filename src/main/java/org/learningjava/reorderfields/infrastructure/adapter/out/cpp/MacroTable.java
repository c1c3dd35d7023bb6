package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.source.RawToken;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Macros defined anywhere in the corpus, with a token-level expander. Later definitions of
 * the same name win; {@code #undef} is not tracked.
 */
final class MacroTable {

    private static final int MAX_DEPTH = 32;

    private final Map<String, MacroDefinition> macros;

    private MacroTable(Map<String, MacroDefinition> macros) {
        this.macros = macros;
    }

    static MacroTable of(Collection<MacroDefinition> definitions) {
        Map<String, MacroDefinition> byName = new LinkedHashMap<>();
        for (MacroDefinition d : definitions) {
            byName.put(d.name(), d);
        }
        return new MacroTable(byName);
    }

    /**
     * The invocation starting at code token {@code i}, or {@code null} when the token is not a
     * macro name or a function-like macro is named without arguments.
     */
    Invocation invocationAt(List<RawToken> toks, int i) {
        if (!Tokens.isIdentifier(toks, i)) {
            return null;
        }
        MacroDefinition def = macros.get(toks.get(i).text());
        if (def == null) {
            return null;
        }
        if (!def.isFunctionLike()) {
            return new Invocation(def, i, i, expand(def, List.of(), new HashSet<>(), 0));
        }
        if (!Tokens.is(toks, i + 1, "(")) {
            return null;
        }
        int close = Tokens.closing(toks, i + 1);
        if (close >= toks.size()) {
            return null;
        }
        List<String> argTokens = new ArrayList<>();
        for (int k = i + 2; k < close; k++) {
            argTokens.add(toks.get(k).text());
        }
        return new Invocation(def, i, close, expand(def, splitArgs(argTokens), new HashSet<>(), 0));
    }

    private List<String> expand(MacroDefinition def, List<List<String>> args, Set<String> active, int depth) {
        if (depth > MAX_DEPTH) {
            return List.of(def.name());
        }
        List<String> substituted = substitute(def, args);
        Set<String> nested = new HashSet<>(active);
        nested.add(def.name());
        return rescan(paste(substituted), nested, depth + 1);
    }

    private List<String> substitute(MacroDefinition def, List<List<String>> args) {
        List<String> body = def.body();
        if (!def.isFunctionLike()) {
            return new ArrayList<>(body);
        }
        List<String> out = new ArrayList<>();
        for (int k = 0; k < body.size(); k++) {
            String t = body.get(k);
            if (t.equals("#") && k + 1 < body.size() && def.params().contains(body.get(k + 1))) {
                out.add(stringify(argument(def, args, body.get(k + 1))));
                k++;
            } else if (def.params().contains(t)) {
                out.addAll(argument(def, args, t));
            } else {
                out.add(t);
            }
        }
        return out;
    }

    private static List<String> argument(MacroDefinition def, List<List<String>> args, String param) {
        int index = def.params().indexOf(param);
        if (param.equals(MacroDefinition.VA_ARGS) && def.isVariadic()) {
            List<String> rest = new ArrayList<>();
            for (int k = index; k < args.size(); k++) {
                if (k > index) rest.add(",");
                rest.addAll(args.get(k));
            }
            return rest;
        }
        return index < args.size() ? args.get(index) : List.of();
    }

    private static List<String> paste(List<String> tokens) {
        List<String> out = new ArrayList<>();
        for (int k = 0; k < tokens.size(); k++) {
            String t = tokens.get(k);
            if (t.equals("##") && !out.isEmpty() && k + 1 < tokens.size()) {
                String left = out.remove(out.size() - 1);
                out.add(left + tokens.get(k + 1));
                k++;
            } else if (!t.equals("##")) {
                out.add(t);
            }
        }
        return out;
    }

    private List<String> rescan(List<String> tokens, Set<String> active, int depth) {
        List<String> out = new ArrayList<>();
        for (int k = 0; k < tokens.size(); k++) {
            String t = tokens.get(k);
            MacroDefinition def = macros.get(t);
            if (def == null || active.contains(t)) {
                out.add(t);
                continue;
            }
            if (!def.isFunctionLike()) {
                out.addAll(expand(def, List.of(), active, depth));
                continue;
            }
            if (k + 1 >= tokens.size() || !tokens.get(k + 1).equals("(")) {
                out.add(t);
                continue;
            }
            int close = closing(tokens, k + 1);
            if (close < 0) {
                out.add(t);
                continue;
            }
            out.addAll(expand(def, splitArgs(tokens.subList(k + 2, close)), active, depth));
            k = close;
        }
        return out;
    }

    static List<List<String>> splitArgs(List<String> tokens) {
        List<List<String>> args = new ArrayList<>();
        if (tokens.isEmpty()) {
            return args;
        }
        List<String> current = new ArrayList<>();
        int depth = 0;
        for (String t : tokens) {
            if (depth == 0 && t.equals(",")) {
                args.add(current);
                current = new ArrayList<>();
                continue;
            }
            if (t.equals("(") || t.equals("[") || t.equals("{")) depth++;
            if (t.equals(")") || t.equals("]") || t.equals("}")) depth--;
            current.add(t);
        }
        args.add(current);
        return args;
    }

    private static int closing(List<String> tokens, int open) {
        int depth = 0;
        for (int k = open; k < tokens.size(); k++) {
            if (tokens.get(k).equals("(")) depth++;
            if (tokens.get(k).equals(")") && --depth == 0) return k;
        }
        return -1;
    }

    private static String stringify(List<String> arg) {
        String joined = String.join(" ", arg);
        return "\"" + joined.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * One macro use in the code.
     *
     * @param first    index of the macro name token
     * @param last     index of the closing parenthesis, or of the name for object-like macros
     * @param expanded spellings of the fully expanded replacement
     */
    record Invocation(MacroDefinition definition, int first, int last, List<String> expanded) {

        Invocation {
            expanded = List.copyOf(expanded);
        }
    }
}
