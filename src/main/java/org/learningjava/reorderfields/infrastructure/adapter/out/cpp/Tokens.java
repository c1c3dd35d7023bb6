package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.source.RawToken;

import java.util.List;
import java.util.Set;

/**
 * Bracket matching and keyword classes over code tokens (comments and directives removed).
 */
final class Tokens {

    static final Set<String> CLASS_KEYS = Set.of("struct", "class", "union");

    static final Set<String> BUILTIN_TYPES = Set.of(
            "void", "bool", "_Bool", "char", "char8_t", "char16_t", "char32_t", "wchar_t",
            "short", "int", "long", "signed", "unsigned", "float", "double", "__int128", "auto"
    );

    /** Specifiers and qualifiers that are neither a type name nor a declarator name. */
    static final Set<String> DECL_SPECIFIERS = Set.of(
            "const", "volatile", "mutable", "constexpr", "constinit", "inline", "register",
            "thread_local", "_Thread_local", "extern", "struct", "class", "union", "enum",
            "typename", "restrict", "__restrict", "__restrict__", "_Atomic", "explicit"
    );

    private Tokens() {
    }

    /** Index of the bracket closing the one at {@code open}; {@code toks.size()} when unbalanced. */
    static int closing(List<RawToken> toks, int open) {
        String o = toks.get(open).text();
        String c = switch (o) {
            case "(" -> ")";
            case "[" -> "]";
            case "{" -> "}";
            default -> throw new IllegalArgumentException("Not an opening bracket: " + o);
        };
        int depth = 0;
        for (int i = open; i < toks.size(); i++) {
            String t = toks.get(i).text();
            if (t.equals(o)) {
                depth++;
            } else if (t.equals(c)) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return toks.size();
    }

    /**
     * Index of the {@code >} closing a template argument list opened at {@code open}. Nested
     * brackets are skipped and {@code >>} closes two levels. Returns {@code open} when no
     * plausible close exists before a {@code ;} or {@code {}.
     */
    static int closingAngle(List<RawToken> toks, int open) {
        int depth = 0;
        for (int i = open; i < toks.size(); i++) {
            String t = toks.get(i).text();
            switch (t) {
                case "<" -> depth++;
                case ">" -> {
                    depth--;
                    if (depth == 0) return i;
                }
                case ">>" -> {
                    depth -= 2;
                    if (depth <= 0) return i;
                }
                case "(", "[" -> i = closing(toks, i);
                case ";", "{", "}" -> {
                    return open;
                }
                default -> {
                }
            }
        }
        return open;
    }

    static boolean is(List<RawToken> toks, int i, String text) {
        return i >= 0 && i < toks.size() && toks.get(i).is(text);
    }

    static boolean isIdentifier(List<RawToken> toks, int i) {
        return i >= 0 && i < toks.size() && toks.get(i).isIdentifier();
    }

    static boolean isAllCaps(String text) {
        boolean letter = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (Character.isLowerCase(ch)) return false;
            if (Character.isUpperCase(ch)) letter = true;
        }
        return letter && text.length() > 1;
    }

    /** Skips {@code [[...]]}, {@code alignas(...)}, {@code __attribute__((...))} and {@code __declspec(...)}. */
    static int skipAttributes(List<RawToken> toks, int i, int end) {
        while (i < end) {
            if (is(toks, i, "[") && is(toks, i + 1, "[")) {
                i = closing(toks, i) + 1;
            } else if (isIdentifier(toks, i) && is(toks, i + 1, "(")
                    && Set.of("alignas", "_Alignas", "__attribute__", "__declspec").contains(toks.get(i).text())) {
                i = closing(toks, i + 1) + 1;
            } else {
                return i;
            }
        }
        return i;
    }
}
