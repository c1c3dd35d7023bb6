package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import java.util.List;

/**
 * A {@code #define} as written.
 *
 * @param name   macro name
 * @param params parameter names, {@code __VA_ARGS__} for {@code ...}; {@code null} for object-like macros
 * @param body   replacement list token spellings
 */
record MacroDefinition(String name, List<String> params, List<String> body) {

    static final String VA_ARGS = "__VA_ARGS__";

    MacroDefinition {
        params = params == null ? null : List.copyOf(params);
        body = List.copyOf(body);
    }

    boolean isFunctionLike() {
        return params != null;
    }

    boolean isVariadic() {
        return params != null && !params.isEmpty() && params.get(params.size() - 1).equals(VA_ARGS);
    }
}
