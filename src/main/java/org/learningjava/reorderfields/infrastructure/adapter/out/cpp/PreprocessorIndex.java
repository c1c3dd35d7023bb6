package org.learningjava.reorderfields.infrastructure.adapter.out.cpp;

import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.RawTokenKind;
import org.learningjava.reorderfields.domain.model.source.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the raw tokens of one file into directive lines and code. Directive lines are not
 * evaluated: every conditional branch stays in the code, the way an unpreprocessed view
 * of the file reads.
 */
final class PreprocessorIndex {

    private final List<RawToken> codeTokens;
    private final List<MacroDefinition> macros;

    private PreprocessorIndex(List<RawToken> codeTokens, List<MacroDefinition> macros) {
        this.codeTokens = codeTokens;
        this.macros = macros;
    }

    static PreprocessorIndex of(SourceFile file, List<RawToken> raw) {
        List<RawToken> code = new ArrayList<>();
        List<MacroDefinition> macros = new ArrayList<>();
        int lastCodeLine = 0;
        int i = 0;
        while (i < raw.size()) {
            RawToken t = raw.get(i);
            if (t.kind() == RawTokenKind.HASH && t.line() > lastCodeLine) {
                int end = file.logicalLineEnd(t.begin());
                List<RawToken> directive = new ArrayList<>();
                int j = i + 1;
                while (j < raw.size() && raw.get(j).begin() < end) {
                    if (!raw.get(j).isComment()) {
                        directive.add(raw.get(j));
                    }
                    j++;
                }
                MacroDefinition def = parseDefine(directive);
                if (def != null) {
                    macros.add(def);
                }
                lastCodeLine = file.line(end > 0 ? end - 1 : 0);
                i = j;
                continue;
            }
            if (!t.isComment()) {
                code.add(t);
                lastCodeLine = t.line();
            }
            i++;
        }
        return new PreprocessorIndex(List.copyOf(code), List.copyOf(macros));
    }

    private static MacroDefinition parseDefine(List<RawToken> directive) {
        if (directive.size() < 2 || !directive.get(0).is("define") || !directive.get(1).isIdentifier()) {
            return null;
        }
        RawToken name = directive.get(1);
        int k = 2;
        List<String> params = null;
        if (k < directive.size() && directive.get(k).is("(") && directive.get(k).begin() == name.end()) {
            params = new ArrayList<>();
            k++;
            while (k < directive.size() && !directive.get(k).is(")")) {
                RawToken p = directive.get(k);
                if (p.is("...")) {
                    params.add(MacroDefinition.VA_ARGS);
                } else if (p.isIdentifier()) {
                    params.add(p.text());
                }
                k++;
            }
            k++;
        }
        List<String> body = new ArrayList<>();
        for (; k < directive.size(); k++) {
            body.add(directive.get(k).text());
        }
        return new MacroDefinition(name.text(), params, body);
    }

    List<RawToken> codeTokens() {
        return codeTokens;
    }

    List<MacroDefinition> macros() {
        return macros;
    }
}
