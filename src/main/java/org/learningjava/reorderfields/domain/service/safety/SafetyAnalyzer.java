package org.learningjava.reorderfields.domain.service.safety;

import org.learningjava.reorderfields.domain.model.diagnostic.UnsafeSyntaxKind;
import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.RawTokenKind;
import org.learningjava.reorderfields.domain.model.source.RawTokens;
import org.learningjava.reorderfields.domain.model.source.SourceLocation;
import org.learningjava.reorderfields.domain.model.source.SourceRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether the fields of a record can be moved as whole text ranges.
 * A record is ineligible when a statement declares several fields, when one macro expansion
 * produces several fields, or when a preprocessor directive sits between its first and its
 * last field.
 */
@Component
public class SafetyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SafetyAnalyzer.class);

    static final Set<String> PREPROCESSOR_KEYWORDS = Set.of(
            "if", "ifdef", "ifndef", "elif", "elifdef", "elifndef", "else", "endif",
            "define", "undef", "include", "include_next", "import", "line",
            "error", "warning", "pragma", "ident", "sccs", "assert", "unassert"
    );

    /**
     * @param record    the record definition
     * @param rawTokens raw tokens of the file holding the definition, comments included
     * @return the first reason the record is unsafe, or empty when it can be rewritten
     */
    public Optional<UnsafeSyntaxKind> check(RecordModel record, List<RawToken> rawTokens) {
        if (record.fields().isEmpty()) {
            return Optional.empty();
        }
        if (declaresMultipleFieldsInStatement(record)) {
            log.debug("{}: several fields share one declaration statement", record.qualifiedName());
            return Optional.of(UnsafeSyntaxKind.MULTIPLE_FIELDS_IN_STATEMENT);
        }
        if (declaresMultipleFieldsInMacro(record)) {
            log.debug("{}: one macro expansion declares several fields", record.qualifiedName());
            return Optional.of(UnsafeSyntaxKind.MULTIPLE_FIELDS_IN_MACRO);
        }
        if (containsPreprocessorDirectives(record, rawTokens)) {
            log.debug("{}: preprocessor directive between fields", record.qualifiedName());
            return Optional.of(UnsafeSyntaxKind.PREPROCESSOR_DIRECTIVE);
        }
        return Optional.empty();
    }

    public boolean isSafe(RecordModel record, List<RawToken> rawTokens) {
        return check(record, rawTokens).isEmpty();
    }

    private boolean declaresMultipleFieldsInStatement(RecordModel record) {
        SourceLocation last = null;
        for (FieldModel field : record.fields()) {
            SourceLocation typeLoc = field.typeLocation();
            if (last != null && typeLoc.equals(last)) {
                return true;
            }
            last = typeLoc;
        }
        return false;
    }

    private boolean declaresMultipleFieldsInMacro(RecordModel record) {
        SourceRange last = null;
        for (FieldModel field : record.fields()) {
            if (!field.isFromMacro()) {
                continue;
            }
            if (last != null && field.macroExpansion().begin() == last.begin()) {
                return true;
            }
            last = field.macroExpansion();
        }
        return false;
    }

    private boolean containsPreprocessorDirectives(RecordModel record, List<RawToken> rawTokens) {
        int begin = record.field(0).spelledRange().begin();
        int end = record.field(record.fieldCount() - 1).spelledRange().end();
        for (int i = RawTokens.indexAtOrAfter(rawTokens, begin); i < rawTokens.size(); i++) {
            RawToken token = rawTokens.get(i);
            if (token.end() >= end) {
                break;
            }
            if (token.kind() != RawTokenKind.HASH) {
                continue;
            }
            int next = nextNonComment(rawTokens, i + 1);
            if (next < rawTokens.size()) {
                RawToken keyword = rawTokens.get(next);
                if (keyword.isIdentifier() && PREPROCESSOR_KEYWORDS.contains(keyword.text())) {
                    return true;
                }
                i = next;
            }
        }
        return false;
    }

    private static int nextNonComment(List<RawToken> tokens, int from) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).isComment()) {
            i++;
        }
        return i;
    }
}
