package org.learningjava.reorderfields.domain.service.rewrite;

import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.RawTokens;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceRange;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes the text a field owns inside its record: the declaration extended through the
 * terminating {@code ;} (so trailing macros like {@code GUARDED_BY(mu)} travel along), plus
 * the comments attached before and after it.
 */
@Component
public class FieldRangeResolver {

    public SourceRange fullRange(FieldModel field, SourceFile file, List<RawToken> tokens) {
        SourceRange base = field.spelledRange();
        int begin = base.begin();
        int end = base.end();

        int next = nextNonComment(tokens, RawTokens.indexAtOrAfter(tokens, end));
        if (field.isFromMacro()) {
            // the invocation may or may not carry its own semicolon
            if (next < tokens.size() && tokens.get(next).is(";")) {
                end = tokens.get(next).end();
            }
        } else {
            while (true) {
                if (next >= tokens.size() || tokens.get(next).is("}")) {
                    return base;
                }
                end = tokens.get(next).end();
                if (tokens.get(next).is(";")) {
                    break;
                }
                next = nextNonComment(tokens, next + 1);
            }
        }

        begin = startOfLeadingComment(begin, file, tokens);
        end = endOfTrailingComment(end, file, tokens);
        return new SourceRange(file.path(), begin, end);
    }

    /**
     * Walks back over comments that are on the declaration's line or start in the
     * declaration's column.
     */
    private int startOfLeadingComment(int begin, SourceFile file, List<RawToken> tokens) {
        int line = file.line(begin);
        int column = file.column(begin);
        int start = begin;
        for (int i = RawTokens.indexEndingBefore(tokens, begin); i >= 0 && tokens.get(i).isComment(); i--) {
            RawToken comment = tokens.get(i);
            if (comment.line() != line && comment.column() != column) {
                break;
            }
            start = comment.begin();
        }
        return start;
    }

    /**
     * Walks forward over comments indented further than the last token of the declaration.
     */
    private int endOfTrailingComment(int end, SourceFile file, List<RawToken> tokens) {
        int last = RawTokens.indexEndingBefore(tokens, end);
        int column = last >= 0 ? tokens.get(last).column() : file.column(end);
        int stop = end;
        for (int i = last + 1; i < tokens.size() && tokens.get(i).isComment(); i++) {
            RawToken comment = tokens.get(i);
            if (comment.column() <= column) {
                break;
            }
            stop = comment.end();
        }
        return stop;
    }

    private static int nextNonComment(List<RawToken> tokens, int from) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).isComment()) {
            i++;
        }
        return i;
    }
}
