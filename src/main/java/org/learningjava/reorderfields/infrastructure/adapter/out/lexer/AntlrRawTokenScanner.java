package org.learningjava.reorderfields.infrastructure.adapter.out.lexer;

import cpp.CppLexer;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.learningjava.reorderfields.application.port.RawTokenScannerPort;
import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.RawTokenKind;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw C/C++ tokens from the generated {@code CppLexer}. Comments are kept; keywords come
 * back as identifiers.
 */
@Component
public class AntlrRawTokenScanner implements RawTokenScannerPort {

    private static final Logger log = LoggerFactory.getLogger(AntlrRawTokenScanner.class);

    @Override
    public List<RawToken> scan(SourceFile file) {
        String content = file.content();
        CppLexer lexer = new CppLexer(CharStreams.fromString(content, file.path()));
        lexer.removeErrorListeners();

        int[] charOffset = codePointToCharOffsets(content);
        List<RawToken> tokens = new ArrayList<>();
        for (Token t : lexer.getAllTokens()) {
            int begin = charOffset[t.getStartIndex()];
            int end = charOffset[t.getStopIndex() + 1];
            tokens.add(new RawToken(kindOf(t.getType()), content.substring(begin, end), begin, end,
                    file.line(begin), file.column(begin)));
        }
        log.debug("Scanned {} raw tokens from {}", tokens.size(), file.path());
        return tokens;
    }

    private static RawTokenKind kindOf(int type) {
        return switch (type) {
            case CppLexer.IDENTIFIER -> RawTokenKind.IDENTIFIER;
            case CppLexer.NUMBER -> RawTokenKind.NUMBER;
            case CppLexer.STRING, CppLexer.RAW_STRING -> RawTokenKind.STRING;
            case CppLexer.CHAR -> RawTokenKind.CHAR;
            case CppLexer.BLOCK_COMMENT, CppLexer.LINE_COMMENT -> RawTokenKind.COMMENT;
            case CppLexer.HASH -> RawTokenKind.HASH;
            case CppLexer.HASHHASH -> RawTokenKind.HASHHASH;
            case CppLexer.PUNCTUATOR -> RawTokenKind.PUNCTUATOR;
            default -> RawTokenKind.UNKNOWN;
        };
    }

    // ANTLR indexes code points, the rest of the tool indexes chars
    private static int[] codePointToCharOffsets(String content) {
        int count = content.codePointCount(0, content.length());
        int[] offsets = new int[count + 1];
        int charIndex = 0;
        for (int cp = 0; cp < count; cp++) {
            offsets[cp] = charIndex;
            charIndex += Character.charCount(content.codePointAt(charIndex));
        }
        offsets[count] = content.length();
        return offsets;
    }
}
