package org.learningjava.reorderfields.application.port;

import org.learningjava.reorderfields.domain.model.source.RawToken;
import org.learningjava.reorderfields.domain.model.source.SourceFile;

import java.util.List;

public interface RawTokenScannerPort {
    List<RawToken> scan(SourceFile file); // comments included, whitespace dropped
}
