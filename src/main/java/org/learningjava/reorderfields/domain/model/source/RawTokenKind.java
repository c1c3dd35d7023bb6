package org.learningjava.reorderfields.domain.model.source;

public enum RawTokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHAR,
    COMMENT,
    HASH,
    HASHHASH,
    PUNCTUATOR,
    UNKNOWN
}
