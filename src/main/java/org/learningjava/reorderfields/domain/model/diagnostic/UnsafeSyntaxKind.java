package org.learningjava.reorderfields.domain.model.diagnostic;

/**
 * Why a record's text cannot be rewritten mechanically.
 */
public enum UnsafeSyntaxKind {
    /** {@code int a, b;} */
    MULTIPLE_FIELDS_IN_STATEMENT,
    /** several fields produced by one macro expansion */
    MULTIPLE_FIELDS_IN_MACRO,
    /** a preprocessor directive between the first and the last field */
    PREPROCESSOR_DIRECTIVE
}
