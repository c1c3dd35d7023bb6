package org.learningjava.reorderfields.domain.model.diagnostic;

/**
 * Reasons a reorder request fails. Every kind aborts the request and discards any partial plan.
 */
public enum ReorderErrorKind {
    DEFINITION_NOT_FOUND,
    AMBIGUOUS_DEFINITION,
    ORDER_COUNT_MISMATCH,
    UNKNOWN_FIELD_NAME,
    DUPLICATE_FIELD_NAME,
    ACCESS_LEVEL_VIOLATION,
    PARTIAL_AGGREGATE_INIT_UNSUPPORTED,
    BRACE_ELISION_UNSUPPORTED,
    CONFLICTING_REPLACEMENTS
}
