package org.learningjava.reorderfields.domain.model.plan;

/**
 * Progress of one reorder request. {@link #ABORTED} is reachable from every other state.
 */
public enum ReorderState {
    START,
    DEFINITION_FOUND,
    SAFETY_CHECKED,
    ORDER_RESOLVED,
    DEFINITION_REWRITTEN,
    CONSTRUCTORS_PROCESSED,
    AGGREGATES_PROCESSED,
    DONE,
    ABORTED
}
