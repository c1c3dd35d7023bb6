package org.learningjava.reorderfields.domain.model.diagnostic;

public record ReorderError(ReorderErrorKind kind, String message) {

    public static ReorderError from(ReorderException e) {
        return new ReorderError(e.kind(), e.getMessage());
    }
}
