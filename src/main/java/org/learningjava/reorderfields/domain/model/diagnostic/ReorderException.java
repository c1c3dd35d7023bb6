package org.learningjava.reorderfields.domain.model.diagnostic;

public class ReorderException extends RuntimeException {

    private final ReorderErrorKind kind;

    public ReorderException(ReorderErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReorderErrorKind kind() {
        return kind;
    }
}
