package org.learningjava.reorderfields.domain.model.record;

public enum AccessLevel {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    public static AccessLevel fromKeyword(String keyword) {
        return switch (keyword) {
            case "public" -> PUBLIC;
            case "protected" -> PROTECTED;
            case "private" -> PRIVATE;
            default -> throw new IllegalArgumentException("Not an access specifier: " + keyword);
        };
    }

    public static boolean isKeyword(String text) {
        return "public".equals(text) || "protected".equals(text) || "private".equals(text);
    }
}
