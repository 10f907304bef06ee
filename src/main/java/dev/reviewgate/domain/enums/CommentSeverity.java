package dev.reviewgate.domain.enums;

import java.util.Locale;

/**
 * Severity of a single review comment, ordered {@code INFO < WARNING < ERROR}.
 */
public enum CommentSeverity {
    INFO, WARNING, ERROR;

    /** Lenient parse; unknown or missing values are treated as INFO. */
    public static CommentSeverity from(String raw) {
        if (raw == null) return INFO;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "error", "critical" -> ERROR;
            case "warning", "warn" -> WARNING;
            default -> INFO;
        };
    }

    public static CommentSeverity max(CommentSeverity a, CommentSeverity b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
