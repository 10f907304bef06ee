package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.ChangeType;

/**
 * One changed file in a PR, as produced by the hosting adapter.
 * Contents are never null: a failed or binary fetch yields an empty string.
 */
public record Change(
        String path,
        ChangeType changeType,
        String originalPath,
        String oldContent,
        String newContent,
        boolean testFile
) {
    public Change {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path is required");
        if (changeType == null) changeType = ChangeType.EDIT;
        if (oldContent == null) oldContent = "";
        if (newContent == null) newContent = "";
    }

    public static Change added(String path, String content) {
        return new Change(path, ChangeType.ADD, null, "", content, false);
    }

    public static Change edited(String path, String oldContent, String newContent) {
        return new Change(path, ChangeType.EDIT, null, oldContent, newContent, false);
    }

    public static Change deleted(String path) {
        return new Change(path, ChangeType.DELETE, null, "", "", false);
    }

    /** Content used for classification: new content, falling back to old. */
    public String effectiveContent() {
        return !newContent.isEmpty() ? newContent : oldContent;
    }
}
