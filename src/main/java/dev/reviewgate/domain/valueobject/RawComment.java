package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.CommentSeverity;

/**
 * A comment as produced by the reviewing agent or a detector, before consolidation.
 */
public record RawComment(
        String filePath,
        Integer lineNumber,
        String content,
        CommentSeverity severity,
        String issueType
) {
    public RawComment {
        if (content == null) content = "";
        if (severity == null) severity = CommentSeverity.INFO;
    }

    public static RawComment general(String content, CommentSeverity severity) {
        return new RawComment(null, null, content, severity, null);
    }

    public static RawComment at(String filePath, int lineNumber, String content, CommentSeverity severity) {
        return new RawComment(filePath, lineNumber, content, severity, null);
    }

    /** General comments have no usable location and are folded into the summary. */
    public boolean isGeneral() {
        return filePath == null || filePath.isBlank() || lineNumber == null || lineNumber <= 0;
    }
}
