package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.CommentSeverity;

/**
 * One consolidated security detection on a single line. At most one exists per
 * (filePath, lineNumber).
 */
public record SecurityFinding(
        String filePath,
        int lineNumber,
        String message,
        CommentSeverity severity,
        String issueType,
        String lineContent
) {
    public static final String ISSUE_TYPE = "security";

    public static SecurityFinding of(String filePath, int lineNumber, String message, String lineContent) {
        return new SecurityFinding(filePath, lineNumber, message, CommentSeverity.ERROR, ISSUE_TYPE, lineContent);
    }

    public RawComment toComment() {
        return new RawComment(filePath, lineNumber, message, severity, issueType);
    }
}
