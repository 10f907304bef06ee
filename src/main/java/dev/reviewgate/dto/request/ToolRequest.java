package dev.reviewgate.dto.request;

/**
 * Arguments of a tool invocation. Each operation reads the fields it needs; the rest are
 * ignored. {@code project} and {@code organization} override the configured defaults.
 */
public record ToolRequest(
        String repositoryId,
        Integer pullRequestId,
        String project,
        String organization,
        String status,
        String reviewJson,
        String content,
        String filePath,
        Integer lineNumber,
        String vote,
        String reason,
        Boolean confirm
) {
    public boolean confirmed() {
        return Boolean.TRUE.equals(confirm);
    }

    public static ToolRequest forPullRequest(String repositoryId, int pullRequestId) {
        return new ToolRequest(repositoryId, pullRequestId, null, null, null, null, null, null, null, null, null, null);
    }
}
