package dev.reviewgate.domain.valueobject;

/**
 * PR details needed for review context. Branch names are stored without {@code refs/heads/}.
 */
public record PullRequestMetadata(
        int pullRequestId,
        String title,
        String description,
        String sourceBranch,
        String targetBranch,
        String author,
        String status
) {
    public PullRequestMetadata {
        if (title == null) title = "";
        if (description == null || description.isBlank()) description = "No description provided";
        if (author == null || author.isBlank()) author = "Unknown";
        sourceBranch = stripRef(sourceBranch);
        targetBranch = stripRef(targetBranch);
    }

    static String stripRef(String ref) {
        if (ref == null) return "";
        return ref.startsWith("refs/heads/") ? ref.substring("refs/heads/".length()) : ref;
    }
}
