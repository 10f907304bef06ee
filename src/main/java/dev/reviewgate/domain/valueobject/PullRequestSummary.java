package dev.reviewgate.domain.valueobject;

public record PullRequestSummary(
        int pullRequestId, String title, String author, String status,
        String sourceBranch, String targetBranch
) {
    public PullRequestSummary {
        sourceBranch = PullRequestMetadata.stripRef(sourceBranch);
        targetBranch = PullRequestMetadata.stripRef(targetBranch);
    }
}
