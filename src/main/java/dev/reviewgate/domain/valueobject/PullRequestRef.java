package dev.reviewgate.domain.valueobject;

/**
 * Fully qualified PR address on Azure DevOps.
 */
public record PullRequestRef(String organization, String project, String repositoryId, int pullRequestId) {

    public PullRequestKey key() {
        return new PullRequestKey(repositoryId, pullRequestId);
    }

    @Override
    public String toString() {
        return "%s/%s/%s#%d".formatted(organization, project, repositoryId, pullRequestId);
    }
}
