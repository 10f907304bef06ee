package dev.reviewgate.domain.valueobject;

/**
 * Identity of a PR for publication bookkeeping.
 */
public record PullRequestKey(String repositoryId, int pullRequestId) {

    @Override
    public String toString() {
        return repositoryId + "#" + pullRequestId;
    }
}
