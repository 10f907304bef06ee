package dev.reviewgate.infrastructure.azure;

import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.domain.valueobject.PullRequestSummary;
import dev.reviewgate.exception.HostingClientException;

import java.util.List;

/**
 * Operations the review pipeline needs from the code hosting service. Every method throws
 * {@link HostingClientException} on failure.
 */
public interface HostingClient {

    /** @param status {@code active}, {@code completed}, {@code abandoned} or {@code all} */
    List<PullRequestSummary> listPullRequests(String organization, String project, String repositoryId, String status);

    PullRequestMetadata getPullRequest(PullRequestRef ref);

    /** De-duplicated by path, folders excluded, sorted by path. */
    List<Change> getPullRequestChanges(PullRequestRef ref);

    /**
     * Opens a comment thread. With a null {@code filePath} or {@code line} the thread is a
     * general PR comment.
     *
     * @return the created thread id
     */
    int createCommentThread(PullRequestRef ref, String content, String filePath, Integer line);

    void setVote(PullRequestRef ref, int vote);
}
