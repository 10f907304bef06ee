package dev.reviewgate.review;

import dev.reviewgate.domain.valueobject.ConsolidatedComment;
import dev.reviewgate.domain.valueobject.PostingResult;
import dev.reviewgate.domain.valueobject.PullRequestKey;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.infrastructure.azure.HostingClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Publishes a consolidated review at most once per PR: location comments, then the summary
 * thread, then the vote. Each post is independent; failures are collected, not thrown.
 */
@Component
public class PostingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PostingOrchestrator.class);

    private final HostingClient hostingClient;
    private final PublicationRegistry registry;
    private final Counter publishedCounter;
    private final Counter duplicateCounter;
    private final Counter failedPostCounter;

    public PostingOrchestrator(HostingClient hostingClient, PublicationRegistry registry, MeterRegistry meterRegistry) {
        this.hostingClient = hostingClient;
        this.registry = registry;
        this.publishedCounter = Counter.builder("reviewgate.reviews.published")
                .description("Reviews fully published")
                .register(meterRegistry);
        this.duplicateCounter = Counter.builder("reviewgate.reviews.duplicate")
                .description("Publish calls skipped because the PR was already published")
                .register(meterRegistry);
        this.failedPostCounter = Counter.builder("reviewgate.posts.failed")
                .description("Individual comment, summary or vote posts that failed")
                .register(meterRegistry);
    }

    /**
     * @param vote Azure DevOps vote value, or null to leave the vote untouched
     */
    public PostingResult publish(PullRequestRef ref, List<ConsolidatedComment> locationComments,
                                 String summary, Integer vote) {
        PullRequestKey key = ref.key();
        if (!registry.tryClaim(key)) {
            log.info("Review for {} already published or in progress, skipping", key);
            duplicateCounter.increment();
            return PostingResult.duplicateOf();
        }

        List<String> errors = new ArrayList<>();
        int posted = 0;
        boolean voteUpdated = false;
        boolean completed = false;
        try {
            for (ConsolidatedComment comment : locationComments) {
                if (comment.isGeneral()) continue;
                try {
                    hostingClient.createCommentThread(ref, comment.content(),
                            comment.location().filePath(), comment.location().lineNumber());
                    posted++;
                } catch (RuntimeException e) {
                    errors.add("Failed to post comment at %s: %s".formatted(comment.location(), e.getMessage()));
                }
            }

            if (summary != null && !summary.isBlank()) {
                try {
                    hostingClient.createCommentThread(ref, summary, null, null);
                } catch (RuntimeException e) {
                    errors.add("Failed to post summary: " + e.getMessage());
                }
            }

            if (vote != null) {
                try {
                    hostingClient.setVote(ref, vote);
                    voteUpdated = true;
                } catch (RuntimeException e) {
                    errors.add("Failed to update vote: " + e.getMessage());
                }
            }
            completed = errors.isEmpty();
        } finally {
            if (completed) {
                registry.markPublished(key);
                publishedCounter.increment();
            } else {
                registry.release(key);
                failedPostCounter.increment(errors.size());
                log.warn("Partial publication for {}: {} error(s)", key, errors.size());
            }
        }

        log.info("Posted review to {}: {} comment(s), vote {}", ref, posted, voteUpdated ? vote : "unchanged");
        return new PostingResult(posted, voteUpdated, errors, false);
    }
}
