package dev.reviewgate.review;

import dev.reviewgate.domain.valueobject.PullRequestKey;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records which PRs have had a review published by this instance. Claiming is atomic, so two
 * concurrent reviews of the same PR cannot both publish.
 */
@Component
public class PublicationRegistry {

    enum State { IN_PROGRESS, PUBLISHED }

    private final Map<PullRequestKey, State> entries = new ConcurrentHashMap<>();

    /** True when the caller now owns publication for {@code key}. */
    public boolean tryClaim(PullRequestKey key) {
        return entries.putIfAbsent(key, State.IN_PROGRESS) == null;
    }

    public void markPublished(PullRequestKey key) {
        entries.put(key, State.PUBLISHED);
    }

    /** Drops an in-progress claim so a later attempt may publish. Published keys stay. */
    public void release(PullRequestKey key) {
        entries.remove(key, State.IN_PROGRESS);
    }

    public boolean isPublished(PullRequestKey key) {
        return entries.get(key) == State.PUBLISHED;
    }
}
