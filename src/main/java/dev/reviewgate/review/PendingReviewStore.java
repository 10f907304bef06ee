package dev.reviewgate.review;

import dev.reviewgate.domain.valueobject.PullRequestKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reviews waiting for confirmation, keyed by PR. Holds the preparation first, then the
 * previewed draft; an entry is removed once confirmed or published. At most
 * {@code capacity} entries are kept, the least recently stored being dropped first.
 */
@Component
public class PendingReviewStore {

    private static final Logger log = LoggerFactory.getLogger(PendingReviewStore.class);

    static final int DEFAULT_CAPACITY = 64;

    public record PendingReview(ReviewPreparation preparation, ReviewDraft draft) {
        public boolean hasDraft() {
            return draft != null;
        }
    }

    private final Map<PullRequestKey, PendingReview> pending;

    public PendingReviewStore() {
        this(DEFAULT_CAPACITY);
    }

    PendingReviewStore(int capacity) {
        this.pending = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<PullRequestKey, PendingReview> eldest) {
                if (size() <= capacity) return false;
                log.info("Dropping pending review for {}, store is full", eldest.getKey());
                return true;
            }
        };
    }

    public synchronized void storePreparation(ReviewPreparation preparation) {
        put(preparation.ref().key(), new PendingReview(preparation, null));
    }

    public synchronized void storeDraft(ReviewDraft draft) {
        put(draft.preparation().ref().key(), new PendingReview(draft.preparation(), draft));
    }

    public synchronized Optional<PendingReview> get(PullRequestKey key) {
        return Optional.ofNullable(pending.get(key));
    }

    /** Removes and returns the draft for {@code key}, if one was previewed. */
    public synchronized Optional<ReviewDraft> takeDraft(PullRequestKey key) {
        PendingReview entry = pending.get(key);
        if (entry == null || !entry.hasDraft()) return Optional.empty();
        pending.remove(key);
        return Optional.of(entry.draft());
    }

    public synchronized void evict(PullRequestKey key) {
        pending.remove(key);
    }

    public synchronized int size() {
        return pending.size();
    }

    // re-inserting moves the key to the newest position
    private void put(PullRequestKey key, PendingReview review) {
        pending.remove(key);
        pending.put(key, review);
    }
}
