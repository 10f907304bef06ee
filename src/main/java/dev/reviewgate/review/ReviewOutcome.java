package dev.reviewgate.review;

import dev.reviewgate.domain.valueobject.PostingResult;

public record ReviewOutcome(ReviewDraft draft, PostingResult posting) {

    public String status() {
        return posting.status();
    }
}
