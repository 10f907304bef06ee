package dev.reviewgate.domain.valueobject;

import java.util.List;

/**
 * Outcome of publishing a review. Partial failures are listed in {@code errors};
 * {@code duplicate} marks a call that was skipped because the PR was already published.
 */
public record PostingResult(int commentsPosted, boolean voteUpdated, List<String> errors, boolean duplicate) {

    public PostingResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static PostingResult duplicateOf() {
        return new PostingResult(0, false, List.of(), true);
    }

    public boolean isSuccess() {
        return errors.isEmpty() && !duplicate;
    }

    public String status() {
        if (duplicate) return "duplicate";
        return errors.isEmpty() ? "success" : "partial_success";
    }
}
