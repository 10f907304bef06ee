package dev.reviewgate.review;

import dev.reviewgate.domain.valueobject.ConsolidatedComment;
import dev.reviewgate.domain.valueobject.ReviewVerdict;

import java.util.List;

/**
 * A fully decided review that has not been posted yet: final verdict after policy and
 * security merge, one comment per location, summary body and vote.
 */
public record ReviewDraft(
        ReviewPreparation preparation,
        ReviewVerdict verdict,
        ConsolidationResult consolidation,
        List<ConsolidatedComment> locationComments,
        String summary,
        int vote
) {}
