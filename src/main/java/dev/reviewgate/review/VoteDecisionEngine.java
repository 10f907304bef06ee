package dev.reviewgate.review;

import dev.reviewgate.domain.valueobject.ReviewVerdict;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a verdict to an Azure DevOps reviewer vote. The table is evaluated in order and the
 * approval check comes first.
 */
@Component
public class VoteDecisionEngine {

    public static final int APPROVE = 10;
    public static final int APPROVE_WITH_SUGGESTIONS = 5;
    public static final int NO_VOTE = 0;
    public static final int WAIT_FOR_AUTHOR = -5;
    public static final int REJECT = -10;

    private static final Map<String, Integer> NAMED = Map.of(
            "approve", APPROVE,
            "approve_with_suggestions", APPROVE_WITH_SUGGESTIONS,
            "no_vote", NO_VOTE,
            "wait_for_author", WAIT_FOR_AUTHOR,
            "reject", REJECT);

    public int decide(boolean approved, String severity) {
        String s = severity == null ? "" : severity.strip().toLowerCase(Locale.ROOT);
        if (approved && (s.equals(ReviewVerdict.APPROVED) || s.equals(ReviewVerdict.MINOR))) return APPROVE;
        return switch (s) {
            case ReviewVerdict.MINOR -> APPROVE_WITH_SUGGESTIONS;
            case ReviewVerdict.MAJOR -> WAIT_FOR_AUTHOR;
            case ReviewVerdict.CRITICAL -> REJECT;
            default -> NO_VOTE;
        };
    }

    public int decide(ReviewVerdict verdict) {
        return decide(verdict.approved(), verdict.severity());
    }

    /**
     * Vote value for a name such as {@code approve_with_suggestions}; case and dashes are
     * ignored.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public int voteFor(String name) {
        if (name == null) throw new IllegalArgumentException("Vote name is required");
        Integer vote = NAMED.get(name.strip().toLowerCase(Locale.ROOT).replace('-', '_'));
        if (vote == null)
            throw new IllegalArgumentException("Unknown vote '" + name + "', expected one of " + NAMED.keySet());
        return vote;
    }
}
