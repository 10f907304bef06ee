package dev.reviewgate.domain.valueobject;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical form of the reviewing agent's output. Immutable: policy and consolidation
 * derive new instances instead of mutating this one.
 */
public record ReviewVerdict(
        boolean approved,
        String severity,
        String summary,
        List<RawComment> comments,
        List<TestSuggestion> testSuggestions
) {
    public static final String APPROVED = "approved";
    public static final String MINOR = "minor";
    public static final String MAJOR = "major";
    public static final String CRITICAL = "critical";

    public static final String DEFAULT_SUMMARY = "Review completed";
    public static final String UNPARSABLE_SUMMARY = "Could not parse review response";

    public ReviewVerdict {
        if (severity == null) severity = MINOR;
        if (summary == null) summary = DEFAULT_SUMMARY;
        comments = comments == null ? List.of() : List.copyOf(comments);
        testSuggestions = testSuggestions == null ? List.of() : List.copyOf(testSuggestions);
    }

    public static ReviewVerdict defaults() {
        return new ReviewVerdict(false, MINOR, DEFAULT_SUMMARY, List.of(), List.of());
    }

    public static ReviewVerdict unparsable() {
        return new ReviewVerdict(false, MINOR, UNPARSABLE_SUMMARY, List.of(), List.of());
    }

    public ReviewVerdict withAdditionalComments(List<RawComment> extra) {
        if (extra.isEmpty()) return this;
        List<RawComment> merged = new ArrayList<>(comments);
        merged.addAll(extra);
        return new ReviewVerdict(approved, severity, summary, merged, testSuggestions);
    }

    public ReviewVerdict rejectedAs(String newSeverity, RawComment reason) {
        List<RawComment> merged = new ArrayList<>(comments);
        merged.add(reason);
        return new ReviewVerdict(false, newSeverity, summary, merged, testSuggestions);
    }
}
