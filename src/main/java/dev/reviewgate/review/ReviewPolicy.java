package dev.reviewgate.review;

import dev.reviewgate.config.ReviewProperties;
import dev.reviewgate.domain.enums.CommentSeverity;
import dev.reviewgate.domain.enums.FileCategory;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.RawComment;
import dev.reviewgate.domain.valueobject.ReviewVerdict;
import dev.reviewgate.domain.valueobject.TestSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * "Bug fix requires tests". A PR that looks like a bug fix (keyword in title or
 * description) but touches no test file is rejected as critical regardless of what the
 * agent said. Never throws; the outcome is a derived verdict.
 */
@Component
public class ReviewPolicy {

    private static final Logger log = LoggerFactory.getLogger(ReviewPolicy.class);

    static final String MISSING_TESTS_MESSAGE =
            "Bug fix lacks required regression tests. Add tests that fail without this fix and pass with it.";
    static final String ISSUE_TYPE = "missing_tests";

    private final ReviewProperties.Policy policy;

    public ReviewPolicy(ReviewProperties properties) {
        this.policy = properties.policy();
    }

    public ReviewVerdict apply(ReviewVerdict verdict, PullRequestMetadata metadata,
                               List<Change> changes, Map<FileCategory, List<String>> categories) {
        if (!policy.enabled() || !isBugFix(metadata) || hasTests(changes, categories)) return verdict;

        log.info("PR #{} looks like a bug fix without tests; escalating to {}",
                metadata.pullRequestId(), ReviewVerdict.CRITICAL);

        RawComment reason = new RawComment(null, null, MISSING_TESTS_MESSAGE, CommentSeverity.ERROR, ISSUE_TYPE);
        ReviewVerdict rejected = verdict.rejectedAs(ReviewVerdict.CRITICAL, reason);
        List<TestSuggestion> suggestions = regressionSuggestions(rejected, categories);
        if (suggestions.isEmpty()) return rejected;

        List<TestSuggestion> merged = new ArrayList<>(rejected.testSuggestions());
        merged.addAll(suggestions);
        return new ReviewVerdict(rejected.approved(), rejected.severity(), rejected.summary(),
                rejected.comments(), merged);
    }

    public boolean isBugFix(PullRequestMetadata metadata) {
        String title = metadata.title().toLowerCase(Locale.ROOT);
        String description = metadata.description().toLowerCase(Locale.ROOT);
        return policy.titleKeywords().stream().anyMatch(k -> title.contains(k.toLowerCase(Locale.ROOT)))
                || policy.descriptionKeywords().stream().anyMatch(k -> description.contains(k.toLowerCase(Locale.ROOT)));
    }

    public boolean hasTests(List<Change> changes, Map<FileCategory, List<String>> categories) {
        if (changes.stream().anyMatch(Change::testFile)) return true;
        return categories.entrySet().stream()
                .anyMatch(e -> e.getKey().isTest() && !e.getValue().isEmpty());
    }

    /** One regression test stub per changed source file the agent did not already cover. */
    private static List<TestSuggestion> regressionSuggestions(ReviewVerdict verdict,
                                                              Map<FileCategory, List<String>> categories) {
        Set<String> covered = new HashSet<>();
        verdict.testSuggestions().forEach(s -> { if (s.filePath() != null) covered.add(s.filePath()); });

        List<TestSuggestion> result = new ArrayList<>();
        categories.forEach((category, paths) -> {
            if (!category.isSignificant() || category.isTest()) return;
            for (String path : paths) {
                if (covered.contains(path)) continue;
                String className = baseName(path);
                result.add(new TestSuggestion(
                        className + "Tests.FixedBehaviour_DoesNotRegress",
                        "Regression test reproducing the bug fixed in " + path,
                        "", path));
            }
        });
        return result;
    }

    private static String baseName(String path) {
        String name = path.substring(path.replace('\\', '/').lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
