package dev.reviewgate.review;

import dev.reviewgate.analysis.FileClassifier;
import dev.reviewgate.config.ReviewProperties;
import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.enums.CommentSeverity;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.RawComment;
import dev.reviewgate.domain.valueobject.ReviewVerdict;
import dev.reviewgate.domain.valueobject.TestSuggestion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewPolicyTest {

    private final FileClassifier classifier = new FileClassifier();
    private final ReviewPolicy policy = new ReviewPolicy(ReviewProperties.defaults());
    private final ReviewVerdict approved = new ReviewVerdict(true, ReviewVerdict.APPROVED, "Looks good", List.of(), List.of());

    private static PullRequestMetadata pr(String title, String description) {
        return new PullRequestMetadata(1, title, description, "feature/x", "main", "Sam", "active");
    }

    @Nested
    @DisplayName("bug fix without tests")
    class BugFixWithoutTests {

        @Test
        @DisplayName("overrides an approval with a critical rejection")
        void rejects() {
            List<Change> changes = List.of(Change.edited("src/OrderService.cs", "a", "b"));

            ReviewVerdict result = policy.apply(approved, pr("Fix rounding in totals", ""), changes,
                    classifier.analyzeSet(changes));

            assertThat(result.approved()).isFalse();
            assertThat(result.severity()).isEqualTo(ReviewVerdict.CRITICAL);
            assertThat(result.summary()).isEqualTo("Looks good");
            assertThat(result.comments()).singleElement().satisfies(c -> {
                assertThat(c.isGeneral()).isTrue();
                assertThat(c.severity()).isEqualTo(CommentSeverity.ERROR);
                assertThat(c.issueType()).isEqualTo("missing_tests");
                assertThat(c.content()).isEqualTo(ReviewPolicy.MISSING_TESTS_MESSAGE);
            });
        }

        @Test
        @DisplayName("suggests a regression test per uncovered source file")
        void suggestsRegressionTests() {
            List<Change> changes = List.of(
                    Change.edited("src/OrderService.cs", "a", "b"),
                    Change.edited("src/Billing.cs", "a", "b"),
                    Change.edited("README.md", "a", "b"));
            ReviewVerdict agent = new ReviewVerdict(false, ReviewVerdict.MINOR, "ok", List.of(),
                    List.of(new TestSuggestion("BillingTests.Rounds", "rounds", "", "src/Billing.cs")));

            ReviewVerdict result = policy.apply(agent, pr("Hotfix billing", ""), changes,
                    classifier.analyzeSet(changes));

            assertThat(result.testSuggestions()).extracting(TestSuggestion::testName)
                    .containsExactly("BillingTests.Rounds", "OrderServiceTests.FixedBehaviour_DoesNotRegress");
        }

        @Test
        @DisplayName("keywords in the description also count")
        void descriptionKeyword() {
            assertThat(policy.isBugFix(pr("Adjust totals", "This is a BugFix for #12"))).isTrue();
            assertThat(policy.isBugFix(pr("Add reports", "New feature"))).isFalse();
        }
    }

    @Test
    @DisplayName("a bug fix that touches a test file passes through unchanged")
    void withTests() {
        List<Change> changes = List.of(
                Change.edited("src/OrderService.cs", "a", "b"),
                new Change("tests/OrderServiceTests.cs", ChangeType.EDIT, null, "a", "b", true));

        ReviewVerdict result = policy.apply(approved, pr("Fix rounding", ""), changes, classifier.analyzeSet(changes));

        assertThat(result).isSameAs(approved);
    }

    @Test
    @DisplayName("test files are recognised by category even without the flag")
    void testsByCategory() {
        List<Change> changes = List.of(Change.added("web/cart.test.js", "it('works')"));

        assertThat(policy.hasTests(changes, classifier.analyzeSet(changes))).isTrue();
    }

    @Test
    @DisplayName("a disabled policy never changes the verdict")
    void disabled() {
        ReviewPolicy off = new ReviewPolicy(new ReviewProperties(null, null,
                new ReviewProperties.Policy(false, null, null), 0));
        List<Change> changes = List.of(Change.edited("src/OrderService.cs", "a", "b"));

        assertThat(off.apply(approved, pr("Fix bug", ""), changes, classifier.analyzeSet(changes))).isSameAs(approved);
    }

    @Test
    @DisplayName("existing comments are kept when the policy rejects")
    void keepsAgentComments() {
        ReviewVerdict agent = new ReviewVerdict(false, ReviewVerdict.MAJOR, "meh",
                List.of(RawComment.at("a.cs", 1, "x", CommentSeverity.WARNING)), List.of());
        List<Change> changes = List.of(Change.edited("a.cs", "a", "b"));

        ReviewVerdict result = policy.apply(agent, pr("bug: crash on save", ""), changes, classifier.analyzeSet(changes));

        assertThat(result.comments()).hasSize(2);
        assertThat(result.comments().get(0).content()).isEqualTo("x");
    }
}
