package dev.reviewgate.review;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewgate.agent.ReviewAgentClient;
import dev.reviewgate.agent.ReviewInstructions;
import dev.reviewgate.agent.ReviewPromptAssembler;
import dev.reviewgate.agent.ReviewResponseParser;
import dev.reviewgate.analysis.FileClassifier;
import dev.reviewgate.analysis.dependency.DependencyVulnerabilityAnalyzer;
import dev.reviewgate.analysis.dependency.NpmManifestParser;
import dev.reviewgate.analysis.dependency.PipRequirementsParser;
import dev.reviewgate.analysis.dependency.VulnerabilityDatabase;
import dev.reviewgate.analysis.security.SecurityPatternScanner;
import dev.reviewgate.config.ReviewProperties;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.exception.ReviewAgentException;
import dev.reviewgate.infrastructure.azure.HostingClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ReviewOrchestratorTest {

    private final PullRequestRef ref = new PullRequestRef("org", "proj", "repo", 42);

    private HostingClient hostingClient;
    private ReviewAgentClient agent;
    private SimpleMeterRegistry meterRegistry;
    private ReviewOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        hostingClient = mock(HostingClient.class);
        agent = mock(ReviewAgentClient.class);
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = build(ReviewProperties.defaults());
    }

    private ReviewOrchestrator build(ReviewProperties properties) {
        ObjectMapper mapper = new ObjectMapper();
        FileClassifier classifier = new FileClassifier();
        return new ReviewOrchestrator(hostingClient, classifier, new SecurityPatternScanner(),
                new DependencyVulnerabilityAnalyzer(
                        List.of(new NpmManifestParser(mapper), new PipRequirementsParser()), new VulnerabilityDatabase()),
                new ReviewPromptAssembler(classifier, new ReviewInstructions(properties)),
                agent, new ReviewResponseParser(mapper), new ReviewPolicy(properties),
                new CommentConsolidator(), new VoteDecisionEngine(), new SummaryRenderer(),
                new PostingOrchestrator(hostingClient, new PublicationRegistry(), meterRegistry),
                properties, new SyncTaskExecutor(), meterRegistry);
    }

    private void givenPullRequest(String title, List<Change> changes) {
        when(hostingClient.getPullRequest(ref)).thenReturn(
                new PullRequestMetadata(42, title, "details", "refs/heads/feature/x", "refs/heads/main", "Ana", "active"));
        when(hostingClient.getPullRequestChanges(ref)).thenReturn(changes);
    }

    @Nested
    @DisplayName("review")
    class FullReview {

        @Test
        @DisplayName("consolidates agent comments, posts them and votes")
        void happyPath() {
            givenPullRequest("Add discount rules", List.of(Change.added("a.cs", "class A {}")));
            when(agent.review(anyString())).thenReturn("""
                    {"approved": false, "severity": "major", "summary": "Needs work",
                     "comments": [{"file": "a.cs", "line": 10, "content": "x"},
                                  {"file": "a.cs", "line": 10, "content": "y"}]}""");

            ReviewOutcome outcome = orchestrator.review(ref);

            assertThat(outcome.status()).isEqualTo("success");
            assertThat(outcome.draft().vote()).isEqualTo(VoteDecisionEngine.WAIT_FOR_AUTHOR);
            assertThat(outcome.draft().locationComments()).singleElement()
                    .satisfies(c -> assertThat(c.content()).contains("x").contains("y"));
            verify(hostingClient).createCommentThread(eq(ref), contains("Multiple issues found"), eq("a.cs"), eq(10));
            verify(hostingClient).createCommentThread(eq(ref), contains("## Automated Code Review Results"), isNull(), isNull());
            verify(hostingClient).setVote(ref, -5);
            assertThat(meterRegistry.timer("reviewgate.pipeline.duration").count()).isEqualTo(1);
        }

        @Test
        @DisplayName("security findings are merged and force a rejection")
        void securityFindingsEscalate() {
            givenPullRequest("Add user service", List.of(Change.added("src/UserService.cs",
                    "public string RevealPassword() { return password; }")));
            when(agent.review(anyString())).thenReturn("{\"approved\": true, \"severity\": \"approved\"}");

            ReviewOutcome outcome = orchestrator.review(ref);

            assertThat(outcome.draft().verdict().approved()).isFalse();
            assertThat(outcome.draft().verdict().severity()).isEqualTo("critical");
            assertThat(outcome.draft().vote()).isEqualTo(VoteDecisionEngine.REJECT);
            verify(hostingClient).createCommentThread(eq(ref), contains("CRITICAL SECURITY"), eq("src/UserService.cs"), eq(1));
            assertThat(outcome.draft().summary())
                    .contains("### Security Recommendations")
                    .contains("- IMMEDIATE: Remove all methods that expose, return, or reveal password information");
        }

        @Test
        @DisplayName("security findings stay out of the verdict when disabled")
        void securityFindingsDisabled() {
            ReviewOrchestrator quiet = build(new ReviewProperties(null, false, null, 0));
            givenPullRequest("Add user service", List.of(Change.added("src/UserService.cs",
                    "public string RevealPassword() { return password; }")));
            when(agent.review(anyString())).thenReturn("{\"approved\": true, \"severity\": \"approved\"}");

            ReviewOutcome outcome = quiet.review(ref);

            assertThat(outcome.draft().vote()).isEqualTo(VoteDecisionEngine.APPROVE);
            assertThat(outcome.draft().preparation().securityFindings()).hasSize(1);
            assertThat(outcome.draft().summary()).doesNotContain("Security Recommendations");
        }

        @Test
        @DisplayName("a second run of the same PR is a duplicate")
        void duplicateRun() {
            givenPullRequest("Add docs", List.of(Change.added("README.md", "# hi")));
            when(agent.review(anyString())).thenReturn("{\"approved\": true, \"severity\": \"approved\"}");

            orchestrator.review(ref);
            ReviewOutcome second = orchestrator.review(ref);

            assertThat(second.status()).isEqualTo("duplicate");
            verify(hostingClient, times(1)).setVote(any(), anyInt());
        }

        @Test
        @DisplayName("an agent failure propagates and nothing is posted")
        void agentFailure() {
            givenPullRequest("Add docs", List.of(Change.added("README.md", "# hi")));
            when(agent.review(anyString())).thenThrow(new ReviewAgentException("model down", null));

            assertThatThrownBy(() -> orchestrator.review(ref)).isInstanceOf(ReviewAgentException.class);
            verify(hostingClient, never()).createCommentThread(any(), anyString(), any(), any());
        }
    }

    @Test
    @DisplayName("prepare builds the prompt without consulting the agent")
    void prepare() {
        givenPullRequest("Add cart", List.of(Change.added("web/cart.js", "let total = 0;")));

        ReviewPreparation preparation = orchestrator.prepare(ref);

        assertThat(preparation.prompt()).startsWith("Pull Request #42: Add cart").contains("**Added**: web/cart.js");
        verifyNoInteractions(agent);
    }

    @Test
    @DisplayName("an unparsable agent reply still yields a publishable draft")
    void unparsableReply() {
        givenPullRequest("Add cart", List.of(Change.added("web/cart.js", "let total = 0;")));
        when(agent.review(anyString())).thenReturn("I could not review this.");

        ReviewPreparation preparation = orchestrator.prepare(ref);
        ReviewDraft draft = orchestrator.draft(preparation, orchestrator.consultAgent(preparation));

        assertThat(draft.summary()).contains("Could not parse review response");
        assertThat(draft.vote()).isEqualTo(VoteDecisionEngine.APPROVE_WITH_SUGGESTIONS);
    }

    @Test
    @DisplayName("reviewAsync completes exceptionally on failure")
    void asyncFailure() {
        when(hostingClient.getPullRequest(ref)).thenThrow(new IllegalStateException("unreachable"));

        assertThatThrownBy(() -> orchestrator.reviewAsync(ref).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
