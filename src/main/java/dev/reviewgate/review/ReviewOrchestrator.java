package dev.reviewgate.review;

import dev.reviewgate.agent.ReviewAgentClient;
import dev.reviewgate.agent.ReviewPromptAssembler;
import dev.reviewgate.agent.ReviewResponseParser;
import dev.reviewgate.analysis.FileClassifier;
import dev.reviewgate.analysis.dependency.DependencyAnalysis;
import dev.reviewgate.analysis.dependency.DependencyVulnerabilityAnalyzer;
import dev.reviewgate.analysis.security.SecurityPatternScanner;
import dev.reviewgate.config.ReviewProperties;
import dev.reviewgate.domain.enums.FileCategory;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PostingResult;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.domain.valueobject.RawComment;
import dev.reviewgate.domain.valueobject.ReviewVerdict;
import dev.reviewgate.domain.valueobject.SecurityFinding;
import dev.reviewgate.infrastructure.azure.HostingClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the review pipeline for one PR.
 *
 * <pre>
 *  1. Fetch metadata and changes from the hosting service
 *  2. Classify files, scan for secrets, analyze dependency manifests
 *  3. Assemble the prompt and ask the reviewing agent
 *  4. Parse the verdict, apply the bug-fix policy, merge security findings
 *  5. Consolidate comments per location, decide the vote, render the summary
 *  6. Publish once per PR
 * </pre>
 *
 * <p>Steps 1-2 and 4-6 are exposed separately so a human (or an external agent) can supply
 * the verdict and confirm before anything is posted.
 */
@Component
public class ReviewOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewOrchestrator.class);

    static final String MDC_KEY = "pr";

    private final HostingClient hostingClient;
    private final FileClassifier classifier;
    private final SecurityPatternScanner securityScanner;
    private final DependencyVulnerabilityAnalyzer dependencyAnalyzer;
    private final ReviewPromptAssembler promptAssembler;
    private final ReviewAgentClient agentClient;
    private final ReviewResponseParser responseParser;
    private final ReviewPolicy policy;
    private final CommentConsolidator consolidator;
    private final VoteDecisionEngine voteEngine;
    private final SummaryRenderer summaryRenderer;
    private final PostingOrchestrator postingOrchestrator;
    private final ReviewProperties properties;
    private final TaskExecutor reviewExecutor;
    private final Timer pipelineTimer;

    public ReviewOrchestrator(HostingClient hostingClient,
                              FileClassifier classifier,
                              SecurityPatternScanner securityScanner,
                              DependencyVulnerabilityAnalyzer dependencyAnalyzer,
                              ReviewPromptAssembler promptAssembler,
                              ReviewAgentClient agentClient,
                              ReviewResponseParser responseParser,
                              ReviewPolicy policy,
                              CommentConsolidator consolidator,
                              VoteDecisionEngine voteEngine,
                              SummaryRenderer summaryRenderer,
                              PostingOrchestrator postingOrchestrator,
                              ReviewProperties properties,
                              @Qualifier("reviewExecutor") TaskExecutor reviewExecutor,
                              MeterRegistry meterRegistry) {
        this.hostingClient = hostingClient;
        this.classifier = classifier;
        this.securityScanner = securityScanner;
        this.dependencyAnalyzer = dependencyAnalyzer;
        this.promptAssembler = promptAssembler;
        this.agentClient = agentClient;
        this.responseParser = responseParser;
        this.policy = policy;
        this.consolidator = consolidator;
        this.voteEngine = voteEngine;
        this.summaryRenderer = summaryRenderer;
        this.postingOrchestrator = postingOrchestrator;
        this.properties = properties;
        this.reviewExecutor = reviewExecutor;
        this.pipelineTimer = Timer.builder("reviewgate.pipeline.duration")
                .description("End-to-end review pipeline time")
                .register(meterRegistry);
    }

    public ReviewPreparation prepare(PullRequestRef ref) {
        PullRequestMetadata metadata = hostingClient.getPullRequest(ref);
        List<Change> changes = hostingClient.getPullRequestChanges(ref);
        log.info("Preparing review of {} '{}' with {} changed file(s)", ref, metadata.title(), changes.size());

        Map<FileCategory, List<String>> categories = classifier.analyzeSet(changes);
        List<SecurityFinding> findings = securityScanner.scanAll(changes);
        DependencyAnalysis dependencies = dependencyAnalyzer.analyze(changes);
        String prompt = promptAssembler.build(metadata, changes, categories, dependencies.summary(), findings);

        return new ReviewPreparation(ref, metadata, changes, categories, findings, dependencies, prompt);
    }

    /** Asks the configured agent and parses its reply. */
    public ReviewVerdict consultAgent(ReviewPreparation preparation) {
        String raw = agentClient.review(preparation.prompt());
        return responseParser.parse(raw);
    }

    /** Derives the final verdict, comments, summary and vote without posting anything. */
    public ReviewDraft draft(ReviewPreparation preparation, ReviewVerdict agentVerdict) {
        ReviewVerdict verdict = policy.apply(agentVerdict, preparation.metadata(),
                preparation.changes(), preparation.categories());
        verdict = mergeSecurityFindings(verdict, preparation.securityFindings());

        ConsolidationResult consolidation = consolidator.consolidate(verdict.comments());
        int vote = voteEngine.decide(verdict);
        String summary = summaryRenderer.render(verdict, consolidation.general(),
                preparation.dependencies().summary(), securityRecommendations(preparation));

        return new ReviewDraft(preparation, verdict, consolidation, consolidation.toLocationComments(), summary, vote);
    }

    public ReviewOutcome publish(ReviewDraft draft) {
        PostingResult result = postingOrchestrator.publish(draft.preparation().ref(),
                draft.locationComments(), draft.summary(), draft.vote());
        return new ReviewOutcome(draft, result);
    }

    public ReviewOutcome finalizeReview(ReviewPreparation preparation, ReviewVerdict agentVerdict) {
        return publish(draft(preparation, agentVerdict));
    }

    /** Full pipeline: prepare, consult the agent, finalize and publish. */
    public ReviewOutcome review(PullRequestRef ref) {
        MDC.put(MDC_KEY, ref.key().toString());
        Timer.Sample sample = Timer.start();
        try {
            ReviewPreparation preparation = prepare(ref);
            ReviewVerdict verdict = consultAgent(preparation);
            ReviewOutcome outcome = finalizeReview(preparation, verdict);
            log.info("Review of {} finished: severity={}, vote={}, status={}", ref,
                    outcome.draft().verdict().severity(), outcome.draft().vote(), outcome.status());
            return outcome;
        } catch (RuntimeException e) {
            log.error("Review of {} failed: {}", ref, e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(pipelineTimer);
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * Runs {@link #review} on the review executor. A failure completes the returned future
     * exceptionally and never affects other PRs.
     */
    public CompletableFuture<ReviewOutcome> reviewAsync(PullRequestRef ref) {
        return CompletableFuture.supplyAsync(() -> review(ref), reviewExecutor);
    }

    private List<String> securityRecommendations(ReviewPreparation preparation) {
        if (!properties.includeSecurityFindings()) return List.of();
        return securityScanner.recommendations(preparation.securityFindings());
    }

    private ReviewVerdict mergeSecurityFindings(ReviewVerdict verdict, List<SecurityFinding> findings) {
        if (!properties.includeSecurityFindings() || findings.isEmpty()) return verdict;
        List<RawComment> extra = findings.stream().map(SecurityFinding::toComment).toList();
        ReviewVerdict merged = verdict.withAdditionalComments(extra);
        return new ReviewVerdict(false, ReviewVerdict.CRITICAL, merged.summary(),
                merged.comments(), merged.testSuggestions());
    }
}
