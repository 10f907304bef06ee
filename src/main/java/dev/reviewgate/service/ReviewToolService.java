package dev.reviewgate.service;

import dev.reviewgate.agent.ReviewResponseParser;
import dev.reviewgate.config.AzureDevOpsProperties;
import dev.reviewgate.domain.enums.FileCategory;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.ConsolidatedComment;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.domain.valueobject.PullRequestSummary;
import dev.reviewgate.domain.valueobject.RawComment;
import dev.reviewgate.domain.valueobject.ReviewVerdict;
import dev.reviewgate.domain.valueobject.TestSuggestion;
import dev.reviewgate.dto.request.ToolRequest;
import dev.reviewgate.dto.response.PublicationReport;
import dev.reviewgate.dto.response.PullRequestReviewContext;
import dev.reviewgate.dto.response.ToolResponse;
import dev.reviewgate.infrastructure.azure.HostingClient;
import dev.reviewgate.review.PendingReviewStore;
import dev.reviewgate.review.ReviewDraft;
import dev.reviewgate.review.ReviewOrchestrator;
import dev.reviewgate.review.ReviewOutcome;
import dev.reviewgate.review.ReviewPreparation;
import dev.reviewgate.review.VoteDecisionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Named review operations for a tool-invocation host. Every operation returns a
 * {@link ToolResponse}; failures become a readable message rather than an exception.
 *
 * <p>Two ways to publish: {@code run_review} does everything with the configured agent;
 * {@code review_and_confirm} or {@code preview_review} followed by
 * {@code confirm_and_post_review} lets a person check the result first.
 */
@Service
public class ReviewToolService {

    private static final Logger log = LoggerFactory.getLogger(ReviewToolService.class);

    static final int MIN_REJECTION_REASON = 10;

    private final ReviewOrchestrator orchestrator;
    private final HostingClient hostingClient;
    private final ReviewResponseParser responseParser;
    private final VoteDecisionEngine voteEngine;
    private final PendingReviewStore pendingStore;
    private final AzureDevOpsProperties azureProperties;
    private final Map<String, Function<ToolRequest, ToolResponse>> operations = new LinkedHashMap<>();

    public ReviewToolService(ReviewOrchestrator orchestrator,
                             HostingClient hostingClient,
                             ReviewResponseParser responseParser,
                             VoteDecisionEngine voteEngine,
                             PendingReviewStore pendingStore,
                             AzureDevOpsProperties azureProperties) {
        this.orchestrator = orchestrator;
        this.hostingClient = hostingClient;
        this.responseParser = responseParser;
        this.voteEngine = voteEngine;
        this.pendingStore = pendingStore;
        this.azureProperties = azureProperties;

        operations.put("list_pull_requests", this::listPullRequests);
        operations.put("get_pull_request", this::getPullRequest);
        operations.put("get_pr_for_review", this::getPrForReview);
        operations.put("review_and_confirm", this::reviewAndConfirm);
        operations.put("preview_review", this::previewReview);
        operations.put("confirm_and_post_review", this::confirmAndPostReview);
        operations.put("post_review_comments", this::postReviewComments);
        operations.put("run_review", this::runReview);
        operations.put("add_pr_comment", this::addPrComment);
        operations.put("set_pr_vote", this::setPrVote);
        operations.put("approve_pull_request", this::approvePullRequest);
        operations.put("reject_pull_request", this::rejectPullRequest);
    }

    public Set<String> operationNames() {
        return operations.keySet();
    }

    public ToolResponse invoke(String operation, ToolRequest request) {
        String name = operation == null ? "" : operation.strip().toLowerCase(Locale.ROOT).replace('-', '_');
        Function<ToolRequest, ToolResponse> handler = operations.get(name);
        if (handler == null)
            return ToolResponse.error(name, "Unknown operation '%s'. Available: %s".formatted(operation, operations.keySet()));
        ToolRequest args = request == null ? ToolRequest.forPullRequest(null, 0) : request;
        try {
            return handler.apply(args);
        } catch (IllegalArgumentException e) {
            return ToolResponse.error(name, "Error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Operation {} failed: {}", name, e.getMessage(), e);
            return ToolResponse.error(name, "Error in %s: %s".formatted(name, e.getMessage()));
        }
    }

    ToolResponse listPullRequests(ToolRequest req) {
        String status = req.status() == null || req.status().isBlank() ? "active" : req.status();
        List<PullRequestSummary> prs = hostingClient.listPullRequests(
                organization(req), project(req), required(req.repositoryId(), "repositoryId"), status);
        StringBuilder sb = new StringBuilder("Found %d %s pull request(s)".formatted(prs.size(), status));
        prs.forEach(pr -> sb.append("\n- #%d %s (%s -> %s) by %s".formatted(
                pr.pullRequestId(), pr.title(), pr.sourceBranch(), pr.targetBranch(), pr.author())));
        return ToolResponse.ok("list_pull_requests", sb.toString(), prs);
    }

    ToolResponse getPullRequest(ToolRequest req) {
        PullRequestRef ref = ref(req);
        PullRequestMetadata pr = hostingClient.getPullRequest(ref);
        return ToolResponse.ok("get_pull_request",
                "PR #%d: %s [%s] %s -> %s".formatted(pr.pullRequestId(), pr.title(), pr.status(),
                        pr.sourceBranch(), pr.targetBranch()), pr);
    }

    ToolResponse getPrForReview(ToolRequest req) {
        ReviewPreparation preparation = orchestrator.prepare(ref(req));
        pendingStore.storePreparation(preparation);
        return ToolResponse.ok("get_pr_for_review",
                "PR data prepared: %d file(s), %d package(s) examined, %d security issue(s) detected"
                        .formatted(preparation.changes().size(),
                                preparation.dependencies().summary().totalPackagesExamined(),
                                preparation.securityFindings().size()),
                toContext(preparation));
    }

    ToolResponse reviewAndConfirm(ToolRequest req) {
        ReviewPreparation preparation = orchestrator.prepare(ref(req));
        ReviewDraft draft = orchestrator.draft(preparation, orchestrator.consultAgent(preparation));
        pendingStore.storeDraft(draft);
        return ToolResponse.ok("review_and_confirm", renderPreview(draft), draftReport(draft));
    }

    ToolResponse previewReview(ToolRequest req) {
        ReviewVerdict verdict = parseSubmittedVerdict(req);
        ReviewDraft draft = orchestrator.draft(preparationFor(req), verdict);
        pendingStore.storeDraft(draft);
        return ToolResponse.ok("preview_review", renderPreview(draft), draftReport(draft));
    }

    ToolResponse confirmAndPostReview(ToolRequest req) {
        if (!req.confirmed())
            return ToolResponse.error("confirm_and_post_review",
                    "Review not posted. Set confirm=true to post the previewed review.");
        PullRequestRef ref = ref(req);
        Optional<ReviewDraft> draft = pendingStore.takeDraft(ref.key());
        if (draft.isEmpty())
            return ToolResponse.error("confirm_and_post_review",
                    "No previewed review for %s. Run review_and_confirm or preview_review first.".formatted(ref.key()));
        return published("confirm_and_post_review", orchestrator.publish(draft.get()));
    }

    ToolResponse postReviewComments(ToolRequest req) {
        ReviewVerdict verdict = parseSubmittedVerdict(req);
        return published("post_review_comments", orchestrator.finalizeReview(preparationFor(req), verdict));
    }

    ToolResponse runReview(ToolRequest req) {
        return published("run_review", orchestrator.review(ref(req)));
    }

    ToolResponse addPrComment(ToolRequest req) {
        String content = required(req.content(), "content");
        int threadId = hostingClient.createCommentThread(ref(req), content, req.filePath(), req.lineNumber());
        String where = req.filePath() != null && req.lineNumber() != null
                ? " at %s:%d".formatted(req.filePath(), req.lineNumber()) : "";
        return ToolResponse.ok("add_pr_comment", "Comment thread %d created%s".formatted(threadId, where),
                Map.of("threadId", threadId));
    }

    ToolResponse setPrVote(ToolRequest req) {
        int vote = voteEngine.voteFor(required(req.vote(), "vote"));
        hostingClient.setVote(ref(req), vote);
        return ToolResponse.ok("set_pr_vote", "Vote set to %s (%d)".formatted(req.vote(), vote), Map.of("vote", vote));
    }

    ToolResponse approvePullRequest(ToolRequest req) {
        if (!req.confirmed())
            return ToolResponse.error("approve_pull_request", "Not approved. Set confirm=true to approve.");
        PullRequestRef ref = ref(req);
        if (req.content() != null && !req.content().isBlank())
            hostingClient.createCommentThread(ref, req.content(), null, null);
        hostingClient.setVote(ref, VoteDecisionEngine.APPROVE);
        return ToolResponse.ok("approve_pull_request", "PR #%d approved".formatted(ref.pullRequestId()),
                Map.of("vote", VoteDecisionEngine.APPROVE));
    }

    ToolResponse rejectPullRequest(ToolRequest req) {
        if (!req.confirmed())
            return ToolResponse.error("reject_pull_request", "Not rejected. Set confirm=true to reject.");
        String reason = req.reason() == null ? "" : req.reason().strip();
        if (reason.length() < MIN_REJECTION_REASON)
            return ToolResponse.error("reject_pull_request",
                    "A rejection reason of at least %d characters is required".formatted(MIN_REJECTION_REASON));
        PullRequestRef ref = ref(req);
        hostingClient.createCommentThread(ref, "**PR Rejected**\n\n" + reason, null, null);
        hostingClient.setVote(ref, VoteDecisionEngine.REJECT);
        return ToolResponse.ok("reject_pull_request", "PR #%d rejected".formatted(ref.pullRequestId()),
                Map.of("vote", VoteDecisionEngine.REJECT));
    }

    // ── Internal ───────────────────────────────────────────────────

    private ReviewPreparation preparationFor(ToolRequest req) {
        PullRequestRef ref = ref(req);
        return pendingStore.get(ref.key())
                .map(PendingReviewStore.PendingReview::preparation)
                .filter(p -> p.ref().equals(ref))
                .orElseGet(() -> orchestrator.prepare(ref));
    }

    private ReviewVerdict parseSubmittedVerdict(ToolRequest req) {
        ReviewVerdict verdict = responseParser.parse(required(req.reviewJson(), "reviewJson"));
        if (ReviewVerdict.UNPARSABLE_SUMMARY.equals(verdict.summary()))
            throw new IllegalArgumentException("reviewJson is not a JSON object");
        return verdict;
    }

    private ToolResponse published(String operation, ReviewOutcome outcome) {
        ReviewDraft draft = outcome.draft();
        if (!"partial_success".equals(outcome.status())) pendingStore.evict(draft.preparation().ref().key());
        PublicationReport report = new PublicationReport(outcome.status(), draft.verdict().severity(),
                draft.verdict().approved(), draft.vote(), outcome.posting().commentsPosted(),
                outcome.posting().voteUpdated(), outcome.posting().errors());
        String message = switch (outcome.status()) {
            case "duplicate" -> "Review already posted for this PR; nothing was sent.";
            case "success" -> "Review posted: %d comment(s), vote %d".formatted(report.commentsPosted(), report.vote());
            default -> "Review partially posted with %d error(s): %s"
                    .formatted(report.errors().size(), String.join("; ", report.errors()));
        };
        return new ToolResponse(operation, !"partial_success".equals(outcome.status()), message, report);
    }

    private static PublicationReport draftReport(ReviewDraft draft) {
        return new PublicationReport("preview", draft.verdict().severity(), draft.verdict().approved(),
                draft.vote(), 0, false, List.of());
    }

    static String renderPreview(ReviewDraft draft) {
        ReviewVerdict verdict = draft.verdict();
        List<String> lines = new ArrayList<>();
        String rule = "=".repeat(60);
        lines.add(rule);
        lines.add("REVIEW PREVIEW - NOT POSTED YET");
        lines.add(rule);
        lines.add("");
        lines.add("PR #%d in %s".formatted(draft.preparation().ref().pullRequestId(),
                draft.preparation().ref().repositoryId()));
        lines.add("Status: " + (verdict.approved() ? "APPROVED" : "CHANGES REQUIRED"));
        lines.add("Severity: " + verdict.severity().toUpperCase(Locale.ROOT));
        lines.add("Vote: " + draft.vote());
        lines.add("");
        lines.add("--- SUMMARY ---");
        lines.add(draft.summary());
        lines.add("");
        lines.add("--- LINE COMMENTS ---");
        if (draft.locationComments().isEmpty()) {
            lines.add("No line-specific comments");
        } else {
            for (ConsolidatedComment c : draft.locationComments()) {
                lines.add("%s (Line %d):".formatted(c.location().filePath(), c.location().lineNumber()));
                lines.add("  " + c.content().replace("\n", "\n  "));
            }
        }
        List<RawComment> general = draft.consolidation().general();
        if (!general.isEmpty()) {
            lines.add("");
            lines.add("--- GENERAL COMMENTS (will be in summary) ---");
            general.forEach(c -> lines.add("  [%s] %s".formatted(c.severity().name(), c.content())));
        }
        List<TestSuggestion> tests = verdict.testSuggestions();
        if (!tests.isEmpty()) {
            lines.add("");
            lines.add("--- TEST SUGGESTIONS ---");
            lines.add("%d test(s) will be suggested:".formatted(tests.size()));
            tests.forEach(t -> lines.add("  • %s: %s".formatted(t.testName(), t.description())));
        }
        lines.add("");
        lines.add(rule);
        lines.add("REVIEW STORED - Ready to post");
        lines.add("To post this review: confirm_and_post_review with confirm=true");
        return String.join("\n", lines);
    }

    private static PullRequestReviewContext toContext(ReviewPreparation p) {
        Map<String, FileCategory> categoryByPath = new LinkedHashMap<>();
        p.categories().forEach((category, paths) -> paths.forEach(path -> categoryByPath.put(path, category)));
        List<PullRequestReviewContext.ChangedFile> files = new ArrayList<>();
        for (Change c : p.changes()) {
            FileCategory category = categoryByPath.getOrDefault(c.path(), FileCategory.DEFAULT);
            files.add(new PullRequestReviewContext.ChangedFile(c.path(),
                    c.changeType().name().toLowerCase(Locale.ROOT), category.id(), c.testFile()));
        }
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        p.categories().forEach((category, paths) -> byCategory.put(category.id(), paths.size()));
        return new PullRequestReviewContext(p.metadata(), files, byCategory, p.dependencies().summary(),
                p.dependencies().issues(), p.securityFindings(), p.prompt());
    }

    private PullRequestRef ref(ToolRequest req) {
        if (req.pullRequestId() == null || req.pullRequestId() <= 0)
            throw new IllegalArgumentException("pullRequestId is required");
        return new PullRequestRef(organization(req), project(req),
                required(req.repositoryId(), "repositoryId"), req.pullRequestId());
    }

    private String organization(ToolRequest req) {
        return firstNonBlank(req.organization(), azureProperties.organization(), "organization");
    }

    private String project(ToolRequest req) {
        return firstNonBlank(req.project(), azureProperties.project(), "project");
    }

    private static String firstNonBlank(String override, String configured, String name) {
        if (override != null && !override.isBlank()) return override;
        if (configured != null && !configured.isBlank()) return configured;
        throw new IllegalArgumentException(name + " is required (not configured and not provided)");
    }

    private static String required(String value, String name) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(name + " is required");
        return value;
    }
}
