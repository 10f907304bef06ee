package dev.reviewgate.infrastructure.azure;

import com.fasterxml.jackson.databind.JsonNode;
import dev.reviewgate.analysis.FileClassifier;
import dev.reviewgate.config.AzureDevOpsProperties;
import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.domain.valueobject.PullRequestSummary;
import dev.reviewgate.exception.HostingClientException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Azure DevOps Git REST API (7.1) client. PAT basic auth, circuit breaker and rate limiter
 * on every public call. Uses WebClient with {@code .block()}; callers run on the review
 * executor or a request thread.
 */
@Component
public class AzureDevOpsClient implements HostingClient {

    private static final Logger log = LoggerFactory.getLogger(AzureDevOpsClient.class);

    static final String API_VERSION = "7.1";
    private static final String REPO_PATH = "/{org}/{project}/_apis/git/repositories/{repo}";

    private final WebClient webClient;
    private final FileClassifier classifier;
    private final Map<String, String> reviewerIds = new ConcurrentHashMap<>();

    public AzureDevOpsClient(WebClient.Builder builder, AzureDevOpsProperties properties, FileClassifier classifier) {
        if (!properties.isConfigured())
            throw new IllegalStateException(
                    "Azure DevOps is not configured: set reviewgate.azure.organization and reviewgate.azure.pat");
        this.classifier = classifier;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(30))
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        String credentials = Base64.getEncoder()
                .encodeToString((":" + properties.pat()).getBytes(StandardCharsets.UTF_8));
        this.webClient = builder.baseUrl(properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    @CircuitBreaker(name = "azure-devops") @RateLimiter(name = "azure-devops")
    public List<PullRequestSummary> listPullRequests(String organization, String project,
                                                     String repositoryId, String status) {
        JsonNode body = call("list pull requests in " + repositoryId, () -> webClient.get()
                .uri(REPO_PATH + "/pullrequests?searchCriteria.status={status}&api-version={v}",
                        organization, project, repositoryId, status == null ? "active" : status, API_VERSION)
                .retrieve().bodyToMono(JsonNode.class).block());

        List<PullRequestSummary> result = new ArrayList<>();
        for (JsonNode pr : body.path("value")) {
            result.add(new PullRequestSummary(
                    pr.path("pullRequestId").asInt(),
                    pr.path("title").asText(""),
                    pr.path("createdBy").path("displayName").asText(null),
                    pr.path("status").asText(""),
                    pr.path("sourceRefName").asText(null),
                    pr.path("targetRefName").asText(null)));
        }
        return result;
    }

    @Override
    @CircuitBreaker(name = "azure-devops") @RateLimiter(name = "azure-devops")
    public PullRequestMetadata getPullRequest(PullRequestRef ref) {
        return fetchPullRequest(ref);
    }

    /**
     * Files touched by the PR's own commits. Merge commits are skipped unless every commit is
     * a merge; the first occurrence of a path wins. New content is read at the commit, old
     * content of edits from the target branch.
     */
    @Override
    @CircuitBreaker(name = "azure-devops") @RateLimiter(name = "azure-devops")
    public List<Change> getPullRequestChanges(PullRequestRef ref) {
        PullRequestMetadata pr = fetchPullRequest(ref);

        JsonNode commitsBody = call("list commits of " + ref, () -> webClient.get()
                .uri(REPO_PATH + "/pullRequests/{id}/commits?api-version={v}",
                        ref.organization(), ref.project(), ref.repositoryId(), ref.pullRequestId(), API_VERSION)
                .retrieve().bodyToMono(JsonNode.class).block());

        List<JsonNode> commits = new ArrayList<>();
        commitsBody.path("value").forEach(commits::add);
        List<JsonNode> featureCommits = commits.stream().filter(c -> !isMergeCommit(c)).toList();
        if (featureCommits.isEmpty()) {
            if (!commits.isEmpty()) log.warn("All commits of {} are merges, using all of them", ref);
            featureCommits = commits;
        }

        Set<String> seen = new HashSet<>();
        List<Change> changes = new ArrayList<>();
        for (JsonNode commit : featureCommits) {
            String commitId = commit.path("commitId").asText();
            JsonNode changesBody = call("list changes of commit " + commitId, () -> webClient.get()
                    .uri(REPO_PATH + "/commits/{commitId}/changes?api-version={v}",
                            ref.organization(), ref.project(), ref.repositoryId(), commitId, API_VERSION)
                    .retrieve().bodyToMono(JsonNode.class).block());

            for (JsonNode change : changesBody.path("changes")) {
                JsonNode item = change.path("item");
                if (item.path("isFolder").asBoolean(false) || "tree".equals(item.path("gitObjectType").asText())) continue;
                String path = item.path("path").asText("");
                if (path.isEmpty() || !seen.add(path)) continue;

                ChangeType type = ChangeType.from(change.path("changeType").asText(""));
                String newContent = "";
                String oldContent = "";
                if (type != ChangeType.DELETE) {
                    newContent = fetchContent(ref, path, commitId, "commit");
                    if (type == ChangeType.EDIT) oldContent = fetchContent(ref, path, pr.targetBranch(), "branch");
                }
                changes.add(new Change(path, type, change.path("originalPath").asText(null),
                        oldContent, newContent, classifier.isTestPath(path)));
            }
        }

        changes.sort(Comparator.comparing(Change::path));
        log.info("Retrieved {} file change(s) for {} (folders excluded)", changes.size(), ref);
        return changes;
    }

    @Override
    @CircuitBreaker(name = "azure-devops") @RateLimiter(name = "azure-devops")
    public int createCommentThread(PullRequestRef ref, String content, String filePath, Integer line) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("comments", List.of(Map.of("parentCommentId", 0, "content", content, "commentType", 1)));
        body.put("status", 1);
        if (filePath != null && line != null && line > 0) {
            body.put("threadContext", Map.of(
                    "filePath", filePath.startsWith("/") ? filePath : "/" + filePath,
                    "rightFileStart", Map.of("line", line, "offset", 1),
                    "rightFileEnd", Map.of("line", line, "offset", 1)));
        }

        JsonNode created = call("create thread on " + ref, () -> webClient.post()
                .uri(REPO_PATH + "/pullRequests/{id}/threads?api-version={v}",
                        ref.organization(), ref.project(), ref.repositoryId(), ref.pullRequestId(), API_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve().bodyToMono(JsonNode.class).block());
        int threadId = created.path("id").asInt();
        log.debug("Created thread {} on {} at {}:{}", threadId, ref, filePath, line);
        return threadId;
    }

    @Override
    @CircuitBreaker(name = "azure-devops") @RateLimiter(name = "azure-devops")
    public void setVote(PullRequestRef ref, int vote) {
        String reviewerId = reviewerIds.computeIfAbsent(ref.organization(), this::authenticatedUserId);
        call("set vote on " + ref, () -> webClient.put()
                .uri(REPO_PATH + "/pullRequests/{id}/reviewers/{reviewer}?api-version={v}",
                        ref.organization(), ref.project(), ref.repositoryId(), ref.pullRequestId(),
                        reviewerId, API_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("vote", vote))
                .retrieve().toBodilessEntity().block());
        log.info("Vote {} recorded on {}", vote, ref);
    }

    private PullRequestMetadata fetchPullRequest(PullRequestRef ref) {
        JsonNode pr = call("get " + ref, () -> webClient.get()
                .uri(REPO_PATH + "/pullrequests/{id}?api-version={v}",
                        ref.organization(), ref.project(), ref.repositoryId(), ref.pullRequestId(), API_VERSION)
                .retrieve().bodyToMono(JsonNode.class).block());
        return new PullRequestMetadata(
                pr.path("pullRequestId").asInt(ref.pullRequestId()),
                pr.path("title").asText(""),
                pr.path("description").asText(null),
                pr.path("sourceRefName").asText(null),
                pr.path("targetRefName").asText(null),
                pr.path("createdBy").path("displayName").asText(null),
                pr.path("status").asText(""));
    }

    /** File text at a version; empty on any failure or for binary content. */
    String fetchContent(PullRequestRef ref, String path, String version, String versionType) {
        try {
            JsonNode item = call("get " + path + "@" + version, () -> webClient.get()
                    .uri(REPO_PATH + "/items?path={path}&versionDescriptor.version={version}"
                                    + "&versionDescriptor.versionType={type}&includeContent=true&api-version={v}",
                            ref.organization(), ref.project(), ref.repositoryId(), path, version, versionType, API_VERSION)
                    .retrieve().bodyToMono(JsonNode.class).block());
            String content = item.path("content").asText("");
            if (content.indexOf('\0') >= 0) {
                log.debug("Treating {} as binary", path);
                return "";
            }
            return content;
        } catch (HostingClientException e) {
            log.warn("Could not get content for {} at {}: {}", path, version, e.getMessage());
            return "";
        }
    }

    private String authenticatedUserId(String organization) {
        JsonNode data = call("resolve authenticated user", () -> webClient.get()
                .uri("/{org}/_apis/connectionData", organization)
                .retrieve().bodyToMono(JsonNode.class).block());
        String id = data.path("authenticatedUser").path("id").asText("");
        if (id.isEmpty()) throw new HostingClientException("connectionData returned no authenticated user id");
        return id;
    }

    static boolean isMergeCommit(JsonNode commit) {
        String message = commit.path("comment").asText("").toLowerCase(Locale.ROOT);
        return message.contains("merge") || message.contains("merging");
    }

    private static <T> T call(String description, Supplier<T> request) {
        T result;
        try {
            result = request.get();
        } catch (WebClientResponseException e) {
            throw new HostingClientException("Azure DevOps call failed (%s): %d %s"
                    .formatted(description, e.getStatusCode().value(), e.getStatusText()),
                    e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new HostingClientException("Azure DevOps call failed (%s): %s".formatted(description, e.getMessage()), e);
        }
        if (result == null) throw new HostingClientException("Azure DevOps returned an empty body (" + description + ")");
        return result;
    }
}
