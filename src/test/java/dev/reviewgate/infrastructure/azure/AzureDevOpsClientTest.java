package dev.reviewgate.infrastructure.azure;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.reviewgate.analysis.FileClassifier;
import dev.reviewgate.config.AzureDevOpsProperties;
import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.domain.valueobject.PullRequestSummary;
import dev.reviewgate.exception.HostingClientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class AzureDevOpsClientTest {

    private static final String REPO = "/org/proj/_apis/git/repositories/repo";

    private final PullRequestRef ref = new PullRequestRef("org", "proj", "repo", 42);
    private AzureDevOpsClient client;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        AzureDevOpsProperties properties = new AzureDevOpsProperties("org", "proj", "secret-pat", wmInfo.getHttpBaseUrl() + "/");
        client = new AzureDevOpsClient(WebClient.builder(), properties, new FileClassifier());
    }

    private static void stubPullRequest() {
        stubFor(get(urlPathEqualTo(REPO + "/pullrequests/42")).willReturn(okJson("""
                {"pullRequestId": 42, "title": "Fix totals", "description": "",
                 "sourceRefName": "refs/heads/feature/totals", "targetRefName": "refs/heads/main",
                 "createdBy": {"displayName": "Rui"}, "status": "active"}""")));
    }

    @Nested
    @DisplayName("pull request reads")
    class Reads {

        @Test
        @DisplayName("maps PR metadata and sends PAT basic auth")
        void metadata() {
            stubPullRequest();

            PullRequestMetadata pr = client.getPullRequest(ref);

            assertThat(pr.title()).isEqualTo("Fix totals");
            assertThat(pr.description()).isEqualTo("No description provided");
            assertThat(pr.sourceBranch()).isEqualTo("feature/totals");
            assertThat(pr.targetBranch()).isEqualTo("main");
            assertThat(pr.author()).isEqualTo("Rui");
            // base64(":secret-pat")
            verify(getRequestedFor(urlPathEqualTo(REPO + "/pullrequests/42"))
                    .withHeader("Authorization", equalTo("Basic OnNlY3JldC1wYXQ="))
                    .withQueryParam("api-version", equalTo("7.1")));
        }

        @Test
        @DisplayName("lists pull requests by status")
        void list() {
            stubFor(get(urlPathEqualTo(REPO + "/pullrequests"))
                    .withQueryParam("searchCriteria.status", equalTo("completed"))
                    .willReturn(okJson("""
                            {"value": [{"pullRequestId": 7, "title": "Bump deps", "status": "completed",
                                        "createdBy": {"displayName": "Kim"},
                                        "sourceRefName": "refs/heads/deps", "targetRefName": "refs/heads/main"}]}""")));

            List<PullRequestSummary> prs = client.listPullRequests("org", "proj", "repo", "completed");

            assertThat(prs).singleElement().satisfies(pr -> {
                assertThat(pr.pullRequestId()).isEqualTo(7);
                assertThat(pr.author()).isEqualTo("Kim");
            });
        }

        @Test
        @DisplayName("HTTP errors surface as HostingClientException with the status")
        void httpErrorSurfacesStatus() {
            stubFor(get(urlPathEqualTo(REPO + "/pullrequests/42")).willReturn(notFound()));

            assertThatThrownBy(() -> client.getPullRequest(ref))
                    .isInstanceOf(HostingClientException.class)
                    .satisfies(e -> assertThat(((HostingClientException) e).getStatusCode()).isEqualTo(404));
        }
    }

    @Nested
    @DisplayName("getPullRequestChanges")
    class Changes {

        @BeforeEach
        void stubCommits() {
            stubPullRequest();
            stubFor(get(urlPathEqualTo(REPO + "/pullRequests/42/commits")).willReturn(okJson("""
                    {"value": [
                      {"commitId": "c2", "comment": "Second pass"},
                      {"commitId": "m1", "comment": "Merged PR 40: Merge main into feature"},
                      {"commitId": "c1", "comment": "First pass"}]}""")));
            stubFor(get(urlPathEqualTo(REPO + "/commits/c2/changes")).willReturn(okJson("""
                    {"changes": [
                      {"item": {"path": "/src/Totals.cs", "gitObjectType": "blob"}, "changeType": "edit"},
                      {"item": {"path": "/src", "isFolder": true}, "changeType": "edit"}]}""")));
            stubFor(get(urlPathEqualTo(REPO + "/commits/c1/changes")).willReturn(okJson("""
                    {"changes": [
                      {"item": {"path": "/src/Totals.cs"}, "changeType": "edit"},
                      {"item": {"path": "/src/Image.cs"}, "changeType": "add"},
                      {"item": {"path": "/tests/TotalsTests.cs"}, "changeType": "add"},
                      {"item": {"path": "/old.txt"}, "changeType": "delete"},
                      {"item": {"path": "/lib", "gitObjectType": "tree"}, "changeType": "add"}]}""")));

            stubContent("/src/Totals.cs", "c2", "new totals");
            stubContent("/src/Totals.cs", "main", "old totals");
            stubContent("/tests/TotalsTests.cs", "c1", "test code");
            stubFor(get(urlPathEqualTo(REPO + "/items"))
                    .withQueryParam("path", equalTo("/src/Image.cs"))
                    .willReturn(serverError()));
        }

        private void stubContent(String path, String version, String content) {
            stubFor(get(urlPathEqualTo(REPO + "/items"))
                    .withQueryParam("path", equalTo(path))
                    .withQueryParam("versionDescriptor.version", equalTo(version))
                    .willReturn(okJson("{\"path\": \"" + path + "\", \"content\": \"" + content + "\"}")));
        }

        @Test
        @DisplayName("skips merge commits and folders, first path wins, sorted by path")
        void collectsChanges() {
            List<Change> changes = client.getPullRequestChanges(ref);

            assertThat(changes).extracting(Change::path)
                    .containsExactly("/old.txt", "/src/Image.cs", "/src/Totals.cs", "/tests/TotalsTests.cs");
            verify(0, getRequestedFor(urlPathEqualTo(REPO + "/commits/m1/changes")));

            Change totals = changes.get(2);
            assertThat(totals.changeType()).isEqualTo(ChangeType.EDIT);
            assertThat(totals.newContent()).isEqualTo("new totals");
            assertThat(totals.oldContent()).isEqualTo("old totals");

            assertThat(changes.get(3).testFile()).isTrue();
            assertThat(changes.get(0).changeType()).isEqualTo(ChangeType.DELETE);
        }

        @Test
        @DisplayName("a failed content fetch yields empty content instead of failing")
        void contentFailure() {
            List<Change> changes = client.getPullRequestChanges(ref);

            Change image = changes.get(1);
            assertThat(image.changeType()).isEqualTo(ChangeType.ADD);
            assertThat(image.newContent()).isEmpty();
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        @DisplayName("inline threads carry a rooted file path and line context")
        void inlineThread() {
            stubFor(post(urlPathEqualTo(REPO + "/pullRequests/42/threads")).willReturn(okJson("{\"id\": 77}")));

            int id = client.createCommentThread(ref, "**[ERROR]**: x", "src/Totals.cs", 12);

            assertThat(id).isEqualTo(77);
            verify(postRequestedFor(urlPathEqualTo(REPO + "/pullRequests/42/threads"))
                    .withRequestBody(matchingJsonPath("$.threadContext.filePath", equalTo("/src/Totals.cs")))
                    .withRequestBody(matchingJsonPath("$.threadContext.rightFileStart.line", equalTo("12")))
                    .withRequestBody(matchingJsonPath("$.comments[0].content", equalTo("**[ERROR]**: x"))));
        }

        @Test
        @DisplayName("general threads have no thread context")
        void generalThread() {
            stubFor(post(urlPathEqualTo(REPO + "/pullRequests/42/threads")).willReturn(okJson("{\"id\": 78}")));

            client.createCommentThread(ref, "summary", null, null);

            verify(postRequestedFor(urlPathEqualTo(REPO + "/pullRequests/42/threads"))
                    .withRequestBody(notMatching(".*threadContext.*")));
        }

        @Test
        @DisplayName("votes as the authenticated user, resolved once per organization")
        void vote() {
            stubFor(get(urlPathEqualTo("/org/_apis/connectionData"))
                    .willReturn(okJson("{\"authenticatedUser\": {\"id\": \"user-1\"}}")));
            stubFor(put(urlPathEqualTo(REPO + "/pullRequests/42/reviewers/user-1")).willReturn(okJson("{}")));

            client.setVote(ref, -10);
            client.setVote(ref, 10);

            verify(1, getRequestedFor(urlPathEqualTo("/org/_apis/connectionData")));
            verify(putRequestedFor(urlPathEqualTo(REPO + "/pullRequests/42/reviewers/user-1"))
                    .withRequestBody(equalToJson("{\"vote\": -10}")));
            verify(putRequestedFor(urlPathEqualTo(REPO + "/pullRequests/42/reviewers/user-1"))
                    .withRequestBody(equalToJson("{\"vote\": 10}")));
        }
    }

    @Test
    @DisplayName("refuses to start without organization and PAT")
    void requiresConfiguration() {
        assertThatIllegalStateException().isThrownBy(() -> new AzureDevOpsClient(WebClient.builder(),
                new AzureDevOpsProperties("org", "proj", "", null), new FileClassifier()));
    }
}
