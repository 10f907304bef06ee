package dev.reviewgate.dto.response;

import dev.reviewgate.domain.valueobject.DependencySummary;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.SecurityFinding;

import java.util.List;
import java.util.Map;

/**
 * What an external reviewer needs to review a PR: metadata, the classified file list,
 * automated findings and the assembled prompt.
 */
public record PullRequestReviewContext(
        PullRequestMetadata metadata,
        List<ChangedFile> files,
        Map<String, Integer> filesByCategory,
        DependencySummary dependencies,
        List<String> dependencyIssues,
        List<SecurityFinding> securityFindings,
        String prompt
) {
    public record ChangedFile(String path, String changeType, String category, boolean testFile) {}
}
