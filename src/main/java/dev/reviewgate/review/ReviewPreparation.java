package dev.reviewgate.review;

import dev.reviewgate.analysis.dependency.DependencyAnalysis;
import dev.reviewgate.domain.enums.FileCategory;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.PullRequestRef;
import dev.reviewgate.domain.valueobject.SecurityFinding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything computed about a PR before the agent is consulted.
 */
public record ReviewPreparation(
        PullRequestRef ref,
        PullRequestMetadata metadata,
        List<Change> changes,
        Map<FileCategory, List<String>> categories,
        List<SecurityFinding> securityFindings,
        DependencyAnalysis dependencies,
        String prompt
) {
    public ReviewPreparation {
        changes = List.copyOf(changes);
        categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        securityFindings = List.copyOf(securityFindings);
    }
}
