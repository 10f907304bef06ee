package dev.reviewgate.domain.valueobject;

import java.util.List;
import java.util.Map;

/**
 * Run-level aggregate of dependency manifest analysis.
 */
public record DependencySummary(
        int totalPackagesExamined,
        Map<String, Integer> packagesByType,
        int vulnerablePackages,
        List<String> vulnerableList,
        boolean hasIssues
) {
    public static DependencySummary empty() {
        return new DependencySummary(0, Map.of(), 0, List.of(), false);
    }
}
