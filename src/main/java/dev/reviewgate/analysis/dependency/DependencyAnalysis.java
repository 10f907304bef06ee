package dev.reviewgate.analysis.dependency;

import dev.reviewgate.domain.valueobject.DependencySummary;

import java.util.List;

public record DependencyAnalysis(DependencySummary summary, List<String> issues) {

    public DependencyAnalysis {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static DependencyAnalysis empty() {
        return new DependencyAnalysis(DependencySummary.empty(), List.of());
    }
}
