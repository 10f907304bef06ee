package dev.reviewgate.review;

import dev.reviewgate.domain.enums.CommentSeverity;
import dev.reviewgate.domain.valueobject.DependencySummary;
import dev.reviewgate.domain.valueobject.RawComment;
import dev.reviewgate.domain.valueobject.ReviewVerdict;
import dev.reviewgate.domain.valueobject.SecurityFinding;
import dev.reviewgate.domain.valueobject.TestSuggestion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Markdown body of the summary thread posted once per review.
 */
@Component
public class SummaryRenderer {

    static final String HEADER = "## Automated Code Review Results";
    static final String FOOTER = "*This review was generated automatically by ReviewGate*";
    private static final int MAX_VULNERABLE_SHOWN = 3;
    private static final int MAX_SECURITY_SHOWN = 2;
    private static final int SECURITY_EXCERPT_CHARS = 80;

    public String render(ReviewVerdict verdict, List<RawComment> generalComments, DependencySummary dependencies) {
        return render(verdict, generalComments, dependencies, List.of());
    }

    public String render(ReviewVerdict verdict, List<RawComment> generalComments, DependencySummary dependencies,
                         List<String> securityRecommendations) {
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add("");
        lines.add(statusLine(verdict));
        lines.add("");

        if (dependencies != null && dependencies.totalPackagesExamined() > 0) appendPackages(lines, dependencies);

        if (!generalComments.isEmpty()) {
            lines.add("### General Review Comments");
            generalComments.forEach(c -> lines.add(CommentConsolidator.format(c)));
            lines.add("");
        }

        appendLineIssues(lines, verdict.comments());

        if (!securityRecommendations.isEmpty()) {
            lines.add("### Security Recommendations");
            securityRecommendations.forEach(r -> lines.add("- " + r));
            lines.add("");
        }

        if (!verdict.summary().isBlank()) {
            lines.add("### Summary");
            lines.add(verdict.summary());
            lines.add("");
        }

        if (!verdict.comments().isEmpty()) {
            lines.add("### Review Statistics");
            lines.add("- Critical errors: " + count(verdict.comments(), CommentSeverity.ERROR));
            lines.add("- Warnings: " + count(verdict.comments(), CommentSeverity.WARNING));
            lines.add("- Suggestions: " + count(verdict.comments(), CommentSeverity.INFO));
            lines.add("");
        }

        appendTestCases(lines, verdict.testSuggestions());

        lines.add("---");
        lines.add(FOOTER);
        return String.join("\n", lines);
    }

    static String statusLine(ReviewVerdict verdict) {
        if (verdict.approved()) return "**Review Status: APPROVED**";
        return switch (verdict.severity()) {
            case ReviewVerdict.CRITICAL -> "**Review Status: AUTOMATIC REJECTION (Critical Issues)**";
            case ReviewVerdict.MAJOR -> "**Review Status: CHANGES REQUIRED (Major Issues)**";
            case ReviewVerdict.MINOR -> "**Review Status: APPROVED WITH SUGGESTIONS**";
            default -> "**Review Status: APPROVED**";
        };
    }

    private static void appendPackages(List<String> lines, DependencySummary deps) {
        lines.add("### Package Security Analysis");
        lines.add("**Packages examined: " + deps.totalPackagesExamined() + "**");
        if (!deps.packagesByType().isEmpty()) {
            lines.add("");
            lines.add("Package types analyzed:");
            deps.packagesByType().forEach((type, n) -> lines.add("- %s: %d packages".formatted(type, n)));
        }
        lines.add("");
        if (deps.hasIssues()) {
            lines.add("**CRITICAL: %d vulnerable package(s) found:**".formatted(deps.vulnerablePackages()));
            deps.vulnerableList().stream().limit(MAX_VULNERABLE_SHOWN).forEach(v -> lines.add("- " + v));
            if (deps.vulnerableList().size() > MAX_VULNERABLE_SHOWN)
                lines.add("- ... and %d more".formatted(deps.vulnerableList().size() - MAX_VULNERABLE_SHOWN));
        } else {
            lines.add("**Result: No package vulnerabilities detected**");
        }
        lines.add("");
    }

    private static void appendLineIssues(List<String> lines, List<RawComment> comments) {
        List<RawComment> located = comments.stream().filter(c -> !c.isGeneral()).toList();
        if (located.isEmpty()) return;

        List<RawComment> security = located.stream()
                .filter(c -> SecurityFinding.ISSUE_TYPE.equals(c.issueType())).toList();
        List<RawComment> testing = located.stream()
                .filter(c -> ReviewPolicy.ISSUE_TYPE.equals(c.issueType())
                        || c.content().toLowerCase(Locale.ROOT).contains("test"))
                .toList();

        lines.add("### Line-Specific Issues Found");
        if (!security.isEmpty()) {
            lines.add("**Security violations: " + security.size() + "**");
            security.stream().limit(MAX_SECURITY_SHOWN).forEach(c -> lines.add("  - Line %d: %s"
                    .formatted(c.lineNumber(), truncate(c.content(), SECURITY_EXCERPT_CHARS))));
        }
        if (!testing.isEmpty()) {
            lines.add("**Testing violations: " + testing.size() + "**");
        }
        if (security.isEmpty() && testing.isEmpty()) {
            lines.add("**Code quality issues: " + located.size() + "**");
        }
        lines.add("");
    }

    private static void appendTestCases(List<String> lines, List<TestSuggestion> suggestions) {
        if (suggestions.isEmpty()) return;
        lines.add("### Required Test Cases");
        lines.add("The following %d test case(s) should be added:".formatted(suggestions.size()));
        lines.add("");
        int i = 1;
        for (TestSuggestion s : suggestions) {
            String name = s.testName().isBlank() ? "Test_" + i : s.testName();
            lines.add("#### %d. %s".formatted(i, name));
            if (!s.description().isBlank()) {
                lines.add("**Purpose:** " + s.description());
                lines.add("");
            }
            if (!s.testCode().isBlank()) {
                lines.add("**Stubbed Implementation:**");
                lines.add("```" + fenceLanguage(s.filePath()));
                lines.add(s.testCode().replace("\\n", "\n"));
                lines.add("```");
            }
            lines.add("");
            i++;
        }
    }

    static String fenceLanguage(String path) {
        if (path == null) return "";
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".cs") || lower.endsWith(".cshtml") || lower.endsWith(".razor")) return "csharp";
        if (lower.endsWith(".java")) return "java";
        if (lower.endsWith(".py")) return "python";
        if (lower.endsWith(".ts") || lower.endsWith(".tsx")) return "typescript";
        if (lower.endsWith(".js") || lower.endsWith(".jsx")) return "javascript";
        if (lower.endsWith(".sql")) return "sql";
        return "";
    }

    private static long count(List<RawComment> comments, CommentSeverity severity) {
        return comments.stream().filter(c -> c.severity() == severity).count();
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
