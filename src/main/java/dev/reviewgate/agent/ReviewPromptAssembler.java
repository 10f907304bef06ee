package dev.reviewgate.agent;

import dev.reviewgate.analysis.FileClassifier;
import dev.reviewgate.domain.enums.ChangeType;
import dev.reviewgate.domain.enums.FileCategory;
import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.DependencySummary;
import dev.reviewgate.domain.valueobject.PullRequestMetadata;
import dev.reviewgate.domain.valueobject.SecurityFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the review context sent to the reviewing agent. Output depends only on the
 * arguments and the configured instructions, so the same PR always yields the same prompt.
 */
@Component
public class ReviewPromptAssembler {

    static final int MAX_ADDED_CONTENT_CHARS = 10_000;
    static final int MAX_DIFF_LINES = 500;
    static final int MAX_VULNERABLE_SHOWN = 5;
    static final int MAX_FINDINGS_PER_FILE = 10;
    static final String DIFF_TRUNCATED = "... (diff truncated)";

    private final FileClassifier classifier;
    private final ReviewInstructions instructions;

    public ReviewPromptAssembler(FileClassifier classifier, ReviewInstructions instructions) {
        this.classifier = classifier;
        this.instructions = instructions;
    }

    public String build(PullRequestMetadata metadata,
                        List<Change> changes,
                        Map<FileCategory, List<String>> categories,
                        DependencySummary dependencySummary,
                        List<SecurityFinding> securityFindings) {
        List<String> parts = new ArrayList<>();

        parts.add("Pull Request #%d: %s".formatted(metadata.pullRequestId(), metadata.title()));
        parts.add("Description: " + metadata.description());
        parts.add("Source Branch: " + metadata.sourceBranch());
        parts.add("Target Branch: " + metadata.targetBranch());

        parts.add("\n### File Type Summary:\n");
        categories.forEach((category, files) -> {
            if (!files.isEmpty()) parts.add("- %s: %d file(s)".formatted(category.id(), files.size()));
        });

        appendDependencies(parts, dependencySummary);
        appendSecurityFindings(parts, securityFindings);

        parts.add("\n### File Changes:\n");
        for (Map.Entry<FileCategory, List<String>> group : categories.entrySet()) {
            if (group.getValue().isEmpty()) continue;
            parts.add("\n#### " + group.getKey().title() + " Files:\n");
            Set<String> paths = new HashSet<>(group.getValue());
            for (Change change : changes) {
                if (paths.contains(change.path())) appendChange(parts, change);
            }
        }

        parts.add("\n### Review Instructions:\n");
        parts.add(selectInstructions(categories));

        return String.join("\n", parts);
    }

    /**
     * Custom template if configured; otherwise the combined block for mixed PRs, the
     * dominant category's text, or the default text when there is nothing to classify.
     */
    String selectInstructions(Map<FileCategory, List<String>> categories) {
        Optional<String> custom = instructions.customTemplate();
        if (custom.isPresent()) return custom.get();
        if (categories.isEmpty()) return instructions.defaultText();
        if (classifier.needsMixedReview(categories)) return instructions.combined(categories);
        return instructions.forCategory(classifier.dominant(categories));
    }

    private void appendDependencies(List<String> parts, DependencySummary summary) {
        if (summary == null || summary.totalPackagesExamined() == 0) return;
        parts.add("\n### Dependency Analysis:\n");
        parts.add("Packages examined: " + summary.totalPackagesExamined());
        summary.packagesByType().forEach((type, count) -> parts.add("- %s: %d".formatted(type, count)));
        if (!summary.hasIssues()) {
            parts.add("No known vulnerable packages.");
            return;
        }
        parts.add("Vulnerable packages: " + summary.vulnerablePackages());
        List<String> vulnerable = summary.vulnerableList();
        vulnerable.stream().limit(MAX_VULNERABLE_SHOWN).forEach(v -> parts.add("- " + v));
        if (vulnerable.size() > MAX_VULNERABLE_SHOWN)
            parts.add("- ... and %d more".formatted(vulnerable.size() - MAX_VULNERABLE_SHOWN));
    }

    private void appendSecurityFindings(List<String> parts, List<SecurityFinding> findings) {
        if (findings == null || findings.isEmpty()) return;
        parts.add("\n### Security Findings (automated scan):\n");
        Map<String, List<SecurityFinding>> byFile = new LinkedHashMap<>();
        for (SecurityFinding finding : findings) {
            byFile.computeIfAbsent(finding.filePath(), k -> new ArrayList<>()).add(finding);
        }
        byFile.forEach((file, fileFindings) -> {
            parts.add("**" + file + "**:");
            fileFindings.stream().limit(MAX_FINDINGS_PER_FILE)
                    .forEach(f -> parts.add("- Line %d: %s".formatted(f.lineNumber(), f.message())));
            if (fileFindings.size() > MAX_FINDINGS_PER_FILE)
                parts.add("- ... and %d more".formatted(fileFindings.size() - MAX_FINDINGS_PER_FILE));
        });
    }

    private void appendChange(List<String> parts, Change change) {
        if (change.changeType() == ChangeType.DELETE) {
            parts.add("\n**Deleted**: " + change.path());
        } else if (change.changeType() == ChangeType.ADD) {
            parts.add("\n**Added**: " + change.path());
            if (!change.newContent().isEmpty()) {
                String content = change.newContent();
                if (content.length() > MAX_ADDED_CONTENT_CHARS) content = content.substring(0, MAX_ADDED_CONTENT_CHARS);
                parts.add("```\n" + content + "\n```");
            }
        } else {
            parts.add("\n**Modified**: " + change.path());
            if (!change.oldContent().isEmpty() || !change.newContent().isEmpty()) {
                parts.add("\nChanges:");
                parts.add("```diff\n" + lineDiff(change.oldContent(), change.newContent()) + "\n```");
            }
        }
    }

    /**
     * Line-aligned diff: line i of the old text is compared with line i of the new text.
     * Not a minimal edit script; an insertion shifts every following line.
     */
    static String lineDiff(String oldContent, String newContent) {
        String[] oldLines = oldContent.lines().toArray(String[]::new);
        String[] newLines = newContent.lines().toArray(String[]::new);
        int max = Math.max(oldLines.length, newLines.length);

        List<String> out = new ArrayList<>();
        for (int i = 0; i < Math.min(max, MAX_DIFF_LINES); i++) {
            boolean inOld = i < oldLines.length;
            boolean inNew = i < newLines.length;
            if (inOld && inNew) {
                if (oldLines[i].equals(newLines[i])) {
                    out.add("  " + oldLines[i]);
                } else {
                    out.add("- " + oldLines[i]);
                    out.add("+ " + newLines[i]);
                }
            } else if (inOld) {
                out.add("- " + oldLines[i]);
            } else {
                out.add("+ " + newLines[i]);
            }
        }
        if (max > MAX_DIFF_LINES) out.add(DIFF_TRUNCATED);
        return String.join("\n", out);
    }
}
