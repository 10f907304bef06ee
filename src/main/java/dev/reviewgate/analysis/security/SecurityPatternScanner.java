package dev.reviewgate.analysis.security;

import dev.reviewgate.domain.valueobject.Change;
import dev.reviewgate.domain.valueobject.SecurityFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Line-level detector for leaked credentials and sensitive data. Deterministic and
 * independent of the reviewing agent: every non-comment line is run through
 * {@link SecurityDetectors#ORDERED} and all messages for a line are folded into a single
 * {@link SecurityFinding}. Identical messages from different detectors appear once.
 */
@Component
public class SecurityPatternScanner {

    private static final Logger log = LoggerFactory.getLogger(SecurityPatternScanner.class);

    static final String MESSAGE_PREFIX = "CRITICAL SECURITY: ";

    private final List<LineDetector> detectors;

    public SecurityPatternScanner() {
        this(SecurityDetectors.ORDERED);
    }

    SecurityPatternScanner(List<LineDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public List<SecurityFinding> scan(String path, String content) {
        if (content == null || content.isEmpty()) return List.of();

        List<String> lines = Arrays.asList(content.split("\n", -1));
        List<SecurityFinding> findings = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String trimmed = line.strip();
            if (trimmed.isEmpty() || CommentSyntax.isComment(trimmed, path)) continue;

            LineContext ctx = new LineContext(path, line, lines, i);
            Set<String> messages = new LinkedHashSet<>();
            for (LineDetector detector : detectors) {
                messages.addAll(detector.detect(ctx));
            }
            if (messages.isEmpty()) continue;

            findings.add(SecurityFinding.of(path, i + 1,
                    MESSAGE_PREFIX + String.join(", ", messages), trimmed));
            log.debug("Security issues at {}:{} ({} consolidated)", path, i + 1, messages.size());
        }
        return findings;
    }

    /** Scans the new content of every change; deleted files contribute nothing. */
    public List<SecurityFinding> scanAll(List<Change> changes) {
        List<SecurityFinding> all = new ArrayList<>();
        for (Change change : changes) {
            all.addAll(scan(change.path(), change.newContent()));
        }
        if (!all.isEmpty())
            log.warn("Security scan flagged {} line(s) across {} file(s)", all.size(),
                    all.stream().map(SecurityFinding::filePath).distinct().count());
        return all;
    }

    public List<String> recommendations(List<SecurityFinding> findings) {
        if (findings.isEmpty()) return List.of();
        List<String> hints = new ArrayList<>(List.of(
                "IMMEDIATE: Remove all methods that expose, return, or reveal password information",
                "REQUIRED: Ensure passwords are only used for validation/comparison, never exposed",
                "SECURITY: Review all logging statements to ensure no sensitive data is logged"));
        boolean secretsInSource = findings.stream().anyMatch(f ->
                f.message().contains("TOKEN LEAK") || f.message().contains("CLOUD SECRET LEAK")
                        || f.message().contains("CONNECTION STRING LEAK") || f.message().contains("CONFIGURATION LEAK"));
        if (secretsInSource)
            hints.add("SECURE: Move secrets and connection strings to a secret store or environment configuration");
        return hints;
    }
}
