package dev.reviewgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Review behaviour. customPromptFile, when set, replaces all category-specific
 * instructions.
 */
@ConfigurationProperties(prefix = "reviewgate.review")
public record ReviewProperties(String customPromptFile, Boolean includeSecurityFindings,
                               Policy policy, int executorPoolSize) {
    public ReviewProperties {
        if (includeSecurityFindings == null) includeSecurityFindings = true;
        if (policy == null) policy = new Policy(null, null, null);
        if (executorPoolSize <= 0) executorPoolSize = 4;
    }

    public static ReviewProperties defaults() {
        return new ReviewProperties(null, null, null, 0);
    }

    /** "Bug fix requires tests" keywords, matched case-insensitively. */
    public record Policy(Boolean enabled, List<String> titleKeywords, List<String> descriptionKeywords) {
        public Policy {
            if (enabled == null) enabled = true;
            if (titleKeywords == null || titleKeywords.isEmpty()) titleKeywords = List.of("bug", "fix", "hotfix");
            if (descriptionKeywords == null || descriptionKeywords.isEmpty())
                descriptionKeywords = List.of("hotfix", "bugfix");
        }
    }
}
