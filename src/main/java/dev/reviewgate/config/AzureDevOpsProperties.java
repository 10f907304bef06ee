package dev.reviewgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Azure DevOps connection. organization and pat are required; project is the default
 * for tool calls that do not override it.
 */
@ConfigurationProperties(prefix = "reviewgate.azure")
public record AzureDevOpsProperties(String organization, String project, String pat, String baseUrl) {
    public AzureDevOpsProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://dev.azure.com";
        if (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }

    public boolean isConfigured() {
        return organization != null && !organization.isBlank() && pat != null && !pat.isBlank();
    }
}
