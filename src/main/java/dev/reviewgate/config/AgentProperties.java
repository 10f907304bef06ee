package dev.reviewgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reviewgate.agent")
public record AgentProperties(String model, Double temperature, int maxOutputTokens) {
    public AgentProperties {
        if (model == null || model.isBlank()) model = "anthropic.claude-3-5-sonnet-20240620-v1:0";
        if (temperature == null) temperature = 0.2;
        if (maxOutputTokens <= 0) maxOutputTokens = 4096;
    }
}
