package dev.reviewgate.infrastructure.ai;

import dev.reviewgate.agent.ReviewAgentClient;
import dev.reviewgate.config.AgentProperties;
import dev.reviewgate.exception.ReviewAgentException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Reviewing agent backed by a Spring AI {@link ChatModel} (Bedrock Converse in the default
 * configuration). Model id, temperature and output budget come from {@link AgentProperties}.
 */
@Component
public class ChatModelReviewAgent implements ReviewAgentClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelReviewAgent.class);

    private final ChatModel chatModel;
    private final AgentProperties properties;

    public ChatModelReviewAgent(ChatModel chatModel, AgentProperties properties) {
        this.chatModel = chatModel;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "review-agent")
    @RateLimiter(name = "review-agent")
    public String review(String prompt) {
        ChatOptions options = ChatOptions.builder()
                .model(properties.model())
                .temperature(properties.temperature())
                .maxTokens(properties.maxOutputTokens())
                .build();

        Instant start = Instant.now();
        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(prompt, options));
        } catch (RuntimeException e) {
            throw new ReviewAgentException("Model " + properties.model() + " call failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null)
            throw new ReviewAgentException("Model " + properties.model() + " returned no output", null);

        String text = response.getResult().getOutput().getText();
        log.info("Agent replied in {} ms ({} chars, prompt {} chars)",
                Duration.between(start, Instant.now()).toMillis(),
                text == null ? 0 : text.length(), prompt.length());
        return text == null ? "" : text;
    }
}
