package dev.reviewgate.infrastructure.ai;

import dev.reviewgate.config.AgentProperties;
import dev.reviewgate.exception.ReviewAgentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatModelReviewAgentTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final ChatModelReviewAgent agent =
            new ChatModelReviewAgent(chatModel, new AgentProperties("test-model", 0.1, 2048));

    @Test
    @DisplayName("sends the prompt with configured model options and returns the text")
    void returnsText() {
        when(chatModel.call(any(Prompt.class))).thenReturn(
                new ChatResponse(List.of(new Generation(new AssistantMessage("{\"approved\": true}")))));

        String reply = agent.review("Review this");

        assertThat(reply).isEqualTo("{\"approved\": true}");
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertThat(captor.getValue().getContents()).contains("Review this");
        assertThat(captor.getValue().getOptions().getModel()).isEqualTo("test-model");
        assertThat(captor.getValue().getOptions().getTemperature()).isEqualTo(0.1);
        assertThat(captor.getValue().getOptions().getMaxTokens()).isEqualTo(2048);
    }

    @Test
    @DisplayName("model failures are wrapped in ReviewAgentException")
    void wrapsFailures() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("throttled"));

        assertThatThrownBy(() -> agent.review("Review this"))
                .isInstanceOf(ReviewAgentException.class)
                .hasMessageContaining("test-model")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("an empty response is an agent failure")
    void emptyResponse() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));

        assertThatThrownBy(() -> agent.review("Review this")).isInstanceOf(ReviewAgentException.class);
    }
}
