package com.paperinsight.config;

import org.junit.jupiter.api.Test;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

import static org.assertj.core.api.Assertions.assertThat;

class ChatClientConfigTest {

    @Test
    void analysisChatOptions_shouldRequestJsonObjectReplies() {
        // Arrange
        PaperInsightProperties.RemoteConfig remote = new PaperInsightProperties.RemoteConfig();
        remote.setModel("deepseek-chat");
        remote.setMaxTokens(2000);

        // Act
        OpenAiChatOptions options = ChatClientConfig.analysisChatOptions(remote);

        // Assert
        assertThat(options.getModel()).isEqualTo("deepseek-chat");
        assertThat(options.getMaxTokens()).isEqualTo(2000);
        assertThat(options.getResponseFormat()).isNotNull();
        assertThat(options.getResponseFormat().getType()).isEqualTo(ResponseFormat.Type.JSON_OBJECT);
    }
}
