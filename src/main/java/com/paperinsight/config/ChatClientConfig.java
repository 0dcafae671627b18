package com.paperinsight.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

/**
 * 远程模型 ChatClient 配置
 *
 * <p>懒加载: 只有远程层级启用且配置了 API Key 时才会被创建。</p>
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
@Configuration
public class ChatClientConfig {

    /**
     * 论文分析用 ChatClient(OpenAI 兼容接口, 默认 DeepSeek)
     */
    @Lazy
    @Bean("paperAnalysisChatClient")
    public ChatClient paperAnalysisChatClient(PaperInsightProperties properties, RestClient.Builder restClientBuilder) {
        PaperInsightProperties.RemoteConfig remote = properties.getRemote();
        log.info("初始化论文分析 ChatClient: baseUrl={}, model={}", remote.getBaseUrl(), remote.getModel());

        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(remote.getBaseUrl())
                .apiKey(remote.getApiKey())
                .restClientBuilder(restClientBuilder)
                .build();

        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(analysisChatOptions(remote))
                // 失败直接交给下一层级, 不重试
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();

        return ChatClient.builder(chatModel).build();
    }

    /**
     * 默认请求参数, 要求模型以 JSON 对象格式回复
     */
    static OpenAiChatOptions analysisChatOptions(PaperInsightProperties.RemoteConfig remote) {
        return OpenAiChatOptions.builder()
                .model(remote.getModel())
                .temperature(remote.getTemperature())
                .maxTokens(remote.getMaxTokens())
                .responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build())
                .build();
    }
}
