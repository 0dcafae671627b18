package com.paperinsight.service.analysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;

/**
 * 基于 Spring AI {@link ChatClient} 的远程补全实现
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
@RequiredArgsConstructor
public class SpringAiCompletionClient implements AnalysisCompletionClient {

    private final ChatClient chatClient;

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        log.debug("调用远程模型, 提示词长度={}", userPrompt.length());
        return chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
    }
}
