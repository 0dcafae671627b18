package com.paperinsight.service.analysis;

/**
 * 远程补全调用, 一次请求对应一次回复
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@FunctionalInterface
public interface AnalysisCompletionClient {

    /**
     * @param systemPrompt 系统提示词
     * @param userPrompt   用户提示词
     * @return 模型原始回复文本
     */
    String complete(String systemPrompt, String userPrompt);
}
