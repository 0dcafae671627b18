package com.paperinsight.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 论文解析与分析配置
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "paper-insight")
public class PaperInsightProperties {

    /**
     * 远程大模型分析配置
     */
    private RemoteConfig remote = new RemoteConfig();

    /**
     * 本地 NLP 分析配置
     */
    private NlpConfig nlp = new NlpConfig();

    /**
     * 章节切分配置
     */
    private SegmentationConfig segmentation = new SegmentationConfig();

    @Data
    public static class RemoteConfig {
        /**
         * 是否启用远程模型层级
         */
        private Boolean enabled = true;

        /**
         * API Key, 为空时启动阶段即降级
         */
        private String apiKey;

        /**
         * OpenAI 兼容接口地址
         */
        private String baseUrl = "https://api.deepseek.com";

        /**
         * 模型名称
         */
        private String model = "deepseek-chat";

        private Double temperature = 0.3;

        private Integer maxTokens = 4000;

        /**
         * 连接超时
         */
        private Duration connectTimeout = Duration.ofSeconds(30);

        /**
         * 整体调用超时, 超时视为该层级失败
         */
        private Duration timeout = Duration.ofSeconds(120);

        /**
         * 单个章节送入提示词的最大字符数
         */
        private Integer sectionCharLimit = 2000;

        /**
         * 整篇论文序列化后的最大字符数
         */
        private Integer promptCharLimit = 24000;

        /**
         * 远程调用线程数
         */
        private Integer maxConcurrentCalls = 4;
    }

    @Data
    public static class NlpConfig {
        /**
         * 是否启用本地 NLP 层级
         */
        private Boolean enabled = true;

        /**
         * 关键短语最多返回条数
         */
        private Integer maxKeyPhrases = 20;
    }

    @Data
    public static class SegmentationConfig {
        /**
         * 标题行最大长度(不含)
         */
        private Integer maxHeaderLength = 80;

        /**
         * 标题行最大词数(不含)
         */
        private Integer maxHeaderWords = 10;
    }
}
