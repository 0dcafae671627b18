package com.paperinsight.config;

import com.paperinsight.service.nlp.LuceneLinguisticParser;
import com.paperinsight.service.nlp.NlpBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * NLP 后端配置: 启动时初始化一次, 失败只记录原因, 不阻止应用启动
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Slf4j
@Configuration
public class NlpConfig {

    @Bean
    public NlpBackend nlpBackend(PaperInsightProperties properties) {
        if (!Boolean.TRUE.equals(properties.getNlp().getEnabled())) {
            log.info("本地 NLP 已通过配置关闭");
            return NlpBackend.unavailable("disabled by configuration");
        }
        try {
            return NlpBackend.available(new LuceneLinguisticParser());
        } catch (RuntimeException | LinkageError e) {
            log.warn("NLP 后端初始化失败, 本地 NLP 层级不可用: {}", e.toString());
            return NlpBackend.unavailable(e.toString());
        }
    }
}
