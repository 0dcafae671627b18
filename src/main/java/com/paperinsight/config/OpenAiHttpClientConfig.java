package com.paperinsight.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * 远程模型 HTTP 客户端超时配置
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
@Configuration
public class OpenAiHttpClientConfig {

    /**
     * 自定义 RestClient 超时配置
     * 读取超时与整体调用超时一致, 单篇论文分析可能耗时较长
     */
    @Bean
    public RestClientCustomizer restClientCustomizer(PaperInsightProperties properties) {
        PaperInsightProperties.RemoteConfig remote = properties.getRemote();
        log.info("配置远程模型 HTTP 客户端超时: 连接超时={}s, 读取超时={}s",
                remote.getConnectTimeout().toSeconds(), remote.getTimeout().toSeconds());

        return restClientBuilder -> restClientBuilder
                .requestFactory(clientHttpRequestFactory(remote));
    }

    private ClientHttpRequestFactory clientHttpRequestFactory(PaperInsightProperties.RemoteConfig remote) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(remote.getConnectTimeout());
        factory.setReadTimeout(remote.getTimeout());
        return factory;
    }
}
