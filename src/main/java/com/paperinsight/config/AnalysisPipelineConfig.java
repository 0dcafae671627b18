package com.paperinsight.config;

import cn.hutool.core.thread.NamedThreadFactory;
import com.paperinsight.service.AcademicAnalysisService;
import com.paperinsight.service.analysis.AnalysisCapabilities;
import com.paperinsight.service.analysis.AnalysisTier;
import com.paperinsight.service.analysis.NlpAnalysisTier;
import com.paperinsight.service.analysis.RemoteModelAnalysisTier;
import com.paperinsight.service.analysis.SpringAiCompletionClient;
import com.paperinsight.service.analysis.TemplateAnalysisTier;
import com.paperinsight.service.impl.AcademicAnalysisServiceImpl;
import com.paperinsight.service.impl.DiscourseSegmentationServiceImpl;
import com.paperinsight.service.impl.KeyPhraseServiceImpl;
import com.paperinsight.service.impl.ScientificEntityServiceImpl;
import com.paperinsight.service.nlp.LinguisticParser;
import com.paperinsight.service.nlp.NlpBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 分析层级装配
 *
 * <p>远程与本地 NLP 层级是否加入链路只在启动时判定一次, 模板层级始终兜底。</p>
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AnalysisPipelineConfig {

    private final PaperInsightProperties properties;

    @Bean
    public AnalysisCapabilities analysisCapabilities(NlpBackend nlpBackend) {
        AnalysisCapabilities capabilities = AnalysisCapabilities.of(properties, nlpBackend);
        log.info("分析能力: remote={}, nlp={}", capabilities.isRemoteAvailable(), capabilities.isNlpAvailable());
        if (!capabilities.isNlpAvailable()) {
            log.info("本地 NLP 不可用: {}", nlpBackend.getUnavailableReason());
        }
        return capabilities;
    }

    /**
     * 远程调用线程池, 等待结果时带超时
     */
    @Bean(name = "remoteAnalysisExecutor", destroyMethod = "shutdownNow")
    public ExecutorService remoteAnalysisExecutor() {
        return Executors.newFixedThreadPool(properties.getRemote().getMaxConcurrentCalls(),
                new NamedThreadFactory("remote-analysis-", true));
    }

    @Bean
    public AcademicAnalysisService academicAnalysisService(AnalysisCapabilities capabilities,
                                                           NlpBackend nlpBackend,
                                                           @Qualifier("paperAnalysisChatClient") ObjectProvider<ChatClient> chatClient,
                                                           @Qualifier("remoteAnalysisExecutor") ExecutorService executor,
                                                           @Qualifier("analysisSystemPrompt") String systemPrompt,
                                                           @Qualifier("paperAnalysisPromptTemplate") String promptTemplate) {
        List<AnalysisTier> tiers = new ArrayList<>();
        if (capabilities.isRemoteAvailable()) {
            tiers.add(new RemoteModelAnalysisTier(new SpringAiCompletionClient(chatClient.getObject()),
                    executor, properties.getRemote(), systemPrompt, promptTemplate));
        }
        if (capabilities.isNlpAvailable()) {
            LinguisticParser parser = nlpBackend.parser().orElseThrow();
            tiers.add(new NlpAnalysisTier(
                    new DiscourseSegmentationServiceImpl(parser),
                    new ScientificEntityServiceImpl(parser),
                    new KeyPhraseServiceImpl(parser),
                    properties.getNlp().getMaxKeyPhrases()));
        }
        return new AcademicAnalysisServiceImpl(tiers, new TemplateAnalysisTier());
    }
}
