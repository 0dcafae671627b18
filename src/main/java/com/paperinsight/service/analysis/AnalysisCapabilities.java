package com.paperinsight.service.analysis;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.config.PaperInsightProperties;
import com.paperinsight.service.nlp.NlpBackend;
import lombok.Value;

/**
 * 启动时确定的分析能力, 之后只读
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Value
public class AnalysisCapabilities {

    /**
     * 远程层级: 已启用且配置了 API Key
     */
    boolean remoteAvailable;

    /**
     * 本地 NLP 层级: 后端初始化成功
     */
    boolean nlpAvailable;

    public static AnalysisCapabilities of(PaperInsightProperties properties, NlpBackend nlpBackend) {
        PaperInsightProperties.RemoteConfig remote = properties.getRemote();
        boolean remoteAvailable = Boolean.TRUE.equals(remote.getEnabled()) && StrUtil.isNotBlank(remote.getApiKey());
        return new AnalysisCapabilities(remoteAvailable, nlpBackend.isAvailable());
    }
}
