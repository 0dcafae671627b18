package com.paperinsight.exception;

import lombok.Getter;

/**
 * 分析层级失败, 由编排器捕获后降级到下一层级
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Getter
public class AnalysisTierException extends PaperAnalysisException {

    /**
     * 失败的层级名称
     */
    private final String tier;

    public AnalysisTierException(String tier, String message) {
        super("[" + tier + "] " + message);
        this.tier = tier;
    }

    public AnalysisTierException(String tier, String message, Throwable cause) {
        super("[" + tier + "] " + message, cause);
        this.tier = tier;
    }
}
