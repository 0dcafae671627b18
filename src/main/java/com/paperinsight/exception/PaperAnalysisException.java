package com.paperinsight.exception;

/**
 * 论文解析/分析业务异常
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
public class PaperAnalysisException extends RuntimeException {

    public PaperAnalysisException(String message) {
        super(message);
    }

    public PaperAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
