package com.paperinsight.model.vo;

import lombok.Builder;
import lombok.Value;

/**
 * 解析 + 分析的组合结果
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Value
@Builder
public class PaperAnalysisResultVO {

    PaperVO paper;

    AcademicAnalysisVO analysis;
}
