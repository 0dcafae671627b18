package com.paperinsight.service.analysis;

import com.paperinsight.exception.AnalysisTierException;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;

/**
 * 分析层级
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
public interface AnalysisTier {

    /**
     * 层级名称, 用于日志
     */
    String getName();

    /**
     * 分析论文
     *
     * @param paper 结构化论文
     * @return 分析结果
     * @throws AnalysisTierException 本层级无法给出结果, 由编排器降级到下一层级
     */
    AcademicAnalysisVO analyze(PaperVO paper);
}
