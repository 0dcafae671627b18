package com.paperinsight.service;

import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;

/**
 * 学术分析服务接口
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
public interface AcademicAnalysisService {

    /**
     * 按层级依次尝试分析, 总能返回结果
     *
     * @param paper 结构化论文
     * @return 分析结果
     */
    AcademicAnalysisVO analyze(PaperVO paper);
}
