package com.paperinsight.service.impl;

import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.service.AcademicAnalysisService;
import com.paperinsight.service.analysis.AnalysisTier;
import com.paperinsight.service.analysis.TemplateAnalysisTier;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 学术分析编排实现
 *
 * <p>按顺序尝试各层级, 任一层级抛出异常即降级到下一个; 模板层级兜底, 不会失败。</p>
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
public class AcademicAnalysisServiceImpl implements AcademicAnalysisService {

    private final List<AnalysisTier> tiers;
    private final TemplateAnalysisTier templateTier;

    public AcademicAnalysisServiceImpl(List<AnalysisTier> tiers, TemplateAnalysisTier templateTier) {
        this.tiers = List.copyOf(tiers);
        this.templateTier = templateTier;
        log.info("学术分析层级: {}", tierNames());
    }

    @Override
    public AcademicAnalysisVO analyze(PaperVO paper) {
        for (AnalysisTier tier : tiers) {
            try {
                AcademicAnalysisVO analysis = tier.analyze(paper);
                log.info("分析完成: title={}, tier={}, confidence={}",
                        paper.getTitle(), tier.getName(), analysis.getAnalysisConfidence().getValue());
                return analysis;
            } catch (Exception e) {
                log.warn("分析层级 {} 失败, 降级到下一层级: {}", tier.getName(), e.getMessage());
            }
        }
        log.info("分析完成: title={}, tier={}", paper.getTitle(), templateTier.getName());
        return templateTier.analyze(paper);
    }

    /**
     * 实际生效的层级名称(含兜底层级)
     */
    public List<String> tierNames() {
        List<String> names = tiers.stream().map(AnalysisTier::getName).collect(Collectors.toList());
        names.add(templateTier.getName());
        return names;
    }
}
