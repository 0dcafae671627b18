package com.paperinsight.service.analysis;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.model.enums.AnalysisConfidence;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 第三层级: 模板分析
 *
 * <p>只依赖论文结构本身, 输出确定性的占位内容, 不会失败; 置信度固定为 low。</p>
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
public class TemplateAnalysisTier implements AnalysisTier {

    public static final String NAME = "template";

    static final String NOT_SPECIFIED = "Not explicitly specified in the paper.";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public AcademicAnalysisVO analyze(PaperVO paper) {
        String title = StrUtil.nullToEmpty(paper.getTitle());
        String abstractText = StrUtil.nullToEmpty(paper.getAbstractText()).trim();
        boolean hasMethodology = StrUtil.isNotBlank(paper.sectionContent(SectionType.METHODOLOGY));
        boolean hasConclusion = StrUtil.isNotBlank(paper.sectionContent(SectionType.CONCLUSION));

        Map<String, String> keyConcepts = new LinkedHashMap<>();
        keyConcepts.put("Concept Extraction", "Requires entity recognition and semantic analysis of the full text.");

        return AcademicAnalysisVO.builder()
                .paperTitle(paper.getTitle())
                .paperDoi(paper.getDoi())
                .technicalSummary("This paper, titled \"" + title + "\", addresses a research problem in its domain. "
                        + "The proposed approach is described in the abstract and introduction sections; "
                        + "a detailed technical summary requires semantic analysis of the full text.")
                .researchProblem(AcademicAnalysisVO.ResearchProblem.builder()
                        .problemStatement(firstAbstractSentence(abstractText))
                        .domainRelevance("Domain relevance requires deeper semantic analysis.")
                        .constraints(hasMethodology
                                ? List.of("Constraints require deeper semantic analysis.")
                                : List.of("Methodology section not found"))
                        .build())
                .methodology(AcademicAnalysisVO.Methodology.builder()
                        .inputData(hasMethodology ? "Input data description requires semantic analysis." : NOT_SPECIFIED)
                        .techniques(List.of(hasMethodology ? "Technique extraction requires semantic analysis." : NOT_SPECIFIED))
                        .pipeline(hasMethodology ? "Pipeline description requires semantic analysis." : NOT_SPECIFIED)
                        .evaluation(hasMethodology ? "Evaluation method requires semantic analysis." : NOT_SPECIFIED)
                        .build())
                .mainContributions(AcademicAnalysisVO.boundContributions(List.of()))
                .limitations(hasConclusion
                        ? List.of("Limitation extraction requires semantic analysis.")
                        : List.of("Conclusion section not found"))
                .keyConcepts(keyConcepts)
                .thematicTags(AnalysisSupport.thematicTags(title, abstractText))
                .sotaPositioning("State-of-the-art positioning requires analysis of cited prior work, "
                        + "identification of research gaps and of methodological innovations.")
                .citationSummary("The work titled \"" + title + "\" presents a research contribution in its domain. "
                        + "The approach and results are described in the paper.")
                .analysisConfidence(AnalysisConfidence.LOW)
                .missingInformation(AnalysisSupport.missingInformation(paper))
                .build();
    }

    /**
     * 摘要首句, 按 ". " 切分
     */
    static String firstAbstractSentence(String abstractText) {
        if (StrUtil.isBlank(abstractText)) {
            return "Problem statement not explicitly identified in abstract.";
        }
        String first = abstractText.split("\\. ", 2)[0].trim();
        return StrUtil.endWithAny(first, ".", "!", "?") ? first : first + ".";
    }
}
