package com.paperinsight.model.vo;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.model.enums.AnalysisConfidence;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 论文学术分析结果
 *
 * <p>主要贡献固定为 2 到 5 条, 不足时补齐占位条目, 超出时截断</p>
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AcademicAnalysisVO {

    public static final int MIN_CONTRIBUTIONS = 2;
    public static final int MAX_CONTRIBUTIONS = 5;

    private static final List<String> CONTRIBUTION_FILLERS = List.of(
            "Further contributions require deeper analysis of the full text.",
            "Additional contributions could not be identified from the available sections."
    );

    String paperTitle;

    String paperDoi;

    /**
     * 技术总结(1-2 段)
     */
    String technicalSummary;

    ResearchProblem researchProblem;

    Methodology methodology;

    @Builder.Default
    List<String> mainContributions = List.of();

    @Builder.Default
    List<String> limitations = List.of();

    /**
     * 概念 -> 定义, 保持插入顺序
     */
    @Builder.Default
    Map<String, String> keyConcepts = new LinkedHashMap<>();

    @Builder.Default
    List<String> thematicTags = List.of();

    /**
     * 在研究现状中的定位
     */
    String sotaPositioning;

    /**
     * 可直接用于文献综述的引用摘要
     */
    String citationSummary;

    @Builder.Default
    AnalysisConfidence analysisConfidence = AnalysisConfidence.MEDIUM;

    @Builder.Default
    List<String> missingInformation = List.of();

    /**
     * 研究问题
     */
    @Value
    @Builder
    @Jacksonized
    public static class ResearchProblem {
        String problemStatement;

        String domainRelevance;

        @Builder.Default
        List<String> constraints = List.of();
    }

    /**
     * 研究方法
     */
    @Value
    @Builder
    @Jacksonized
    public static class Methodology {
        String inputData;

        @Builder.Default
        List<String> techniques = List.of();

        String pipeline;

        String evaluation;
    }

    /**
     * 校验必填字段, 返回缺失字段名列表(空列表表示完整)
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (StrUtil.isBlank(technicalSummary)) {
            missing.add("technical_summary");
        }
        if (researchProblem == null) {
            missing.add("research_problem");
        } else {
            if (StrUtil.isBlank(researchProblem.getProblemStatement())) {
                missing.add("research_problem.problem_statement");
            }
            if (StrUtil.isBlank(researchProblem.getDomainRelevance())) {
                missing.add("research_problem.domain_relevance");
            }
        }
        if (methodology == null) {
            missing.add("methodology");
        } else {
            if (StrUtil.isBlank(methodology.getInputData())) {
                missing.add("methodology.input_data");
            }
            if (StrUtil.isBlank(methodology.getPipeline())) {
                missing.add("methodology.pipeline");
            }
            if (StrUtil.isBlank(methodology.getEvaluation())) {
                missing.add("methodology.evaluation");
            }
        }
        if (mainContributions == null || mainContributions.isEmpty()) {
            missing.add("main_contributions");
        }
        if (StrUtil.isBlank(sotaPositioning)) {
            missing.add("sota_positioning");
        }
        if (StrUtil.isBlank(citationSummary)) {
            missing.add("citation_summary");
        }
        return missing;
    }

    /**
     * 将贡献列表规整到 [2, 5] 条: 去掉空白条目, 不足补齐, 超出截断
     */
    public static List<String> boundContributions(List<String> contributions) {
        List<String> bounded = new ArrayList<>();
        if (contributions != null) {
            for (String contribution : contributions) {
                if (StrUtil.isNotBlank(contribution) && bounded.size() < MAX_CONTRIBUTIONS) {
                    bounded.add(contribution.trim());
                }
            }
        }
        int filler = 0;
        while (bounded.size() < MIN_CONTRIBUTIONS) {
            bounded.add(CONTRIBUTION_FILLERS.get(filler++ % CONTRIBUTION_FILLERS.size()));
        }
        return List.copyOf(bounded);
    }
}
