package com.paperinsight.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分析阶段使用的关键词表: 主题分类词典与各字段的抽取触发词
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
public final class AnalysisLexicon {

    /**
     * 没有任何主题命中时的默认标签
     */
    public static final String DEFAULT_THEMATIC_TAG = "General Research";

    /**
     * 主题标签 -> 触发关键词(小写), 迭代顺序即输出顺序
     */
    public static final Map<String, List<String>> THEMATIC_KEYWORDS;

    static {
        Map<String, List<String>> themes = new LinkedHashMap<>();
        themes.put("Speech Processing", List.of("speech", "voice", "audio"));
        themes.put("Pattern Recognition", List.of("recognition", "classification"));
        themes.put("Embedded Systems", List.of("embedded", "portable", "device"));
        themes.put("Assistive Technologies", List.of("assistive", "accessibility", "disability"));
        themes.put("Machine Learning", List.of("machine learning", "neural", "deep learning"));
        THEMATIC_KEYWORDS = Collections.unmodifiableMap(themes);
    }

    /**
     * 表明领域重要性的词
     */
    public static final List<String> IMPORTANCE_WORDS = List.of(
            "important", "importance", "crucial", "critical", "essential", "significant",
            "vital", "key", "challenging", "widely", "increasingly", "growing");

    /**
     * 输入数据相关词
     */
    public static final List<String> DATA_KEYWORDS = List.of(
            "data", "dataset", "corpus", "samples", "participants", "signals",
            "images", "recordings", "collected");

    /**
     * 评估相关词
     */
    public static final List<String> EVALUATION_KEYWORDS = List.of(
            "evaluate", "evaluation", "evaluated", "metric", "accuracy", "benchmark",
            "compared", "comparison", "validation", "validated");

    /**
     * 第一人称贡献声明
     */
    public static final List<String> CLAIM_INDICATORS = List.of(
            "we propose", "we present", "we introduce", "we develop", "we show",
            "we demonstrate", "we achieve", "our contribution", "our results",
            "this paper presents", "this work presents");

    /**
     * 局限性相关词
     */
    public static final List<String> LIMITATION_KEYWORDS = List.of(
            "limitation", "limited", "drawback", "shortcoming", "weakness",
            "does not", "cannot", "unable to", "restricted to");

    /**
     * 约束/假设相关词
     */
    public static final List<String> CONSTRAINT_KEYWORDS = List.of(
            "assume", "assumption", "constraint", "constrained", "require", "requires",
            "limited to", "only");

    private AnalysisLexicon() {
    }
}
