package com.paperinsight.model.vo;

import com.paperinsight.model.enums.ScientificEntityType;
import lombok.Builder;
import lombok.Value;

/**
 * 抽取出的科学实体, 仅在单次分析内有效
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Value
@Builder
public class ScientificEntityVO {

    /**
     * 匹配到的原文片段
     */
    String text;

    ScientificEntityType entityType;

    /**
     * 实体所在句子
     */
    String context;

    /**
     * 置信度 [0, 1]
     */
    double confidence;
}
