package com.paperinsight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 科学实体类型
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Getter
@AllArgsConstructor
public enum ScientificEntityType {

    /**
     * 研究任务或问题
     */
    TASK("task"),

    /**
     * 方法或算法
     */
    METHOD("method"),

    /**
     * 评价指标
     */
    METRIC("metric"),

    /**
     * 数据集或实验材料
     */
    MATERIAL("material"),

    /**
     * 关键技术概念
     */
    CONCEPT("concept"),

    /**
     * 软件或硬件工具
     */
    TOOL("tool");

    @JsonValue
    private final String value;
}
