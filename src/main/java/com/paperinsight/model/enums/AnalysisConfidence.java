package com.paperinsight.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 分析结果置信度
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Getter
@AllArgsConstructor
public enum AnalysisConfidence {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    @JsonValue
    private final String value;

    /**
     * 模型可能返回 "High" 或 " medium " 之类的写法, 统一大小写后匹配
     */
    @JsonCreator
    public static AnalysisConfidence fromValue(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (AnalysisConfidence confidence : values()) {
                if (confidence.value.equalsIgnoreCase(normalized)) {
                    return confidence;
                }
            }
        }
        throw new IllegalArgumentException("未知置信度: " + value);
    }
}
