package com.paperinsight.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 句子在学术写作中的修辞功能
 * <p>声明顺序即打分并列时的优先顺序</p>
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Getter
@AllArgsConstructor
public enum RhetoricalFunction {

    BACKGROUND("background"),
    OBJECTIVE("objective"),
    METHOD("method"),
    RESULT("result"),
    CONCLUSION("conclusion"),
    FUTURE_WORK("future_work"),
    LIMITATION("limitation"),
    UNKNOWN("unknown");

    @JsonValue
    private final String value;
}
