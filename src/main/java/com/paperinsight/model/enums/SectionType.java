package com.paperinsight.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 论文章节类型
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Getter
@AllArgsConstructor
public enum SectionType {

    ABSTRACT("abstract"),
    INTRODUCTION("introduction"),
    BACKGROUND("background"),
    METHODOLOGY("methodology"),
    RESULTS("results"),
    DISCUSSION("discussion"),
    CONCLUSION("conclusion"),
    REFERENCES("references"),
    ACKNOWLEDGMENTS("acknowledgments"),
    APPENDIX("appendix"),
    OTHER("other");

    @JsonValue
    private final String value;

    @JsonCreator
    public static SectionType fromValue(String value) {
        for (SectionType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知章节类型: " + value);
    }
}
