package com.paperinsight.service.nlp;

import lombok.Value;

/**
 * 文本片段及其在原文中的字符区间 [start, end)
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Value
public class TextSpan {

    String text;

    int start;

    int end;

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }
}
