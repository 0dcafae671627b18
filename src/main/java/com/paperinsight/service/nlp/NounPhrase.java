package com.paperinsight.service.nlp;

import lombok.Value;

/**
 * 名词短语候选
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Value
public class NounPhrase {

    /**
     * 原文片段(保留大小写与连字符)
     */
    String text;

    /**
     * 词数, 连字符复合词计为一个词
     */
    int tokenCount;

    /**
     * 所在句子
     */
    String sentence;

    int start;

    int end;
}
