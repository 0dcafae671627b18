package com.paperinsight.service.nlp;

import java.util.List;

/**
 * 语言学解析后端: 分句与名词短语切分
 *
 * <p>实现类在进程内只初始化一次, 初始化后只读, 必须可被多线程并发调用</p>
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
public interface LinguisticParser {

    /**
     * 分句, 返回去除首尾空白后的句子及其在原文中的区间; 行内换行视为空格
     *
     * @param text 原文
     * @return 按出现顺序排列的句子
     */
    List<TextSpan> sentences(String text);

    /**
     * 抽取名词短语候选(不限词数, 由调用方过滤)
     *
     * @param text 原文
     * @return 按出现顺序排列的短语
     */
    List<NounPhrase> nounPhrases(String text);

    /**
     * 是否为停用词(不区分大小写)
     */
    boolean isStopWord(String word);
}
