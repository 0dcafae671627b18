package com.paperinsight.model.vo;

import lombok.Builder;
import lombok.Value;

/**
 * 关键短语及其频次得分
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Value
@Builder
public class KeyPhraseVO {

    /**
     * 小写短语
     */
    String phrase;

    double score;
}
