package com.paperinsight.model.vo;

import com.paperinsight.model.enums.RhetoricalFunction;
import lombok.Builder;
import lombok.Value;

/**
 * 带修辞功能标注的句子
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Value
@Builder
public class AnnotatedSentenceVO {

    String text;

    RhetoricalFunction function;

    double confidence;

    /**
     * 句子在文本块中的序号(从 0 开始)
     */
    int position;
}
