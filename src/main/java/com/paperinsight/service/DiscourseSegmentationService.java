package com.paperinsight.service;

import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.AnnotatedSentenceVO;

import java.util.List;

/**
 * 篇章切分服务接口: 分句并标注修辞功能
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
public interface DiscourseSegmentationService {

    /**
     * 分句并标注
     *
     * @param text        文本块
     * @param sectionHint 章节类型提示, 如 "methodology"(可为空)
     * @return 按句序排列的标注结果
     */
    List<AnnotatedSentenceVO> segment(String text, String sectionHint);

    /**
     * 分句并标注
     *
     * @param text        文本块
     * @param sectionType 所属章节类型(可为空)
     * @return 按句序排列的标注结果
     */
    default List<AnnotatedSentenceVO> segment(String text, SectionType sectionType) {
        return segment(text, sectionType == null ? null : sectionType.getValue());
    }
}
