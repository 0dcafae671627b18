package com.paperinsight.service;

import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.PaperVO;

import java.util.List;
import java.util.Optional;

/**
 * 章节切分服务接口
 *
 * @author PaperInsight
 * @since 2026-09-04
 */
public interface SectionSegmentationService {

    /**
     * 按行切分章节(无分页信息)
     *
     * @param lines 抽取出的文本行
     * @return 按原文顺序排列的章节, 至少包含一个
     */
    List<PaperVO.Section> segment(List<String> lines);

    /**
     * 按页切分章节, 章节记录起止页码
     *
     * @param extractedText 文本抽取结果
     * @return 按原文顺序排列的章节, 至少包含一个
     */
    List<PaperVO.Section> segment(ExtractedTextDTO extractedText);

    /**
     * 判断一行是否为章节标题
     *
     * @param line 文本行
     * @return 命中的章节类型
     */
    Optional<SectionType> matchHeader(String line);
}
