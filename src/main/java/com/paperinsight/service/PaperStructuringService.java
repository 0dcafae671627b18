package com.paperinsight.service;

import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.model.vo.PaperVO;

/**
 * 论文结构化服务接口: 元数据 + 章节 -> 结构化论文
 *
 * @author PaperInsight
 * @since 2026-09-04
 */
public interface PaperStructuringService {

    /**
     * 解析论文结构
     *
     * @param extractedText 文本抽取结果
     * @return 结构化论文
     */
    PaperVO structure(ExtractedTextDTO extractedText);
}
