package com.paperinsight.service;

import com.paperinsight.model.vo.ScientificEntityVO;

import java.util.List;

/**
 * 科学实体抽取服务接口
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
public interface ScientificEntityService {

    /**
     * 抽取实体, 按 (小写文本, 类型) 去重并保留置信度最高者
     *
     * @param text 原文
     * @return 实体列表, 输入为空或解析失败时返回空列表
     */
    List<ScientificEntityVO> extractEntities(String text);
}
