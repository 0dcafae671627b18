package com.paperinsight.service;

import com.paperinsight.model.vo.KeyPhraseVO;

import java.util.List;

/**
 * 关键短语抽取服务接口
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
public interface KeyPhraseService {

    /**
     * 按出现频次抽取关键短语
     *
     * @param text       原文
     * @param maxPhrases 最多返回条数
     * @return 按得分降序排列的短语, 同分按首次出现顺序
     */
    List<KeyPhraseVO> extract(String text, int maxPhrases);
}
