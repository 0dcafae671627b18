package com.paperinsight.service.impl;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.config.EntityPatterns;
import com.paperinsight.model.enums.ScientificEntityType;
import com.paperinsight.model.vo.ScientificEntityVO;
import com.paperinsight.service.ScientificEntityService;
import com.paperinsight.service.nlp.LinguisticParser;
import com.paperinsight.service.nlp.NounPhrase;
import com.paperinsight.service.nlp.TextSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 科学实体抽取服务实现
 *
 * <p>两路来源: 正则表命中(置信度 0.8, 上下文为命中位置所在句子)与首字母大写的多词名词短语(CONCEPT, 置信度 0.6)。</p>
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Slf4j
@RequiredArgsConstructor
public class ScientificEntityServiceImpl implements ScientificEntityService {

    private final LinguisticParser linguisticParser;

    @Override
    public List<ScientificEntityVO> extractEntities(String text) {
        if (StrUtil.isBlank(text)) {
            return List.of();
        }
        try {
            List<TextSpan> sentences = linguisticParser.sentences(text);
            List<ScientificEntityVO> entities = new ArrayList<>();

            for (Map.Entry<ScientificEntityType, List<Pattern>> entry : EntityPatterns.PATTERNS.entrySet()) {
                for (Pattern pattern : entry.getValue()) {
                    Matcher matcher = pattern.matcher(text);
                    while (matcher.find()) {
                        entities.add(ScientificEntityVO.builder()
                                .text(matcher.group())
                                .entityType(entry.getKey())
                                .context(sentenceAt(sentences, matcher.start()))
                                .confidence(EntityPatterns.PATTERN_CONFIDENCE)
                                .build());
                    }
                }
            }

            for (NounPhrase phrase : linguisticParser.nounPhrases(text)) {
                if (phrase.getTokenCount() >= 2 && Character.isUpperCase(phrase.getText().charAt(0))) {
                    entities.add(ScientificEntityVO.builder()
                            .text(phrase.getText())
                            .entityType(ScientificEntityType.CONCEPT)
                            .context(phrase.getSentence())
                            .confidence(EntityPatterns.CONCEPT_CONFIDENCE)
                            .build());
                }
            }

            List<ScientificEntityVO> deduplicated = deduplicate(entities);
            log.debug("实体抽取完成: matches={}, unique={}", entities.size(), deduplicated.size());
            return deduplicated;
        } catch (RuntimeException e) {
            log.warn("实体抽取失败, 返回空列表: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private String sentenceAt(List<TextSpan> sentences, int offset) {
        for (TextSpan sentence : sentences) {
            if (sentence.contains(offset)) {
                return sentence.getText();
            }
        }
        return "";
    }

    /**
     * 同一 (小写文本, 类型) 只保留置信度最高的一条, 位置沿用首次出现的位置
     */
    private List<ScientificEntityVO> deduplicate(List<ScientificEntityVO> entities) {
        Map<String, ScientificEntityVO> seen = new LinkedHashMap<>();
        for (ScientificEntityVO entity : entities) {
            String key = entity.getText().toLowerCase(Locale.ROOT) + "|" + entity.getEntityType().name();
            ScientificEntityVO existing = seen.get(key);
            if (existing == null || entity.getConfidence() > existing.getConfidence()) {
                seen.put(key, entity);
            }
        }
        return List.copyOf(seen.values());
    }
}
