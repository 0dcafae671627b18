package com.paperinsight.service.impl;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.model.vo.KeyPhraseVO;
import com.paperinsight.service.KeyPhraseService;
import com.paperinsight.service.nlp.LinguisticParser;
import com.paperinsight.service.nlp.NounPhrase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 关键短语抽取服务实现, 仅按文内出现频次打分
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Slf4j
@RequiredArgsConstructor
public class KeyPhraseServiceImpl implements KeyPhraseService {

    private final LinguisticParser linguisticParser;

    @Override
    public List<KeyPhraseVO> extract(String text, int maxPhrases) {
        if (StrUtil.isBlank(text) || maxPhrases <= 0) {
            return List.of();
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (NounPhrase phrase : linguisticParser.nounPhrases(text)) {
            if (phrase.getTokenCount() < 2) {
                continue;
            }
            String lower = phrase.getText().toLowerCase(Locale.ROOT);
            boolean allStopWords = Arrays.stream(lower.split("[\\s-]+"))
                    .allMatch(linguisticParser::isStopWord);
            if (allStopWords) {
                continue;
            }
            scores.merge(lower, 1.0, Double::sum);
        }

        // 稳定排序, 同分保持首次出现顺序
        List<Map.Entry<String, Double>> ranked = new ArrayList<>(scores.entrySet());
        ranked.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));

        List<KeyPhraseVO> phrases = ranked.stream()
                .limit(maxPhrases)
                .map(entry -> KeyPhraseVO.builder().phrase(entry.getKey()).score(entry.getValue()).build())
                .collect(Collectors.toList());
        log.debug("关键短语抽取完成: candidates={}, returned={}", scores.size(), phrases.size());
        return phrases;
    }
}
