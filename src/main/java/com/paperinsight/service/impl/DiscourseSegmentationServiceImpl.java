package com.paperinsight.service.impl;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.config.RhetoricalIndicators;
import com.paperinsight.model.enums.RhetoricalFunction;
import com.paperinsight.model.vo.AnnotatedSentenceVO;
import com.paperinsight.service.DiscourseSegmentationService;
import com.paperinsight.service.nlp.LinguisticParser;
import com.paperinsight.service.nlp.TextSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 篇章切分服务实现
 *
 * <p>每句按三部分打分: 指示词命中(每个 +1)、章节类型加成、位置先验(前 20% 偏背景/目标, 后 20% 偏结论/展望)。
 * 取最高分的功能, 并列时按枚举声明顺序取先者; 置信度 = min(最高分 / 3, 1), 最高分为 0 时标为 UNKNOWN。
 * 纯规则, 无随机性, 相同输入得到相同输出。</p>
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Slf4j
@RequiredArgsConstructor
public class DiscourseSegmentationServiceImpl implements DiscourseSegmentationService {

    private static final double INDICATOR_WEIGHT = 1.0;
    private static final double SECTION_BONUS = 2.0;
    private static final double INTRODUCTION_BONUS = 1.0;
    private static final double EARLY_BONUS = 0.5;
    private static final double LATE_CONCLUSION_BONUS = 0.5;
    private static final double LATE_FUTURE_WORK_BONUS = 0.3;
    private static final double CONFIDENCE_SCALE = 3.0;

    private final LinguisticParser linguisticParser;

    @Override
    public List<AnnotatedSentenceVO> segment(String text, String sectionHint) {
        if (StrUtil.isBlank(text)) {
            return List.of();
        }
        List<TextSpan> sentences = linguisticParser.sentences(text);
        List<AnnotatedSentenceVO> annotated = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++) {
            annotated.add(classify(sentences.get(i).getText(), sectionHint, i, sentences.size()));
        }
        log.debug("篇章切分完成: hint={}, sentences={}", sectionHint, annotated.size());
        return annotated;
    }

    private AnnotatedSentenceVO classify(String sentence, String sectionHint, int position, int total) {
        Map<RhetoricalFunction, Double> scores = new EnumMap<>(RhetoricalFunction.class);
        for (RhetoricalFunction function : RhetoricalFunction.values()) {
            scores.put(function, 0.0);
        }

        String lower = sentence.toLowerCase(Locale.ROOT);
        RhetoricalIndicators.INDICATORS.forEach((function, indicators) -> {
            for (String indicator : indicators) {
                if (lower.contains(indicator)) {
                    scores.merge(function, INDICATOR_WEIGHT, Double::sum);
                }
            }
        });

        if (StrUtil.isNotBlank(sectionHint)) {
            String hint = sectionHint.toLowerCase(Locale.ROOT);
            if (hint.contains("method")) {
                scores.merge(RhetoricalFunction.METHOD, SECTION_BONUS, Double::sum);
            } else if (hint.contains("result")) {
                scores.merge(RhetoricalFunction.RESULT, SECTION_BONUS, Double::sum);
            } else if (hint.contains("conclusion")) {
                scores.merge(RhetoricalFunction.CONCLUSION, SECTION_BONUS, Double::sum);
            } else if (hint.contains("introduction") || hint.contains("background")) {
                scores.merge(RhetoricalFunction.BACKGROUND, INTRODUCTION_BONUS, Double::sum);
                scores.merge(RhetoricalFunction.OBJECTIVE, INTRODUCTION_BONUS, Double::sum);
            }
        }

        double relativePosition = (double) position / Math.max(total, 1);
        if (relativePosition < 0.2) {
            scores.merge(RhetoricalFunction.BACKGROUND, EARLY_BONUS, Double::sum);
            scores.merge(RhetoricalFunction.OBJECTIVE, EARLY_BONUS, Double::sum);
        } else if (relativePosition > 0.8) {
            scores.merge(RhetoricalFunction.CONCLUSION, LATE_CONCLUSION_BONUS, Double::sum);
            scores.merge(RhetoricalFunction.FUTURE_WORK, LATE_FUTURE_WORK_BONUS, Double::sum);
        }

        // EnumMap 按声明顺序迭代, 严格大于才替换, 并列时保留先者
        RhetoricalFunction best = RhetoricalFunction.UNKNOWN;
        double maxScore = 0.0;
        for (Map.Entry<RhetoricalFunction, Double> entry : scores.entrySet()) {
            if (entry.getValue() > maxScore) {
                maxScore = entry.getValue();
                best = entry.getKey();
            }
        }

        double confidence = maxScore == 0.0 ? 0.0 : Math.min(maxScore / CONFIDENCE_SCALE, 1.0);
        return AnnotatedSentenceVO.builder()
                .text(sentence)
                .function(best)
                .confidence(confidence)
                .position(position)
                .build();
    }
}
