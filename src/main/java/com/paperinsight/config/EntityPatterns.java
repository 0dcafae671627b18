package com.paperinsight.config;

import com.paperinsight.model.enums.ScientificEntityType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 科学实体抽取正则表
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
public final class EntityPatterns {

    /**
     * 规则匹配实体的固定置信度
     */
    public static final double PATTERN_CONFIDENCE = 0.8;

    /**
     * 名词短语概念实体的置信度
     */
    public static final double CONCEPT_CONFIDENCE = 0.6;

    /**
     * 实体类型 -> 有序正则列表
     */
    public static final Map<ScientificEntityType, List<Pattern>> PATTERNS;

    static {
        Map<ScientificEntityType, List<Pattern>> patterns = new LinkedHashMap<>();
        patterns.put(ScientificEntityType.METHOD, List.of(
                compile("\\b(?:algorithm|approach|method|technique|model|framework|system|architecture)\\b"),
                compile("\\b(?:neural network|deep learning|machine learning|SVM|CNN|RNN|LSTM|transformer)\\b"),
                compile("\\b(?:classification|regression|clustering|segmentation|detection)\\b")));
        patterns.put(ScientificEntityType.METRIC, List.of(
                compile("\\b(?:accuracy|precision|recall|F1[- ]score|AUC|ROC)\\b"),
                compile("\\b(?:RMSE|MAE|MSE|error rate|performance)\\b"),
                compile("\\b\\d+(?:\\.\\d+)?%")));
        patterns.put(ScientificEntityType.MATERIAL, List.of(
                compile("\\b(?:dataset|corpus|benchmark|database)\\b"),
                compile("\\b(?:MNIST|ImageNet|COCO|TIMIT|LibriSpeech)\\b"),
                compile("\\b(?:training set|test set|validation set)\\b")));
        patterns.put(ScientificEntityType.TASK, List.of(
                compile("\\b(?:recognition|detection|classification|prediction|estimation)\\b"),
                compile("\\b(?:speech recognition|image classification|object detection)\\b"),
                compile("\\b(?:problem|task|challenge)\\b")));
        patterns.put(ScientificEntityType.TOOL, List.of(
                compile("\\b(?:TensorFlow|PyTorch|Keras|scikit-learn|MATLAB)\\b"),
                compile("\\b(?:Python|Java|R)\\b|\\bC\\+\\+"),
                compile("\\b(?:GPU|CPU|FPGA|embedded system)\\b")));
        PATTERNS = Collections.unmodifiableMap(patterns);
    }

    private EntityPatterns() {
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
