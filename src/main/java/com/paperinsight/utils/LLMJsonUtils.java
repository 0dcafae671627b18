package com.paperinsight.utils;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.paperinsight.exception.PaperAnalysisException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM JSON 响应工具类
 *
 * <p>模型回复按严格模式解析: 只允许整体包裹一层 Markdown 代码块, 对象之外出现任何文字、
 * JSON 非法、出现未知字段或缺少必填字段都视为失败, 不做"尽量提取"。</p>
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
public class LLMJsonUtils {

    /**
     * 宽松序列化用: snake_case 字段名, 日期输出为 ISO 字符串
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * 严格反序列化用: 未知字段与尾随内容均报错
     */
    private static final ObjectMapper STRICT_MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .registerModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    // 整个回复被一层代码块包裹
    private static final Pattern CODE_FENCE_PATTERN = Pattern.compile("^```(?:json|JSON)?\\s*([\\s\\S]*?)\\s*```$");

    private LLMJsonUtils() {
    }

    /**
     * 去掉包裹整个回复的 Markdown 代码块标记; 代码块前后还有其他文字时原样返回
     *
     * @param rawResponse LLM 原始响应
     * @return 去掉代码块后的文本(已 trim)
     */
    public static String cleanCodeFence(String rawResponse) {
        if (rawResponse == null) {
            return "";
        }
        String cleaned = rawResponse.trim();
        Matcher matcher = CODE_FENCE_PATTERN.matcher(cleaned);
        if (matcher.matches()) {
            cleaned = matcher.group(1).trim();
        }
        return cleaned;
    }

    /**
     * 严格解析 JSON 对象
     *
     * @param rawResponse LLM 原始响应
     * @param clazz       目标类型
     * @param <T>         泛型类型
     * @return 解析后的对象
     * @throws PaperAnalysisException 回复为空、对象外有多余文字、JSON 非法或字段不匹配
     */
    public static <T> T parseStrictObject(String rawResponse, Class<T> clazz) {
        return parseStrictObject(rawResponse, clazz, List.of());
    }

    /**
     * 严格解析 JSON 对象, 并要求指定字段全部出现且不为 null
     *
     * @param rawResponse    LLM 原始响应
     * @param clazz          目标类型
     * @param requiredFields 必须出现的字段, 嵌套字段用点号分隔, 如 {@code research_problem.constraints}
     * @param <T>            泛型类型
     * @return 解析后的对象
     * @throws PaperAnalysisException 回复为空、对象外有多余文字、JSON 非法、缺少必填字段或字段不匹配
     */
    public static <T> T parseStrictObject(String rawResponse, Class<T> clazz, Collection<String> requiredFields) {
        if (StrUtil.isBlank(rawResponse)) {
            throw new PaperAnalysisException("LLM 响应为空");
        }
        String cleaned = cleanCodeFence(rawResponse);
        if (!cleaned.startsWith("{") || !cleaned.endsWith("}")) {
            throw new PaperAnalysisException("LLM 响应不是单个 JSON 对象");
        }
        try {
            JsonNode root = STRICT_MAPPER.readTree(cleaned);
            List<String> missing = missingFields(root, requiredFields);
            if (!missing.isEmpty()) {
                throw new PaperAnalysisException("缺少必填字段: " + missing);
            }
            return STRICT_MAPPER.treeToValue(root, clazz);
        } catch (JsonProcessingException e) {
            log.debug("JSON 解析失败, 原始响应: {}", rawResponse);
            throw new PaperAnalysisException("JSON 解析失败: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 按点号路径检查字段是否存在且不为 null
     */
    private static List<String> missingFields(JsonNode root, Collection<String> requiredFields) {
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            JsonNode node = root;
            for (String name : field.split("\\.")) {
                node = node == null ? null : node.get(name);
            }
            if (node == null || node.isNull()) {
                missing.add(field);
            }
        }
        return missing;
    }

    /**
     * 序列化为 snake_case JSON
     *
     * @param value 待序列化对象
     * @return JSON 字符串
     */
    public static String toJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PaperAnalysisException("JSON 序列化失败: " + e.getOriginalMessage(), e);
        }
    }
}
