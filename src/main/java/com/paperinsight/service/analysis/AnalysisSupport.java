package com.paperinsight.service.analysis;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.config.AnalysisLexicon;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.PaperVO;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 本地分析层级共用的规则: 缺失信息清单与主题分类
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
public final class AnalysisSupport {

    private AnalysisSupport() {
    }

    /**
     * 列出论文缺少的信息项
     */
    public static List<String> missingInformation(PaperVO paper) {
        List<String> missing = new ArrayList<>();
        if (StrUtil.isBlank(paper.getAbstractText())) {
            missing.add("Abstract");
        }
        if (StrUtil.isBlank(paper.getDoi())) {
            missing.add("DOI");
        }
        if (paper.getAuthors() == null || paper.getAuthors().isEmpty()) {
            missing.add("Authors");
        }
        if (paper.getPublicationDate() == null) {
            missing.add("Publication date");
        }
        if (!paper.hasSection(SectionType.METHODOLOGY)) {
            missing.add("Methodology section");
        }
        if (!paper.hasSection(SectionType.RESULTS)) {
            missing.add("Results section");
        }
        return missing;
    }

    /**
     * 按主题词典对标题 + 摘要分类, 无命中时返回默认标签
     */
    public static List<String> thematicTags(String title, String abstractText) {
        String text = (StrUtil.nullToEmpty(title) + " " + StrUtil.nullToEmpty(abstractText)).toLowerCase(Locale.ROOT);
        List<String> tags = new ArrayList<>();
        for (Map.Entry<String, List<String>> theme : AnalysisLexicon.THEMATIC_KEYWORDS.entrySet()) {
            if (theme.getValue().stream().anyMatch(text::contains)) {
                tags.add(theme.getKey());
            }
        }
        if (tags.isEmpty()) {
            tags.add(AnalysisLexicon.DEFAULT_THEMATIC_TAG);
        }
        return tags;
    }

    /**
     * 文本是否包含任一关键词(不区分大小写, 按词边界匹配)
     */
    public static boolean containsAny(String text, List<String> keywords) {
        if (StrUtil.isBlank(text)) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }
}
