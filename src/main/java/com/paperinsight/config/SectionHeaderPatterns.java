package com.paperinsight.config;

import com.paperinsight.model.enums.SectionType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 章节标题匹配规则(多学科、中英西文同义词)
 *
 * <p>按优先级顺序匹配, 先命中者生效, 例如 "Summary" 归入 ABSTRACT 而不是 CONCLUSION。
 * 标题允许前导编号(阿拉伯数字或罗马数字)和结尾标点, 不区分大小写, 必须整行匹配。</p>
 *
 * @author PaperInsight
 * @since 2026-09-04
 */
public final class SectionHeaderPatterns {

    private static final String NUMBERING = "(?:(?:\\d+(?:\\.\\d+)*|[IVX]+)\\.?\\s*)?";

    private static final String TRAILING = "\\s*[:.\\-]?\\s*";

    /**
     * 章节类型 -> 标题正则, 迭代顺序即匹配优先级
     */
    public static final Map<SectionType, Pattern> PATTERNS;

    static {
        Map<SectionType, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(SectionType.ABSTRACT, header(
                "abstract|resumen|summary|executive\\s+summary"));
        patterns.put(SectionType.INTRODUCTION, header(
                "introduction|introducción|introduccion|background|motivation|overview|preliminaries"
                        + "|problem\\s+statement|context"));
        // 工程: system model / proposed method; 医学: materials and methods / patients and methods
        patterns.put(SectionType.METHODOLOGY, header(
                "methodology|metodología|metodologia|methods?|materials?\\s+and\\s+methods?"
                        + "|patients?\\s+and\\s+methods?|experimental\\s+setup|approach|implementation"
                        + "|system\\s+design|architecture|system\\s+model|proposed\\s+method|algorithm"
                        + "|procedure|study\\s+design|participants?|protocol"));
        patterns.put(SectionType.RESULTS, header(
                "results?|resultados|findings|experimental\\s+results?|experiments?|evaluations?"
                        + "|performance(?:\\s+evaluation)?|outcomes?|simulation\\s+results?"
                        + "|analysis\\s+of\\s+results|results\\s+and\\s+discussion"));
        // 社科: theoretical framework; related work 视为讨论
        patterns.put(SectionType.DISCUSSION, header(
                "discussion|discusión|discusion|analysis|interpretation|limitations?|implications?"
                        + "|theoretical\\s+framework|literature\\s+review|related\\s+works?"));
        patterns.put(SectionType.CONCLUSION, header(
                "conclusions?|conclusiones|concluding\\s+remarks|summary|future\\s+work"
                        + "|conclusions?\\s+and\\s+future\\s+work|recommendations?"));
        patterns.put(SectionType.REFERENCES, header(
                "references?|referencias|bibliography|bibliografía|bibliografia|works?\\s+cited|sources?"));
        patterns.put(SectionType.ACKNOWLEDGMENTS, header(
                "acknowledge?ments?|agradecimientos"));
        patterns.put(SectionType.APPENDIX, header(
                "appendix(?:\\s+[a-z0-9]+)?|appendices|anexos?|supplementary\\s+materials?"));
        PATTERNS = Collections.unmodifiableMap(patterns);
    }

    private SectionHeaderPatterns() {
    }

    private static Pattern header(String alternatives) {
        return Pattern.compile("^\\s*" + NUMBERING + "(?:" + alternatives + ")" + TRAILING + "$",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
