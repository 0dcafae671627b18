package com.paperinsight.model.vo;

import com.paperinsight.model.enums.SectionType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 结构化论文
 *
 * <p>章节保持原文顺序; 若存在摘要, 其内容与第一个 ABSTRACT 章节一致</p>
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PaperVO {

    /**
     * 论文标题
     */
    String title;

    /**
     * 作者列表(保持原顺序)
     */
    @Builder.Default
    List<Author> authors = List.of();

    /**
     * 摘要
     */
    String abstractText;

    /**
     * 章节结构
     */
    @Builder.Default
    List<Section> sections = List.of();

    /**
     * DOI
     */
    String doi;

    /**
     * arXiv 编号
     */
    String arxivId;

    /**
     * 会议/期刊名称
     */
    String venue;

    /**
     * 发表日期
     */
    LocalDate publicationDate;

    /**
     * 参考文献原始条目
     */
    @Builder.Default
    List<String> references = List.of();

    /**
     * 来源文件
     */
    String sourceFile;

    /**
     * 解析器版本
     */
    String parserVersion;

    /**
     * 入库时间(UTC)
     */
    Instant ingestionTimestamp;

    /**
     * 返回第一个指定类型的章节
     */
    public Optional<Section> findSection(SectionType type) {
        return sections.stream()
                .filter(section -> section.getSectionType() == type)
                .findFirst();
    }

    /**
     * 返回第一个指定类型章节的内容, 不存在时返回空串
     */
    public String sectionContent(SectionType type) {
        return findSection(type).map(Section::getContent).orElse("");
    }

    public boolean hasSection(SectionType type) {
        return findSection(type).isPresent();
    }

    /**
     * 作者信息
     */
    @Value
    @Builder
    @Jacksonized
    public static class Author {
        /**
         * 姓名
         */
        String name;

        /**
         * 机构
         */
        String affiliation;

        /**
         * 邮箱
         */
        String email;

        /**
         * ORCID
         */
        String orcid;
    }

    /**
     * 章节信息
     */
    @Value
    @Builder
    @Jacksonized
    public static class Section {
        /**
         * 章节类型
         */
        SectionType sectionType;

        /**
         * 匹配到的原始标题行, 前导 OTHER 章节没有标题
         */
        String title;

        /**
         * 正文, 行间以换行连接
         */
        String content;

        /**
         * 起始页
         */
        Integer pageStart;

        /**
         * 结束页
         */
        Integer pageEnd;
    }
}
