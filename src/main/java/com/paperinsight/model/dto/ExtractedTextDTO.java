package com.paperinsight.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 文本抽取结果 - 结构化解析的输入
 *
 * <p>按页保存抽取出的原始文本, 页内按换行切分为行; 没有分页信息的纯文本视为单页</p>
 *
 * @author PaperInsight
 * @since 2026-09-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedTextDTO {

    /**
     * 各页原始文本(页码从 1 开始, 与下标 +1 对应)
     */
    @Builder.Default
    private List<String> pages = new ArrayList<>();

    /**
     * 文档元数据中的标题(可选)
     */
    private String titleHint;

    /**
     * 文档元数据中的作者字符串(可选), 如 "A. Smith; B. Jones and C. Lee"
     */
    private String authorHint;

    /**
     * 已知 DOI(可选)
     */
    private String doiHint;

    /**
     * 发表日期(可选)
     */
    private LocalDate publicationDate;

    /**
     * 来源文件名
     */
    private String sourceFile;

    /**
     * 由一整段文本构造单页输入
     */
    public static ExtractedTextDTO ofText(String text) {
        List<String> pages = new ArrayList<>();
        pages.add(text == null ? "" : text);
        return ExtractedTextDTO.builder().pages(pages).build();
    }

    /**
     * 所有页的文本按页序拼接
     */
    public String fullText() {
        if (pages == null || pages.isEmpty()) {
            return "";
        }
        return String.join("\n", pages);
    }
}
