package com.paperinsight.service.impl;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.service.PaperStructuringService;
import com.paperinsight.service.SectionSegmentationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 论文结构化服务实现
 *
 * <p>标题优先取文档元数据, 其次取首页第一行; 作者由元数据作者串拆分; 章节由
 * {@link SectionSegmentationService} 切分, 正文为空的标题章节被丢弃; 摘要取第一个 ABSTRACT 章节。</p>
 *
 * @author PaperInsight
 * @since 2026-09-04
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaperStructuringServiceImpl implements PaperStructuringService {

    public static final String PARSER_VERSION = "paper-insight-structurer-0.1.0";

    public static final String UNTITLED = "Untitled Document";

    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("[,;]|\\s+and\\s+|\\s*&\\s*");

    private static final Pattern DOI_PATTERN = Pattern.compile("\\b(10\\.\\d{4,9}/[-._;()/:A-Za-z0-9]+)");

    private static final Pattern ARXIV_PATTERN = Pattern.compile("arXiv:\\s*(\\d{4}\\.\\d{4,5}(?:v\\d+)?)",
            Pattern.CASE_INSENSITIVE);

    /**
     * 参考文献条目起始标记: [12] 或 12.
     */
    private static final Pattern REFERENCE_START = Pattern.compile("^(?:\\[\\d+]|\\d+\\.)\\s*");

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private final SectionSegmentationService sectionSegmentationService;

    @Override
    public PaperVO structure(ExtractedTextDTO extractedText) {
        ExtractedTextDTO input = extractedText != null ? extractedText : ExtractedTextDTO.ofText("");

        List<PaperVO.Section> sections = sectionSegmentationService.segment(input).stream()
                .filter(section -> section.getTitle() == null || StrUtil.isNotBlank(section.getContent()))
                .collect(Collectors.toList());

        String abstractText = sections.stream()
                .filter(section -> section.getSectionType() == SectionType.ABSTRACT)
                .map(PaperVO.Section::getContent)
                .findFirst()
                .orElse(null);

        String fullText = input.fullText();
        PaperVO paper = PaperVO.builder()
                .title(extractTitle(input))
                .authors(extractAuthors(input.getAuthorHint()))
                .abstractText(abstractText)
                .sections(List.copyOf(sections))
                .doi(StrUtil.isNotBlank(input.getDoiHint()) ? input.getDoiHint().trim() : findDoi(fullText))
                .arxivId(findFirst(ARXIV_PATTERN, fullText))
                .publicationDate(input.getPublicationDate())
                .references(extractReferences(sections))
                .sourceFile(input.getSourceFile())
                .parserVersion(PARSER_VERSION)
                .ingestionTimestamp(Instant.now())
                .build();

        log.info("论文结构化完成: title={}, authors={}, sections={}, abstract={}",
                paper.getTitle(), paper.getAuthors().size(), paper.getSections().size(), abstractText != null);
        return paper;
    }

    /**
     * 标题: 元数据标题(排除 untitled 和文件名) -> 首页第一个非空行 -> 默认值
     */
    private String extractTitle(ExtractedTextDTO input) {
        String hint = StrUtil.trim(input.getTitleHint());
        if (StrUtil.isNotBlank(hint) && !"untitled".equalsIgnoreCase(hint) && !looksLikeFileName(hint)) {
            return hint;
        }
        if (input.getPages() != null && !input.getPages().isEmpty() && input.getPages().get(0) != null) {
            for (String line : LINE_BREAK.split(input.getPages().get(0))) {
                if (StrUtil.isNotBlank(line)) {
                    return line.strip();
                }
            }
        }
        return UNTITLED;
    }

    private boolean looksLikeFileName(String hint) {
        String lower = hint.toLowerCase(Locale.ROOT);
        return lower.endsWith(".pdf") || lower.endsWith(".doc") || lower.endsWith(".docx")
                || lower.endsWith(".tex") || lower.startsWith("microsoft word - ");
    }

    private List<PaperVO.Author> extractAuthors(String authorHint) {
        if (StrUtil.isBlank(authorHint)) {
            return List.of();
        }
        List<PaperVO.Author> authors = new ArrayList<>();
        for (String name : AUTHOR_SEPARATOR.split(authorHint)) {
            if (StrUtil.isNotBlank(name)) {
                authors.add(PaperVO.Author.builder().name(name.strip()).build());
            }
        }
        return List.copyOf(authors);
    }

    private String findDoi(String text) {
        String doi = findFirst(DOI_PATTERN, text);
        // 句末标点和右括号不属于 DOI
        return doi == null ? null : doi.replaceAll("[.,;)]+$", "");
    }

    private String findFirst(Pattern pattern, String text) {
        if (StrUtil.isBlank(text)) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * 按 [n] / n. 标记拆分参考文献条目; 没有编号时每行一条
     */
    private List<String> extractReferences(List<PaperVO.Section> sections) {
        String content = sections.stream()
                .filter(section -> section.getSectionType() == SectionType.REFERENCES)
                .map(PaperVO.Section::getContent)
                .findFirst()
                .orElse("");
        if (StrUtil.isBlank(content)) {
            return List.of();
        }

        String[] lines = LINE_BREAK.split(content);
        boolean numbered = false;
        for (String line : lines) {
            if (REFERENCE_START.matcher(line).find()) {
                numbered = true;
                break;
            }
        }

        List<String> references = new ArrayList<>();
        StringBuilder current = null;
        for (String line : lines) {
            if (StrUtil.isBlank(line)) {
                continue;
            }
            if (!numbered) {
                references.add(line.strip());
                continue;
            }
            if (REFERENCE_START.matcher(line).find() || current == null) {
                if (current != null) {
                    references.add(current.toString());
                }
                current = new StringBuilder(line.strip());
            } else {
                current.append(' ').append(line.strip());
            }
        }
        if (current != null) {
            references.add(current.toString());
        }
        return List.copyOf(references);
    }
}
