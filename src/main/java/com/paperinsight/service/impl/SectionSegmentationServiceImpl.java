package com.paperinsight.service.impl;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.config.PaperInsightProperties;
import com.paperinsight.config.SectionHeaderPatterns;
import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.service.SectionSegmentationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 章节切分服务实现
 *
 * <p>逐行扫描: 形似标题(短行)且命中 {@link SectionHeaderPatterns} 的行开启新章节, 其余行追加到当前章节。
 * 标题行作为章节 title, 正文行作为 content, 每个非空行恰好归属一个章节。没有识别到任何标题时,
 * 全部文本归入一个 OTHER 章节。该过程不会抛出异常。</p>
 *
 * @author PaperInsight
 * @since 2026-09-04
 */
@Slf4j
@Service
public class SectionSegmentationServiceImpl implements SectionSegmentationService {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n|\\r");

    private final int maxHeaderLength;

    private final int maxHeaderWords;

    public SectionSegmentationServiceImpl(PaperInsightProperties properties) {
        this.maxHeaderLength = properties.getSegmentation().getMaxHeaderLength();
        this.maxHeaderWords = properties.getSegmentation().getMaxHeaderWords();
    }

    @Override
    public List<PaperVO.Section> segment(List<String> lines) {
        List<PageLine> pageLines = new ArrayList<>();
        if (lines != null) {
            for (String line : lines) {
                pageLines.add(new PageLine(line, null));
            }
        }
        return doSegment(pageLines);
    }

    @Override
    public List<PaperVO.Section> segment(ExtractedTextDTO extractedText) {
        List<PageLine> pageLines = new ArrayList<>();
        if (extractedText != null && extractedText.getPages() != null) {
            List<String> pages = extractedText.getPages();
            // 单页输入视为没有分页信息
            boolean paged = pages.size() > 1;
            for (int i = 0; i < pages.size(); i++) {
                String page = pages.get(i);
                if (page == null) {
                    continue;
                }
                for (String line : LINE_BREAK.split(page)) {
                    pageLines.add(new PageLine(line, paged ? i + 1 : null));
                }
            }
        }
        return doSegment(pageLines);
    }

    @Override
    public Optional<SectionType> matchHeader(String line) {
        if (StrUtil.isBlank(line)) {
            return Optional.empty();
        }
        String stripped = line.strip();
        if (!isHeaderShaped(stripped)) {
            return Optional.empty();
        }
        for (Map.Entry<SectionType, Pattern> entry : SectionHeaderPatterns.PATTERNS.entrySet()) {
            if (entry.getValue().matcher(stripped).matches()) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private List<PaperVO.Section> doSegment(List<PageLine> lines) {
        List<PaperVO.Section> sections = new ArrayList<>();
        SectionBuffer current = new SectionBuffer(SectionType.OTHER, null, null);

        for (PageLine line : lines) {
            if (line.text == null || line.text.isBlank()) {
                continue;
            }
            String stripped = line.text.strip();
            Optional<SectionType> header = matchHeader(stripped);
            if (header.isPresent()) {
                flush(current, sections);
                current = new SectionBuffer(header.get(), stripped, line.page);
                log.debug("识别到章节标题: type={}, line={}", header.get(), stripped);
            } else {
                // 正文行原样保留, 仅标题行去掉首尾空白
                current.append(line.text, line.page);
            }
        }
        flush(current, sections);

        if (sections.isEmpty()) {
            // 空输入仍然产出一个 OTHER 章节
            sections.add(PaperVO.Section.builder()
                    .sectionType(SectionType.OTHER)
                    .content("")
                    .build());
        }
        log.debug("章节切分完成: lines={}, sections={}", lines.size(), sections.size());
        return sections;
    }

    /**
     * 前导 OTHER 章节只有在收集到正文时才输出; 有标题的章节即使正文为空也输出, 由调用方决定是否丢弃
     */
    private void flush(SectionBuffer buffer, List<PaperVO.Section> sections) {
        if (buffer.title == null && buffer.lines.isEmpty()) {
            return;
        }
        sections.add(PaperVO.Section.builder()
                .sectionType(buffer.type)
                .title(buffer.title)
                .content(String.join("\n", buffer.lines))
                .pageStart(buffer.pageStart)
                .pageEnd(buffer.pageEnd)
                .build());
    }

    private boolean isHeaderShaped(String line) {
        return line.length() < maxHeaderLength && line.split("\\s+").length < maxHeaderWords;
    }

    private static final class PageLine {
        private final String text;
        private final Integer page;

        private PageLine(String text, Integer page) {
            this.text = text;
            this.page = page;
        }
    }

    private static final class SectionBuffer {
        private final SectionType type;
        private final String title;
        private final List<String> lines = new ArrayList<>();
        private Integer pageStart;
        private Integer pageEnd;

        private SectionBuffer(SectionType type, String title, Integer page) {
            this.type = type;
            this.title = title;
            this.pageStart = page;
            this.pageEnd = page;
        }

        private void append(String line, Integer page) {
            lines.add(line);
            if (page != null) {
                if (pageStart == null) {
                    pageStart = page;
                }
                pageEnd = page;
            }
        }
    }
}
