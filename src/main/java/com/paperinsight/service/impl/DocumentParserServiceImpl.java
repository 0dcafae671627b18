package com.paperinsight.service.impl;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.exception.PaperAnalysisException;
import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.service.DocumentParserService;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 文档解析服务实现
 * 使用 Apache Tika 自动检测格式, PDF 按页输出文本
 *
 * @author PaperInsight
 * @since 2026-09-18
 */
@Slf4j
@Service
public class DocumentParserServiceImpl implements DocumentParserService {

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public ExtractedTextDTO parseDocument(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PaperAnalysisException("文件不能为空");
        }
        String filename = file.getOriginalFilename();
        try (InputStream inputStream = file.getInputStream()) {
            return parse(inputStream, filename);
        } catch (IOException e) {
            log.error("读取上传文件失败: {}", filename, e);
            throw new PaperAnalysisException("文档读取失败: " + e.getMessage(), e);
        }
    }

    @Override
    public ExtractedTextDTO parseDocument(byte[] fileData, String fileName) {
        if (fileData == null || fileData.length == 0) {
            throw new PaperAnalysisException("文件不能为空");
        }
        log.info("开始从字节数组解析文档, 大小={} bytes", fileData.length);
        return parse(new ByteArrayInputStream(fileData), fileName);
    }

    private ExtractedTextDTO parse(InputStream inputStream, String filename) {
        log.info("开始解析文档: {}", filename);
        PageTextContentHandler pageHandler = new PageTextContentHandler();
        Metadata metadata = new Metadata();
        if (filename != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        }
        try {
            parser.parse(inputStream, new BodyContentHandler(pageHandler), metadata, new ParseContext());
        } catch (IOException | SAXException | TikaException e) {
            log.error("文档解析失败: {}", filename, e);
            throw new PaperAnalysisException("文档解析失败: " + e.getMessage(), e);
        }

        List<String> pages = new ArrayList<>();
        int characters = 0;
        for (String page : pageHandler.getPages()) {
            String cleaned = cleanText(page);
            pages.add(cleaned);
            characters += cleaned.length();
        }
        if (characters == 0) {
            throw new PaperAnalysisException("文档中没有可提取的文本: " + StrUtil.nullToDefault(filename, "<bytes>"));
        }

        String[] creators = metadata.getValues(TikaCoreProperties.CREATOR);
        ExtractedTextDTO extracted = ExtractedTextDTO.builder()
                .pages(pages)
                .titleHint(StrUtil.trimToNull(metadata.get(TikaCoreProperties.TITLE)))
                .authorHint(creators.length == 0 ? null : String.join("; ", creators))
                .sourceFile(filename)
                .build();
        log.info("文档解析完成: {}, 页数={}, 字符数={}", filename, pages.size(), characters);
        return extracted;
    }

    /**
     * 清理文本
     * - 移除控制字符(保留换行)
     * - 标准化换行
     * - 行内多余空白合并, 行首行尾空白去除
     */
    private String cleanText(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replace("\r\n", "\n")
                .replace('\r', '\n')
                // 移除特殊控制字符（保留换行符和制表符）
                .replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "")
                // 行内连续空白合并为单个空格
                .replaceAll("[ \\t\\u00A0]{2,}|\\t", " ")
                // 移除行首行尾空白
                .replaceAll("(?m)^[ \\t]+|[ \\t]+$", "")
                // 多余空行最多保留一个
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }
}
