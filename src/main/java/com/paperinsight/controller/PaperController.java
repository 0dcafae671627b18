package com.paperinsight.controller;

import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperAnalysisResultVO;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.service.AcademicAnalysisService;
import com.paperinsight.service.DocumentParserService;
import com.paperinsight.service.PaperStructuringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * 论文解析与分析控制器
 *
 * @author PaperInsight
 * @since 2026-09-18
 */
@Slf4j
@Tag(name = "论文分析", description = "论文结构化解析与学术分析")
@RestController
@RequestMapping("/api/papers")
@RequiredArgsConstructor
public class PaperController {

    private final DocumentParserService documentParserService;
    private final PaperStructuringService paperStructuringService;
    private final AcademicAnalysisService academicAnalysisService;

    /**
     * 上传文档并解析为结构化论文
     */
    @Operation(summary = "解析论文", description = "抽取文本并切分章节, 返回结构化论文")
    @PostMapping(value = "/ingest", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public PaperVO ingest(@Parameter(description = "论文文件(PDF 等)") @RequestParam("file") MultipartFile file) {
        return paperStructuringService.structure(documentParserService.parseDocument(file));
    }

    /**
     * 上传文档, 解析并分析
     */
    @Operation(summary = "解析并分析论文", description = "依次尝试远程模型、本地 NLP 与模板分析")
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public PaperAnalysisResultVO analyze(@Parameter(description = "论文文件(PDF 等)") @RequestParam("file") MultipartFile file) {
        return analyzeExtracted(documentParserService.parseDocument(file));
    }

    /**
     * 分析已抽取的文本
     */
    @Operation(summary = "分析已抽取文本", description = "输入按页切分的文本与可选元数据")
    @PostMapping(value = "/analyze/text", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PaperAnalysisResultVO analyzeText(@RequestBody ExtractedTextDTO extractedText) {
        return analyzeExtracted(extractedText);
    }

    private PaperAnalysisResultVO analyzeExtracted(ExtractedTextDTO extractedText) {
        PaperVO paper = paperStructuringService.structure(extractedText);
        log.info("论文结构化完成: title={}, sections={}", paper.getTitle(), paper.getSections().size());
        AcademicAnalysisVO analysis = academicAnalysisService.analyze(paper);
        return PaperAnalysisResultVO.builder()
                .paper(paper)
                .analysis(analysis)
                .build();
    }
}
