package com.paperinsight.service.analysis;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.config.PaperInsightProperties;
import com.paperinsight.exception.AnalysisTierException;
import com.paperinsight.exception.PaperAnalysisException;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.utils.LLMJsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 第一层级: 远程大模型分析
 *
 * <p>论文序列化为提示词后提交到独立线程池, 等待结果时带超时; 超时即取消任务并判定失败, 不重试。
 * 回复必须是单个符合字段定义的 JSON 对象, 标题与 DOI 始终以论文本身为准。</p>
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
public class RemoteModelAnalysisTier implements AnalysisTier {

    public static final String NAME = "remote-model";

    /**
     * 提示词模板中论文内容的占位符
     */
    public static final String CONTENT_PLACEHOLDER = "{paper_content}";

    /**
     * 回复中必须出现的字段; paper_title 与 paper_doi 以论文为准, 不要求模型给出
     */
    static final List<String> REQUIRED_REPLY_FIELDS = List.of(
            "technical_summary",
            "research_problem.problem_statement",
            "research_problem.domain_relevance",
            "research_problem.constraints",
            "methodology.input_data",
            "methodology.techniques",
            "methodology.pipeline",
            "methodology.evaluation",
            "main_contributions",
            "limitations",
            "key_concepts",
            "thematic_tags",
            "sota_positioning",
            "citation_summary",
            "analysis_confidence",
            "missing_information");

    private final AnalysisCompletionClient completionClient;
    private final ExecutorService executor;
    private final String systemPrompt;
    private final String promptTemplate;
    private final Duration timeout;
    private final int sectionCharLimit;
    private final int promptCharLimit;

    public RemoteModelAnalysisTier(AnalysisCompletionClient completionClient,
                                   ExecutorService executor,
                                   PaperInsightProperties.RemoteConfig config,
                                   String systemPrompt,
                                   String promptTemplate) {
        this.completionClient = completionClient;
        this.executor = executor;
        this.systemPrompt = systemPrompt;
        this.promptTemplate = promptTemplate;
        this.timeout = config.getTimeout();
        this.sectionCharLimit = config.getSectionCharLimit();
        this.promptCharLimit = config.getPromptCharLimit();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public AcademicAnalysisVO analyze(PaperVO paper) {
        String userPrompt = promptTemplate.replace(CONTENT_PLACEHOLDER, preparePaperContent(paper));
        String reply = callWithTimeout(userPrompt);

        AcademicAnalysisVO parsed;
        try {
            parsed = LLMJsonUtils.parseStrictObject(reply, AcademicAnalysisVO.class, REQUIRED_REPLY_FIELDS);
        } catch (PaperAnalysisException e) {
            throw new AnalysisTierException(NAME, "模型回复无法解析: " + e.getMessage(), e);
        }

        List<String> missing = parsed.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new AnalysisTierException(NAME, "模型回复缺少必填字段: " + missing);
        }
        return normalize(parsed, paper);
    }

    /**
     * 序列化论文: 标题、摘要与除参考文献外的各章节, 单章节与整体分别截断
     */
    String preparePaperContent(PaperVO paper) {
        List<String> parts = new ArrayList<>();
        parts.add("TITLE: " + StrUtil.nullToEmpty(paper.getTitle()));
        if (StrUtil.isNotBlank(paper.getAbstractText())) {
            parts.add("\nABSTRACT:\n" + paper.getAbstractText());
        }
        for (PaperVO.Section section : paper.getSections()) {
            if (section.getSectionType() == SectionType.REFERENCES) {
                continue;
            }
            String title = StrUtil.isNotBlank(section.getTitle())
                    ? section.getTitle()
                    : section.getSectionType().getValue().toUpperCase(Locale.ROOT);
            parts.add("\n" + title + ":\n" + StrUtil.sub(StrUtil.nullToEmpty(section.getContent()), 0, sectionCharLimit));
        }
        String content = String.join("\n", parts);
        return content.length() > promptCharLimit ? content.substring(0, promptCharLimit) : content;
    }

    private String callWithTimeout(String userPrompt) {
        Future<String> future;
        try {
            future = executor.submit(() -> completionClient.complete(systemPrompt, userPrompt));
        } catch (RejectedExecutionException e) {
            throw new AnalysisTierException(NAME, "远程调用线程池拒绝任务", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AnalysisTierException(NAME, "远程调用超时: " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisTierException(NAME, "远程调用被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AnalysisTierException(NAME, "远程调用失败: " + cause.getMessage(), cause);
        }
    }

    private AcademicAnalysisVO normalize(AcademicAnalysisVO parsed, PaperVO paper) {
        return parsed.toBuilder()
                .paperTitle(paper.getTitle())
                .paperDoi(paper.getDoi())
                .mainContributions(AcademicAnalysisVO.boundContributions(parsed.getMainContributions()))
                .build();
    }
}
