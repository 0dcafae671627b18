package com.paperinsight.service.analysis;

import cn.hutool.core.util.StrUtil;
import com.paperinsight.config.AnalysisLexicon;
import com.paperinsight.model.enums.AnalysisConfidence;
import com.paperinsight.model.enums.RhetoricalFunction;
import com.paperinsight.model.enums.ScientificEntityType;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.AnnotatedSentenceVO;
import com.paperinsight.model.vo.KeyPhraseVO;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.model.vo.ScientificEntityVO;
import com.paperinsight.service.DiscourseSegmentationService;
import com.paperinsight.service.KeyPhraseService;
import com.paperinsight.service.ScientificEntityService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 第二层级: 本地 NLP 分析
 *
 * <p>只读取摘要、引言、方法与结论四类章节: 逐章节做篇章标注, 对这些章节的合并文本做实体与关键短语抽取,
 * 再按字段规则拼装分析结果。标题作者等前导内容与结果、讨论、附录章节不参与。</p>
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Slf4j
public class NlpAnalysisTier implements AnalysisTier {

    public static final String NAME = "local-nlp";

    static final int MAX_LIST_ITEMS = 5;
    static final int MAX_KEY_CONCEPTS = 10;
    static final int CONCEPTS_PER_TYPE = 2;
    static final int PIPELINE_SENTENCES = 3;
    static final int SOTA_SENTENCES = 2;

    /**
     * 参与本地分析的章节类型
     */
    static final Set<SectionType> ANALYZED_SECTIONS = Collections.unmodifiableSet(EnumSet.of(
            SectionType.ABSTRACT, SectionType.INTRODUCTION, SectionType.METHODOLOGY, SectionType.CONCLUSION));

    private final DiscourseSegmentationService discourseSegmentationService;
    private final ScientificEntityService scientificEntityService;
    private final KeyPhraseService keyPhraseService;
    private final int maxKeyPhrases;

    public NlpAnalysisTier(DiscourseSegmentationService discourseSegmentationService,
                           ScientificEntityService scientificEntityService,
                           KeyPhraseService keyPhraseService,
                           int maxKeyPhrases) {
        this.discourseSegmentationService = discourseSegmentationService;
        this.scientificEntityService = scientificEntityService;
        this.keyPhraseService = keyPhraseService;
        this.maxKeyPhrases = maxKeyPhrases;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public AcademicAnalysisVO analyze(PaperVO paper) {
        Map<SectionType, List<AnnotatedSentenceVO>> annotated = new EnumMap<>(SectionType.class);
        List<AnnotatedSentenceVO> allSentences = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (PaperVO.Section section : paper.getSections()) {
            if (!ANALYZED_SECTIONS.contains(section.getSectionType()) || StrUtil.isBlank(section.getContent())) {
                continue;
            }
            List<AnnotatedSentenceVO> sentences = discourseSegmentationService.segment(section.getContent(), section.getSectionType());
            annotated.computeIfAbsent(section.getSectionType(), type -> new ArrayList<>()).addAll(sentences);
            allSentences.addAll(sentences);
            texts.add(section.getContent());
        }
        String fullText = String.join("\n", texts);

        List<ScientificEntityVO> entities = byConfidence(scientificEntityService.extractEntities(fullText));
        List<KeyPhraseVO> keyPhrases = keyPhraseService.extract(fullText, maxKeyPhrases);
        log.debug("NLP 分析: sentences={}, entities={}, keyPhrases={}", allSentences.size(), entities.size(), keyPhrases.size());

        List<AnnotatedSentenceVO> abstractSentences = sentencesOf(annotated, SectionType.ABSTRACT);
        List<AnnotatedSentenceVO> introSentences = sentencesOf(annotated, SectionType.INTRODUCTION);
        List<AnnotatedSentenceVO> methodSentences = sentencesOf(annotated, SectionType.METHODOLOGY);

        String problemStatement = problemStatement(abstractSentences, introSentences);
        String pipeline = joinOrDefault(methodSentences.stream()
                .filter(sentence -> sentence.getFunction() == RhetoricalFunction.METHOD)
                .limit(PIPELINE_SENTENCES)
                .map(AnnotatedSentenceVO::getText)
                .collect(Collectors.toList()), " ");
        List<String> contributions = AcademicAnalysisVO.boundContributions(distinctTexts(allSentences,
                sentence -> (sentence.getFunction() == RhetoricalFunction.RESULT
                        || sentence.getFunction() == RhetoricalFunction.CONCLUSION)
                        && AnalysisSupport.containsAny(sentence.getText(), AnalysisLexicon.CLAIM_INDICATORS),
                MAX_LIST_ITEMS));

        String title = StrUtil.nullToEmpty(paper.getTitle());
        return AcademicAnalysisVO.builder()
                .paperTitle(paper.getTitle())
                .paperDoi(paper.getDoi())
                .technicalSummary(technicalSummary(title, problemStatement, pipeline, contributions))
                .researchProblem(AcademicAnalysisVO.ResearchProblem.builder()
                        .problemStatement(problemStatement)
                        .domainRelevance(firstText(allSentences,
                                sentence -> sentence.getFunction() == RhetoricalFunction.BACKGROUND
                                        && AnalysisSupport.containsAny(sentence.getText(), AnalysisLexicon.IMPORTANCE_WORDS),
                                "Domain relevance not explicitly stated in the paper."))
                        .constraints(distinctTexts(methodSentences,
                                sentence -> AnalysisSupport.containsAny(sentence.getText(), AnalysisLexicon.CONSTRAINT_KEYWORDS),
                                MAX_LIST_ITEMS))
                        .build())
                .methodology(AcademicAnalysisVO.Methodology.builder()
                        .inputData(entityTextsOr(entities, ScientificEntityType.MATERIAL, allSentences, AnalysisLexicon.DATA_KEYWORDS))
                        .techniques(techniques(entities))
                        .pipeline(pipeline)
                        .evaluation(entityTextsOr(entities, ScientificEntityType.METRIC, allSentences, AnalysisLexicon.EVALUATION_KEYWORDS))
                        .build())
                .mainContributions(contributions)
                .limitations(distinctTexts(allSentences,
                        sentence -> sentence.getFunction() == RhetoricalFunction.LIMITATION
                                || AnalysisSupport.containsAny(sentence.getText(), AnalysisLexicon.LIMITATION_KEYWORDS),
                        MAX_LIST_ITEMS))
                .keyConcepts(keyConcepts(entities, keyPhrases))
                .thematicTags(AnalysisSupport.thematicTags(title, paper.getAbstractText()))
                .sotaPositioning(joinOrDefault(introSentences.stream()
                        .filter(sentence -> sentence.getFunction() == RhetoricalFunction.BACKGROUND)
                        .limit(SOTA_SENTENCES)
                        .map(AnnotatedSentenceVO::getText)
                        .collect(Collectors.toList()), " ", "State-of-the-art positioning not explicitly stated in the introduction."))
                .citationSummary(citationSummary(title, problemStatement, contributions))
                .analysisConfidence(StrUtil.isBlank(fullText) ? AnalysisConfidence.LOW : AnalysisConfidence.MEDIUM)
                .missingInformation(AnalysisSupport.missingInformation(paper))
                .build();
    }

    /**
     * 摘要或引言中第一个 OBJECTIVE 句; 其次摘要首句
     */
    private String problemStatement(List<AnnotatedSentenceVO> abstractSentences, List<AnnotatedSentenceVO> introSentences) {
        List<AnnotatedSentenceVO> candidates = new ArrayList<>(abstractSentences);
        candidates.addAll(introSentences);
        String objective = firstText(candidates, sentence -> sentence.getFunction() == RhetoricalFunction.OBJECTIVE, null);
        if (objective != null) {
            return objective;
        }
        if (!abstractSentences.isEmpty()) {
            return abstractSentences.get(0).getText();
        }
        return "Problem statement not explicitly identified in abstract.";
    }

    private List<String> techniques(List<ScientificEntityVO> entities) {
        List<String> techniques = distinctEntityTexts(entities, ScientificEntityType.METHOD).stream()
                .limit(MAX_LIST_ITEMS)
                .collect(Collectors.toList());
        return techniques.isEmpty() ? List.of(TemplateAnalysisTier.NOT_SPECIFIED) : techniques;
    }

    /**
     * 指定类型的实体文本拼接; 没有实体时退回第一个含关键词的句子
     */
    private String entityTextsOr(List<ScientificEntityVO> entities, ScientificEntityType type,
                                 List<AnnotatedSentenceVO> sentences, List<String> keywords) {
        List<String> texts = distinctEntityTexts(entities, type);
        if (!texts.isEmpty()) {
            return String.join(", ", texts);
        }
        return firstText(sentences, sentence -> AnalysisSupport.containsAny(sentence.getText(), keywords),
                TemplateAnalysisTier.NOT_SPECIFIED);
    }

    /**
     * 每种实体类型取置信度最高的两个, 最多 10 个; 剩余名额用未出现过的关键短语补齐
     */
    private Map<String, String> keyConcepts(List<ScientificEntityVO> entities, List<KeyPhraseVO> keyPhrases) {
        Map<String, String> concepts = new LinkedHashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        for (ScientificEntityType type : ScientificEntityType.values()) {
            entities.stream()
                    .filter(entity -> entity.getEntityType() == type)
                    .filter(entity -> !seen.contains(entity.getText().toLowerCase(Locale.ROOT)))
                    .limit(CONCEPTS_PER_TYPE)
                    .forEach(entity -> {
                        if (concepts.size() < MAX_KEY_CONCEPTS) {
                            concepts.put(entity.getText(), entity.getContext());
                            seen.add(entity.getText().toLowerCase(Locale.ROOT));
                        }
                    });
        }
        for (KeyPhraseVO keyPhrase : keyPhrases) {
            if (concepts.size() >= MAX_KEY_CONCEPTS) {
                break;
            }
            if (seen.add(keyPhrase.getPhrase().toLowerCase(Locale.ROOT))) {
                concepts.put(keyPhrase.getPhrase(), String.format(Locale.ROOT,
                        "Key phrase occurring %d times in the paper.", (int) keyPhrase.getScore()));
            }
        }
        return concepts;
    }

    private String technicalSummary(String title, String problemStatement, String pipeline, List<String> contributions) {
        StringBuilder summary = new StringBuilder();
        summary.append("This paper, titled \"").append(title).append("\", addresses the following problem: ")
                .append(problemStatement);
        if (!TemplateAnalysisTier.NOT_SPECIFIED.equals(pipeline)) {
            summary.append("\n\nThe approach proceeds as follows: ").append(pipeline);
        }
        summary.append("\n\nMain contribution: ").append(contributions.get(0));
        return summary.toString();
    }

    private String citationSummary(String title, String problemStatement, List<String> contributions) {
        return "The work titled \"" + title + "\" studies the following problem: " + problemStatement
                + " Its main contribution: " + contributions.get(0);
    }

    private static List<ScientificEntityVO> byConfidence(List<ScientificEntityVO> entities) {
        List<ScientificEntityVO> sorted = new ArrayList<>(entities);
        sorted.sort(Comparator.comparingDouble(ScientificEntityVO::getConfidence).reversed());
        return sorted;
    }

    private static List<String> distinctEntityTexts(List<ScientificEntityVO> entities, ScientificEntityType type) {
        Map<String, String> distinct = new LinkedHashMap<>();
        for (ScientificEntityVO entity : entities) {
            if (entity.getEntityType() == type) {
                distinct.putIfAbsent(entity.getText().toLowerCase(Locale.ROOT), entity.getText());
            }
        }
        return new ArrayList<>(distinct.values());
    }

    private static List<AnnotatedSentenceVO> sentencesOf(Map<SectionType, List<AnnotatedSentenceVO>> annotated, SectionType type) {
        return annotated.getOrDefault(type, List.of());
    }

    private static String firstText(List<AnnotatedSentenceVO> sentences, Predicate<AnnotatedSentenceVO> filter, String fallback) {
        return sentences.stream()
                .filter(filter)
                .map(AnnotatedSentenceVO::getText)
                .findFirst()
                .orElse(fallback);
    }

    private static List<String> distinctTexts(List<AnnotatedSentenceVO> sentences, Predicate<AnnotatedSentenceVO> filter, int limit) {
        return sentences.stream()
                .filter(filter)
                .map(AnnotatedSentenceVO::getText)
                .distinct()
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static String joinOrDefault(List<String> texts, String delimiter) {
        return joinOrDefault(texts, delimiter, TemplateAnalysisTier.NOT_SPECIFIED);
    }

    private static String joinOrDefault(List<String> texts, String delimiter, String fallback) {
        return texts.isEmpty() ? fallback : String.join(delimiter, texts);
    }
}
