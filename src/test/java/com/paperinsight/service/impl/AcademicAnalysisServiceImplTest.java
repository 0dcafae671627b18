package com.paperinsight.service.impl;

import com.paperinsight.exception.AnalysisTierException;
import com.paperinsight.model.enums.AnalysisConfidence;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.service.analysis.AnalysisTier;
import com.paperinsight.service.analysis.TemplateAnalysisTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AcademicAnalysisServiceImplTest {

    @Mock private AnalysisTier remoteTier;
    @Mock private AnalysisTier nlpTier;

    private PaperVO paper;

    @BeforeEach
    void setUp() {
        lenient().when(remoteTier.getName()).thenReturn("remote-model");
        lenient().when(nlpTier.getName()).thenReturn("local-nlp");
        paper = PaperVO.builder().title("A Paper").abstractText("We study X. It works.").build();
    }

    private static AcademicAnalysisVO analysis(String summary, AnalysisConfidence confidence) {
        return AcademicAnalysisVO.builder()
                .technicalSummary(summary)
                .analysisConfidence(confidence)
                .build();
    }

    @Test
    void analyze_shouldReturnFirstSuccessfulTier() {
        AcademicAnalysisVO expected = analysis("remote", AnalysisConfidence.HIGH);
        when(remoteTier.analyze(paper)).thenReturn(expected);
        AcademicAnalysisServiceImpl service = new AcademicAnalysisServiceImpl(List.of(remoteTier, nlpTier), new TemplateAnalysisTier());

        assertThat(service.analyze(paper)).isSameAs(expected);
        verify(nlpTier, never()).analyze(any());
    }

    @Test
    void analyze_shouldFallThroughToNextTierOnFailure() {
        // Arrange
        AcademicAnalysisVO expected = analysis("nlp", AnalysisConfidence.MEDIUM);
        when(remoteTier.analyze(paper)).thenThrow(new AnalysisTierException("remote-model", "invalid credential"));
        when(nlpTier.analyze(paper)).thenReturn(expected);
        AcademicAnalysisServiceImpl service = new AcademicAnalysisServiceImpl(List.of(remoteTier, nlpTier), new TemplateAnalysisTier());

        // Act
        AcademicAnalysisVO result = service.analyze(paper);

        // Assert
        assertThat(result).isSameAs(expected);
        InOrder order = inOrder(remoteTier, nlpTier);
        order.verify(remoteTier).analyze(paper);
        order.verify(nlpTier).analyze(paper);
    }

    @Test
    void analyze_shouldUseTemplateWhenEveryTierFails() {
        when(remoteTier.analyze(paper)).thenThrow(new AnalysisTierException("remote-model", "timeout"));
        when(nlpTier.analyze(paper)).thenThrow(new IllegalStateException("unexpected"));
        AcademicAnalysisServiceImpl service = new AcademicAnalysisServiceImpl(List.of(remoteTier, nlpTier), new TemplateAnalysisTier());

        AcademicAnalysisVO result = service.analyze(paper);

        assertThat(result.getAnalysisConfidence()).isEqualTo(AnalysisConfidence.LOW);
        assertThat(result.getResearchProblem().getProblemStatement()).isEqualTo("We study X.");
        assertThat(result.getMainContributions()).hasSizeBetween(2, 5);
    }

    @Test
    void analyze_shouldReturnLowConfidenceWithOnlyTemplateTier() {
        AcademicAnalysisServiceImpl service = new AcademicAnalysisServiceImpl(List.of(), new TemplateAnalysisTier());

        assertThat(service.analyze(paper).getAnalysisConfidence()).isEqualTo(AnalysisConfidence.LOW);
        assertThat(service.tierNames()).containsExactly("template");
    }

    @Test
    void tierNames_shouldListConfiguredTiersThenTemplate() {
        AcademicAnalysisServiceImpl service = new AcademicAnalysisServiceImpl(List.of(remoteTier, nlpTier), new TemplateAnalysisTier());

        assertThat(service.tierNames()).containsExactly("remote-model", "local-nlp", "template");
    }
}
