package com.paperinsight.service.analysis;

import com.paperinsight.config.PaperInsightProperties;
import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.model.enums.AnalysisConfidence;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;
import com.paperinsight.service.impl.DiscourseSegmentationServiceImpl;
import com.paperinsight.service.impl.KeyPhraseServiceImpl;
import com.paperinsight.service.impl.PaperStructuringServiceImpl;
import com.paperinsight.service.impl.ScientificEntityServiceImpl;
import com.paperinsight.service.impl.SectionSegmentationServiceImpl;
import com.paperinsight.service.nlp.LuceneLinguisticParser;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NlpAnalysisTierTest {

    private static NlpAnalysisTier tier;

    @BeforeAll
    static void setUp() {
        LuceneLinguisticParser parser = new LuceneLinguisticParser();
        tier = new NlpAnalysisTier(
                new DiscourseSegmentationServiceImpl(parser),
                new ScientificEntityServiceImpl(parser),
                new KeyPhraseServiceImpl(parser),
                20);
    }

    @Nested
    class FullPaper {

        private final AcademicAnalysisVO analysis = tier.analyze(TestPapers.fullPaper());

        @Test
        void analyze_shouldTakeProblemStatementFromObjectiveSentence() {
            assertThat(analysis.getResearchProblem().getProblemStatement())
                    .isEqualTo("Our goal is robust speech recognition on portable devices.");
            assertThat(analysis.getResearchProblem().getDomainRelevance())
                    .isEqualTo("Speech interfaces are increasingly important for accessibility.");
            assertThat(analysis.getResearchProblem().getConstraints())
                    .containsExactly("The approach requires clean audio.");
        }

        @Test
        void analyze_shouldMapEntitiesToMethodology() {
            AcademicAnalysisVO.Methodology methodology = analysis.getMethodology();

            assertThat(methodology.getTechniques()).containsExactly("system", "model", "approach");
            assertThat(methodology.getInputData()).isEqualTo("corpus, TIMIT, test set");
            assertThat(methodology.getEvaluation()).isEqualTo("accuracy, 92%");
            assertThat(methodology.getPipeline()).isEqualTo(TestPapers.METHODOLOGY);
        }

        @Test
        void analyze_shouldCollectClaimsAndLimitations() {
            assertThat(analysis.getMainContributions()).hasSize(2);
            assertThat(analysis.getMainContributions().get(0))
                    .isEqualTo("In conclusion, we present an offline recognizer for assistive devices.");
            assertThat(analysis.getLimitations())
                    .containsExactly("We found that noise remains a limitation.");
        }

        @Test
        void analyze_shouldFillKeyConceptsFromEntities() {
            assertThat(analysis.getKeyConcepts()).hasSizeLessThanOrEqualTo(10);
            assertThat(analysis.getKeyConcepts())
                    .containsEntry("TIMIT", "We use a hidden Markov model trained on the TIMIT corpus.");
            assertThat(analysis.getKeyConcepts()).containsKey("accuracy");
        }

        @Test
        void analyze_shouldUsePaperMetadataAndSharedRules() {
            assertThat(analysis.getPaperTitle()).isEqualTo("Offline Speech Recognition for Portable Devices");
            assertThat(analysis.getThematicTags())
                    .containsExactly("Speech Processing", "Pattern Recognition", "Embedded Systems");
            assertThat(analysis.getSotaPositioning()).isEqualTo(TestPapers.INTRODUCTION);
            assertThat(analysis.getMissingInformation()).containsExactly("DOI", "Authors", "Publication date");
            assertThat(analysis.getAnalysisConfidence()).isEqualTo(AnalysisConfidence.MEDIUM);
            assertThat(analysis.missingRequiredFields()).isEmpty();
        }
    }

    @Nested
    @DisplayName("章节范围")
    class AnalyzedSections {

        @Test
        void analyze_shouldIgnoreResultsSectionContent() {
            AcademicAnalysisVO analysis = tier.analyze(TestPapers.fullPaper());

            assertThat(analysis.getKeyConcepts().keySet())
                    .noneMatch(key -> key.contains("Speaker Group") || key.contains("Baseline Recognizer"));
            assertThat(analysis.getMethodology().getEvaluation()).doesNotContain("error rate");
        }

        @Test
        void analyze_shouldKeepAuthorPreambleOutOfKeyConcepts() {
            // Arrange
            String text = "Offline Speech Recognition\n"
                    + "John Smith, Mary Jones\n"
                    + "University Of Nowhere\n"
                    + "Abstract\n"
                    + "Our goal is robust speech recognition on portable devices.\n"
                    + "Methods\n"
                    + "We use a hidden Markov model trained on the TIMIT corpus.\n"
                    + "Results\n"
                    + "Hidden Markov Models reach 92% accuracy.\n"
                    + "Conclusion\n"
                    + "In conclusion, we present an offline recognizer for assistive devices.";
            PaperStructuringServiceImpl structurer =
                    new PaperStructuringServiceImpl(new SectionSegmentationServiceImpl(new PaperInsightProperties()));
            PaperVO paper = structurer.structure(ExtractedTextDTO.ofText(text));

            // Act
            AcademicAnalysisVO analysis = tier.analyze(paper);

            // Assert
            assertThat(analysis.getKeyConcepts()).containsKey("TIMIT");
            assertThat(analysis.getKeyConcepts().keySet())
                    .noneMatch(key -> key.contains("Smith") || key.contains("Jones") || key.contains("Nowhere"));
            assertThat(analysis.getKeyConcepts().values())
                    .noneMatch(context -> context.contains("John Smith"));
        }
    }

    @Test
    void analyze_shouldDegradeToPlaceholdersWithoutText() {
        AcademicAnalysisVO analysis = tier.analyze(TestPapers.emptyPaper());

        assertThat(analysis.getAnalysisConfidence()).isEqualTo(AnalysisConfidence.LOW);
        assertThat(analysis.getResearchProblem().getProblemStatement())
                .isEqualTo("Problem statement not explicitly identified in abstract.");
        assertThat(analysis.getMethodology().getTechniques()).containsExactly(TemplateAnalysisTier.NOT_SPECIFIED);
        assertThat(analysis.getMainContributions()).hasSize(2);
        assertThat(analysis.getKeyConcepts()).isEmpty();
        assertThat(analysis.getMissingInformation()).contains("Abstract", "Methodology section", "Results section");
        assertThat(analysis.missingRequiredFields()).isEmpty();
    }
}
