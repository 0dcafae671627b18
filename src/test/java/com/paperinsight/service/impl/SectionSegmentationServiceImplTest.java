package com.paperinsight.service.impl;

import com.paperinsight.config.PaperInsightProperties;
import com.paperinsight.model.dto.ExtractedTextDTO;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.PaperVO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SectionSegmentationServiceImplTest {

    private SectionSegmentationServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new SectionSegmentationServiceImpl(new PaperInsightProperties());
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n"));
    }

    @Nested
    @DisplayName("segment(lines)")
    class SegmentLines {

        @Test
        void segment_shouldSplitAbstractIntroductionAndMethodology() {
            // Arrange
            List<String> input = lines("Abstract\nWe study X.\nIntroduction\nX is important.\nMethodology\nWe use Y.");

            // Act
            List<PaperVO.Section> sections = service.segment(input);

            // Assert
            assertThat(sections).extracting(PaperVO.Section::getSectionType)
                    .containsExactly(SectionType.ABSTRACT, SectionType.INTRODUCTION, SectionType.METHODOLOGY);
            assertThat(sections).extracting(PaperVO.Section::getContent)
                    .containsExactly("We study X.", "X is important.", "We use Y.");
            assertThat(sections).extracting(PaperVO.Section::getTitle)
                    .containsExactly("Abstract", "Introduction", "Methodology");
        }

        @Test
        void segment_shouldReturnSingleOtherSectionWhenNoHeaderMatches() {
            List<PaperVO.Section> sections = service.segment(lines("Some title\nplain text line one\nplain text line two"));

            assertThat(sections).hasSize(1);
            assertThat(sections.get(0).getSectionType()).isEqualTo(SectionType.OTHER);
            assertThat(sections.get(0).getTitle()).isNull();
            assertThat(sections.get(0).getContent()).isEqualTo("Some title\nplain text line one\nplain text line two");
        }

        @Test
        void segment_shouldReturnSingleEmptyOtherSectionForEmptyInput() {
            assertThat(service.segment(List.of())).singleElement()
                    .satisfies(section -> {
                        assertThat(section.getSectionType()).isEqualTo(SectionType.OTHER);
                        assertThat(section.getContent()).isEmpty();
                    });
            assertThat(service.segment((List<String>) null)).hasSize(1);
            assertThat(service.segment(List.of("   ", ""))).hasSize(1);
        }

        @Test
        void segment_shouldKeepLeadingOtherSectionBeforeFirstHeader() {
            List<PaperVO.Section> sections = service.segment(lines("A Study of Things\nJane Doe\nAbstract\nText."));

            assertThat(sections).extracting(PaperVO.Section::getSectionType)
                    .containsExactly(SectionType.OTHER, SectionType.ABSTRACT);
            assertThat(sections.get(0).getContent()).isEqualTo("A Study of Things\nJane Doe");
        }

        @Test
        void segment_shouldEmitEmptySectionForConsecutiveHeaders() {
            List<PaperVO.Section> sections = service.segment(lines("Introduction\nMethods\nWe measure Z."));

            assertThat(sections).hasSize(2);
            assertThat(sections.get(0).getSectionType()).isEqualTo(SectionType.INTRODUCTION);
            assertThat(sections.get(0).getContent()).isEmpty();
            assertThat(sections.get(1).getSectionType()).isEqualTo(SectionType.METHODOLOGY);
            assertThat(sections.get(1).getContent()).isEqualTo("We measure Z.");
        }

        @Test
        void segment_shouldNotTreatLongLinesAsHeaders() {
            String longLine = "Results of this very long line are not a header because it has far too many words in it";
            List<PaperVO.Section> sections = service.segment(List.of("Introduction", longLine));

            assertThat(sections).hasSize(1);
            assertThat(sections.get(0).getContent()).isEqualTo(longLine);
        }

        @Test
        void segment_shouldAssignEveryNonBlankLineToExactlyOneSection() {
            // Arrange
            List<String> input = lines("  Title line  \n\nAbstract\n first \n\n2. Related Work\nsecond\nthird\n"
                    + "III. RESULTS:\nfourth\nReferences\n[1] A ref.");

            // Act
            List<PaperVO.Section> sections = service.segment(input);

            // Assert
            List<String> reconstructed = new ArrayList<>();
            for (PaperVO.Section section : sections) {
                if (section.getTitle() != null) {
                    reconstructed.add(section.getTitle());
                }
                if (!section.getContent().isEmpty()) {
                    reconstructed.addAll(Arrays.asList(section.getContent().split("\n")));
                }
            }
            List<String> expected = input.stream()
                    .filter(line -> !line.isBlank())
                    .map(line -> service.matchHeader(line).isPresent() ? line.strip() : line)
                    .collect(Collectors.toList());
            assertThat(reconstructed).isEqualTo(expected);
        }

        @Test
        void segment_shouldKeepBodyLinesVerbatim() {
            // Arrange
            List<String> input = List.of("  Methods  ", "    x = f(y)   ", "\tindented step", "plain line ");

            // Act
            List<PaperVO.Section> sections = service.segment(input);

            // Assert
            assertThat(sections).singleElement().satisfies(section -> {
                assertThat(section.getSectionType()).isEqualTo(SectionType.METHODOLOGY);
                assertThat(section.getTitle()).isEqualTo("Methods");
                assertThat(section.getContent()).isEqualTo("    x = f(y)   \n\tindented step\nplain line ");
            });
        }
    }

    @Nested
    @DisplayName("matchHeader()")
    class MatchHeader {

        @ParameterizedTest
        @CsvSource({
                "ABSTRACT, ABSTRACT",
                "abstract, ABSTRACT",
                "Resumen, ABSTRACT",
                "Summary, ABSTRACT",
                "1. Introduction, INTRODUCTION",
                "I. INTRODUCTION, INTRODUCTION",
                "Introducción, INTRODUCTION",
                "Background, INTRODUCTION",
                "2.1 Materials and Methods, METHODOLOGY",
                "System Model, METHODOLOGY",
                "Metodología, METHODOLOGY",
                "IV. Simulation Results, RESULTS",
                "Resultados:, RESULTS",
                "Related Work, DISCUSSION",
                "Literature Review, DISCUSSION",
                "Discusión, DISCUSSION",
                "Conclusions, CONCLUSION",
                "Conclusiones., CONCLUSION",
                "References, REFERENCES",
                "Bibliografía, REFERENCES",
                "Acknowledgments, ACKNOWLEDGMENTS",
                "Appendix A, APPENDIX"
        })
        void matchHeader_shouldRecognizeHeaderVariants(String line, SectionType expected) {
            assertThat(service.matchHeader(line)).contains(expected);
        }

        @Test
        void matchHeader_shouldRejectLinesWithTextAfterHeaderWord() {
            assertThat(service.matchHeader("Introduction to the problem of parsing")).isEmpty();
            assertThat(service.matchHeader("The results are shown below")).isEmpty();
            assertThat(service.matchHeader("")).isEmpty();
        }
    }

    @Nested
    @DisplayName("segment(ExtractedTextDTO)")
    class SegmentExtractedText {

        @Test
        void segment_shouldRecordPageRangeWhenPagesAreSupplied() {
            // Arrange
            ExtractedTextDTO input = ExtractedTextDTO.builder()
                    .pages(List.of("Title\nAbstract\nFirst page text.", "More abstract.\nIntroduction\nIntro text."))
                    .build();

            // Act
            List<PaperVO.Section> sections = service.segment(input);

            // Assert
            assertThat(sections).extracting(PaperVO.Section::getSectionType)
                    .containsExactly(SectionType.OTHER, SectionType.ABSTRACT, SectionType.INTRODUCTION);
            PaperVO.Section abstractSection = sections.get(1);
            assertThat(abstractSection.getPageStart()).isEqualTo(1);
            assertThat(abstractSection.getPageEnd()).isEqualTo(2);
            assertThat(abstractSection.getContent()).isEqualTo("First page text.\nMore abstract.");
            assertThat(sections.get(2).getPageStart()).isEqualTo(2);
        }

        @Test
        void segment_shouldLeavePagesEmptyForSinglePageText() {
            List<PaperVO.Section> sections = service.segment(ExtractedTextDTO.ofText("Abstract\nText."));

            assertThat(sections.get(0).getPageStart()).isNull();
            assertThat(sections.get(0).getPageEnd()).isNull();
        }
    }
}
