package com.paperinsight.utils;

import com.paperinsight.exception.PaperAnalysisException;
import com.paperinsight.model.enums.AnalysisConfidence;
import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.AcademicAnalysisVO;
import com.paperinsight.model.vo.PaperVO;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LLMJsonUtilsTest {

    @Test
    void cleanCodeFence_shouldStripFenceWrappingWholeReply() {
        assertThat(LLMJsonUtils.cleanCodeFence("```json\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(LLMJsonUtils.cleanCodeFence("```\n{\"a\": 1}```")).isEqualTo("{\"a\": 1}");
        assertThat(LLMJsonUtils.cleanCodeFence("  {\"a\": 1}  ")).isEqualTo("{\"a\": 1}");
        assertThat(LLMJsonUtils.cleanCodeFence(null)).isEmpty();
    }

    @Test
    void cleanCodeFence_shouldKeepTextAroundFence() {
        String reply = "Sure!\n```json\n{\"a\": 1}\n```";

        assertThat(LLMJsonUtils.cleanCodeFence(reply)).isEqualTo(reply);
    }

    @Test
    void parseStrictObject_shouldReadSnakeCaseFields() {
        AcademicAnalysisVO analysis = LLMJsonUtils.parseStrictObject(
                "{\"technical_summary\": \"S\", \"analysis_confidence\": \"low\", \"thematic_tags\": [\"A\"]}",
                AcademicAnalysisVO.class);

        assertThat(analysis.getTechnicalSummary()).isEqualTo("S");
        assertThat(analysis.getAnalysisConfidence()).isEqualTo(AnalysisConfidence.LOW);
        assertThat(analysis.getThematicTags()).containsExactly("A");
        assertThat(analysis.getLimitations()).isEmpty();
    }

    @Test
    void parseStrictObject_shouldRejectNonObjectReplies() {
        assertThatThrownBy(() -> LLMJsonUtils.parseStrictObject("", AcademicAnalysisVO.class))
                .isInstanceOf(PaperAnalysisException.class);
        assertThatThrownBy(() -> LLMJsonUtils.parseStrictObject("[1, 2]", AcademicAnalysisVO.class))
                .isInstanceOf(PaperAnalysisException.class);
        assertThatThrownBy(() -> LLMJsonUtils.parseStrictObject("The answer is {\"technical_summary\": \"S\"}", AcademicAnalysisVO.class))
                .isInstanceOf(PaperAnalysisException.class);
    }

    @Test
    void parseStrictObject_shouldReportMissingNestedAndNullFields() {
        String reply = "{\"technical_summary\": null, \"research_problem\": {\"problem_statement\": \"P\"}}";

        assertThatThrownBy(() -> LLMJsonUtils.parseStrictObject(reply, AcademicAnalysisVO.class,
                List.of("technical_summary", "research_problem.problem_statement", "research_problem.constraints",
                        "methodology.techniques")))
                .isInstanceOf(PaperAnalysisException.class)
                .hasMessage("缺少必填字段: [technical_summary, research_problem.constraints, methodology.techniques]");
    }

    @Test
    void parseStrictObject_shouldBindWhenRequiredFieldsPresent() {
        AcademicAnalysisVO analysis = LLMJsonUtils.parseStrictObject(
                "{\"research_problem\": {\"problem_statement\": \"P\", \"constraints\": []}}",
                AcademicAnalysisVO.class, List.of("research_problem.constraints"));

        assertThat(analysis.getResearchProblem().getProblemStatement()).isEqualTo("P");
        assertThat(analysis.getResearchProblem().getConstraints()).isEmpty();
    }

    @Test
    void parseStrictObject_shouldRejectUnknownEnumValue() {
        assertThatThrownBy(() -> LLMJsonUtils.parseStrictObject("{\"analysis_confidence\": \"very high\"}", AcademicAnalysisVO.class))
                .isInstanceOf(PaperAnalysisException.class);
    }

    @Test
    void toJson_shouldWriteSnakeCaseAndLowercaseEnums() {
        // Arrange
        PaperVO paper = PaperVO.builder()
                .title("T")
                .abstractText("A")
                .publicationDate(LocalDate.of(2024, 1, 15))
                .sections(List.of(PaperVO.Section.builder().sectionType(SectionType.ABSTRACT).content("A").build()))
                .build();

        // Act
        String json = LLMJsonUtils.toJson(paper);

        // Assert
        assertThat(json).contains("\"abstract_text\" : \"A\"")
                .contains("\"section_type\" : \"abstract\"")
                .contains("\"publication_date\" : \"2024-01-15\"");
    }
}
