package com.paperinsight.service.analysis;

import com.paperinsight.model.enums.SectionType;
import com.paperinsight.model.vo.PaperVO;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 分析层级测试用的论文样例
 */
final class TestPapers {

    static final String ABSTRACT = "Our goal is robust speech recognition on portable devices. The system runs offline.";
    static final String INTRODUCTION = "Speech interfaces are increasingly important for accessibility. "
            + "Prior systems require a network connection.";
    static final String METHODOLOGY = "We use a hidden Markov model trained on the TIMIT corpus. "
            + "The approach requires clean audio. We apply noise filtering before decoding.";
    static final String RESULTS = "Table 2 lists the Word Error Rate for each Speaker Group. "
            + "The Baseline Recognizer performs worse.";
    static final String CONCLUSION = "In conclusion, we present an offline recognizer for assistive devices. "
            + "It reaches 92% accuracy on the test set. We found that noise remains a limitation. "
            + "Future work will explore more languages.";

    private TestPapers() {
    }

    static PaperVO.Section section(SectionType type, String content) {
        return PaperVO.Section.builder()
                .sectionType(type)
                .title(type.getValue())
                .content(content)
                .build();
    }

    static PaperVO fullPaper() {
        List<PaperVO.Section> sections = new ArrayList<>();
        sections.add(section(SectionType.ABSTRACT, ABSTRACT));
        sections.add(section(SectionType.INTRODUCTION, INTRODUCTION));
        sections.add(section(SectionType.METHODOLOGY, METHODOLOGY));
        sections.add(section(SectionType.RESULTS, RESULTS));
        sections.add(section(SectionType.CONCLUSION, CONCLUSION));
        sections.add(section(SectionType.REFERENCES, "[1] Some Reference. A neural network paper."));
        return PaperVO.builder()
                .title("Offline Speech Recognition for Portable Devices")
                .abstractText(ABSTRACT)
                .sections(sections)
                .ingestionTimestamp(Instant.now())
                .build();
    }

    static PaperVO emptyPaper() {
        return PaperVO.builder()
                .title("Untitled Document")
                .sections(List.of(PaperVO.Section.builder().sectionType(SectionType.OTHER).content("").build()))
                .build();
    }
}
