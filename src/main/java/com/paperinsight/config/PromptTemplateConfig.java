package com.paperinsight.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提示词模板配置类
 * 集中管理远程模型分析用到的提示词
 *
 * @author PaperInsight
 * @since 2026-09-15
 */
@Configuration
public class PromptTemplateConfig {

    /**
     * 系统提示词
     */
    @Bean("analysisSystemPrompt")
    public String analysisSystemPrompt() {
        return "You are an expert academic researcher analyzing scientific papers. "
                + "Provide detailed, accurate analysis in JSON format.";
    }

    /**
     * 论文分析提示词模板, {paper_content} 替换为序列化后的论文
     */
    @Bean("paperAnalysisPromptTemplate")
    public String paperAnalysisPromptTemplate() {
        return """
            Analyze the following scientific paper and provide a comprehensive academic analysis.

            PAPER CONTENT:
            {paper_content}

            Provide your analysis in JSON format with the following structure:
            {
                "technical_summary": "A 2-3 paragraph formal academic summary of the problem and approach",
                "research_problem": {
                    "problem_statement": "Clear statement of what problem is being solved",
                    "domain_relevance": "Why this problem is important in its domain",
                    "constraints": ["List of constraints or assumptions"]
                },
                "methodology": {
                    "input_data": "Description of input data or datasets used",
                    "techniques": ["List of algorithms, methods, or techniques used"],
                    "pipeline": "Description of the processing pipeline",
                    "evaluation": "How the approach is evaluated"
                },
                "main_contributions": [
                    "Contribution 1: Specific, verifiable contribution",
                    "Contribution 2: Another concrete contribution"
                ],
                "limitations": ["Limitation 1: Stated or implied limitation"],
                "key_concepts": {
                    "Concept 1": "Definition or explanation"
                },
                "thematic_tags": ["Tag1", "Tag2", "Tag3"],
                "sota_positioning": "How this work positions itself within the state of the art",
                "citation_summary": "A concise paragraph suitable for citing in a literature review",
                "analysis_confidence": "high/medium/low",
                "missing_information": ["List of information not found in the paper"]
            }

            Focus on:
            1. Extracting concrete, verifiable contributions (between 2 and 5)
            2. Identifying actual methodologies and techniques used
            3. Finding real limitations stated in the paper
            4. Extracting key technical concepts with their definitions
            5. Being precise and factual - don't invent information

            Respond ONLY with the JSON object, no additional text.
            """;
    }
}
