package com.paperinsight.config;

import com.paperinsight.model.enums.RhetoricalFunction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 修辞功能指示词表(小写, 子串匹配)
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
public final class RhetoricalIndicators {

    public static final Map<RhetoricalFunction, List<String>> INDICATORS;

    static {
        Map<RhetoricalFunction, List<String>> indicators = new LinkedHashMap<>();
        indicators.put(RhetoricalFunction.BACKGROUND, List.of(
                "previous", "prior", "existing", "traditional", "conventional",
                "literature", "research has shown", "studies have", "well-known"));
        indicators.put(RhetoricalFunction.OBJECTIVE, List.of(
                "we propose", "we present", "we introduce", "our goal", "our aim",
                "this paper", "this work", "we develop", "objective", "purpose"));
        indicators.put(RhetoricalFunction.METHOD, List.of(
                "we use", "we apply", "we implement", "algorithm", "approach",
                "methodology", "technique", "procedure", "process", "framework"));
        indicators.put(RhetoricalFunction.RESULT, List.of(
                "results show", "we found", "we observed", "demonstrates",
                "achieves", "performance", "accuracy", "outperforms", "improvement"));
        indicators.put(RhetoricalFunction.CONCLUSION, List.of(
                "in conclusion", "we conclude", "in summary", "overall",
                "demonstrates that", "shows that", "indicates that"));
        indicators.put(RhetoricalFunction.FUTURE_WORK, List.of(
                "future work", "future research", "future direction", "next step",
                "plan to", "will explore", "intend to"));
        indicators.put(RhetoricalFunction.LIMITATION, List.of(
                "limitation", "constraint", "challenge", "drawback", "however",
                "unfortunately", "difficult", "cannot", "unable to"));
        INDICATORS = Collections.unmodifiableMap(indicators);
    }

    private RhetoricalIndicators() {
    }
}
