package com.paperinsight.service.nlp;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * NLP 后端初始化结果: 可用时持有解析器, 不可用时记录原因
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class NlpBackend {

    private final LinguisticParser parser;

    private final String unavailableReason;

    public static NlpBackend available(LinguisticParser parser) {
        return new NlpBackend(parser, null);
    }

    public static NlpBackend unavailable(String reason) {
        return new NlpBackend(null, reason);
    }

    public boolean isAvailable() {
        return parser != null;
    }

    public Optional<LinguisticParser> parser() {
        return Optional.ofNullable(parser);
    }
}
