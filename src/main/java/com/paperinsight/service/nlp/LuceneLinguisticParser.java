package com.paperinsight.service.nlp;

import cn.hutool.core.util.StrUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.apache.lucene.analysis.tokenattributes.TypeAttribute;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 基于 Lucene StandardTokenizer 的语言学解析实现
 *
 * <p>分句使用 JDK {@link BreakIterator}(英文 locale), 并合并缩写(e.g.、et al.、Fig. 等)造成的误切分;
 * 名词短语按"连续实词"切分: 停用词、常见动词、副词、数字和标点都会截断短语, 连字符复合词视为一个词。</p>
 *
 * <p>停用词表在构造时建立, 之后只读; 分词器与句子迭代器每次调用新建, 因此实例可跨线程共享。</p>
 *
 * @author PaperInsight
 * @since 2026-09-09
 */
@Slf4j
public class LuceneLinguisticParser implements LinguisticParser {

    private static final Locale LOCALE = Locale.ENGLISH;

    private static final String NUM_TYPE = StandardTokenizer.TOKEN_TYPES[StandardTokenizer.NUM];

    private static final Pattern NUMERIC = Pattern.compile("\\d[\\d.,]*");

    private static final Pattern ADVERB = Pattern.compile("[a-z]{3,}ly");

    private static final Pattern INITIAL = Pattern.compile("[A-Z]\\.");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "e.g.", "i.e.", "al.", "fig.", "figs.", "eq.", "eqs.", "ref.", "refs.", "sec.", "no.",
            "vol.", "pp.", "vs.", "cf.", "approx.", "dr.", "prof.", "mr.", "mrs.", "ms.", "tab.",
            "resp.", "ca.", "st.", "jr.");

    /**
     * 补充 Lucene 默认英文停用词表(偏短)中缺失的功能词
     */
    private static final List<String> EXTRA_STOP_WORDS = List.of(
            "i", "me", "my", "we", "our", "ours", "us", "you", "your", "he", "him", "his", "she", "her",
            "its", "them", "what", "which", "who", "whom", "those", "am", "were", "been", "being", "have",
            "has", "had", "having", "do", "does", "did", "doing", "because", "until", "while", "about",
            "against", "between", "through", "during", "before", "after", "above", "below", "from", "up",
            "down", "out", "off", "over", "under", "again", "further", "once", "here", "when", "where",
            "why", "how", "all", "any", "both", "each", "few", "more", "most", "other", "some", "nor",
            "only", "own", "same", "so", "than", "too", "very", "can", "just", "should", "now", "also",
            "however", "thus", "therefore", "hence", "could", "would", "may", "might", "must", "shall",
            "via", "whereas", "within", "without", "across", "among", "per", "upon", "whether", "yet",
            "many", "much", "several", "various", "new", "first", "second", "one", "two", "three");

    /**
     * 学术文本中常见的谓语动词, 只截断短语, 不算停用词
     */
    private static final Set<String> VERBS = Set.of(
            "propose", "proposes", "present", "presents", "show", "shows", "shown", "use", "uses",
            "used", "using", "achieve", "achieves", "achieved", "demonstrate", "demonstrates",
            "introduce", "introduces", "describe", "describes", "apply", "applies", "applied",
            "obtain", "obtains", "obtained", "provide", "provides", "require", "requires", "improve",
            "improves", "improved", "outperform", "outperforms", "evaluate", "evaluates", "evaluated",
            "investigate", "investigates", "found", "observed", "develop", "develops", "developed",
            "compare", "compares", "compared", "make", "makes", "allow", "allows", "enable", "enables",
            "remain", "remains", "yield", "yields", "reach", "reaches", "perform", "performs",
            "consider", "considers", "based", "study", "studies", "conclude", "indicate", "indicates",
            "suggest", "suggests", "report", "reports", "train", "trained", "test", "tested",
            "reduce", "reduces", "increase", "increases", "focus", "focuses", "address", "addresses");

    private final CharArraySet stopWords;

    public LuceneLinguisticParser() {
        CharArraySet words = new CharArraySet(EnglishAnalyzer.ENGLISH_STOP_WORDS_SET, true);
        words.addAll(EXTRA_STOP_WORDS);
        this.stopWords = CharArraySet.unmodifiableSet(words);
        // 初始化时跑一次完整流程, 类路径或分词器问题在启动阶段暴露
        List<NounPhrase> warmUp = nounPhrases("The linguistic parser handles warm-up text.");
        log.info("Lucene 语言学解析器初始化完成: stopWords={}, warmUpPhrases={}", stopWords.size(), warmUp.size());
    }

    @Override
    public List<TextSpan> sentences(String text) {
        if (StrUtil.isBlank(text)) {
            return List.of();
        }
        // 换行替换为空格, 长度不变, 偏移量与原文一致
        String flat = text.replace('\r', ' ').replace('\n', ' ').replace('\t', ' ');

        BreakIterator iterator = BreakIterator.getSentenceInstance(LOCALE);
        iterator.setText(flat);
        List<int[]> pieces = new ArrayList<>();
        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            pieces.add(new int[]{start, end});
        }

        List<TextSpan> sentences = new ArrayList<>();
        int sentenceStart = -1;
        for (int i = 0; i < pieces.size(); i++) {
            int[] piece = pieces.get(i);
            if (sentenceStart < 0) {
                sentenceStart = piece[0];
            }
            boolean hasNext = i + 1 < pieces.size();
            if (hasNext && (endsWithAbbreviation(flat.substring(sentenceStart, piece[1]))
                    || startsWithLowercase(flat, piece[1]))) {
                continue;
            }
            addTrimmed(sentences, flat, sentenceStart, piece[1]);
            sentenceStart = -1;
        }
        if (sentenceStart >= 0) {
            addTrimmed(sentences, flat, sentenceStart, flat.length());
        }
        return sentences;
    }

    @Override
    public List<NounPhrase> nounPhrases(String text) {
        List<NounPhrase> phrases = new ArrayList<>();
        for (TextSpan sentence : sentences(text)) {
            collectPhrases(sentence, phrases);
        }
        return phrases;
    }

    @Override
    public boolean isStopWord(String word) {
        return word != null && stopWords.contains(word);
    }

    private void collectPhrases(TextSpan sentence, List<NounPhrase> phrases) {
        String sentenceText = sentence.getText();
        List<Word> words = mergeCompounds(sentenceText, tokenize(sentenceText));

        List<Word> run = new ArrayList<>();
        Word previous = null;
        for (Word word : words) {
            boolean punctuationGap = previous != null
                    && StrUtil.isNotBlank(sentenceText.substring(previous.end, word.start));
            if (punctuationGap) {
                emit(sentence, run, phrases);
            }
            if (isPhraseBreaker(word)) {
                emit(sentence, run, phrases);
            } else {
                run.add(word);
            }
            previous = word;
        }
        emit(sentence, run, phrases);
    }

    private void emit(TextSpan sentence, List<Word> run, List<NounPhrase> phrases) {
        if (run.isEmpty()) {
            return;
        }
        int start = run.get(0).start;
        int end = run.get(run.size() - 1).end;
        phrases.add(new NounPhrase(
                sentence.getText().substring(start, end),
                run.size(),
                sentence.getText(),
                sentence.getStart() + start,
                sentence.getStart() + end));
        run.clear();
    }

    private boolean isPhraseBreaker(Word word) {
        if (word.parts.size() > 1) {
            return word.parts.stream().allMatch(part -> stopWords.contains(part) || NUMERIC.matcher(part).matches());
        }
        String part = word.parts.get(0);
        String lower = part.toLowerCase(LOCALE);
        return word.numeric
                || NUMERIC.matcher(part).matches()
                || part.chars().noneMatch(Character::isLetter)
                || stopWords.contains(lower)
                || VERBS.contains(lower)
                || ADVERB.matcher(lower).matches();
    }

    private List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        try (StandardTokenizer tokenizer = new StandardTokenizer()) {
            tokenizer.setReader(new StringReader(text));
            CharTermAttribute term = tokenizer.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = tokenizer.addAttribute(OffsetAttribute.class);
            TypeAttribute type = tokenizer.addAttribute(TypeAttribute.class);
            tokenizer.reset();
            while (tokenizer.incrementToken()) {
                tokens.add(new Token(term.toString(), offset.startOffset(), offset.endOffset(),
                        NUM_TYPE.equals(type.type())));
            }
            tokenizer.end();
        } catch (IOException e) {
            throw new UncheckedIOException("分词失败", e);
        }
        return tokens;
    }

    /**
     * 紧邻且以单个连字符相连的 token 合并为一个复合词, 如 state-of-the-art、ResNet-50
     */
    private List<Word> mergeCompounds(String text, List<Token> tokens) {
        List<Word> words = new ArrayList<>();
        for (Token token : tokens) {
            if (!words.isEmpty()) {
                Word last = words.get(words.size() - 1);
                if ("-".equals(text.substring(last.end, token.start))) {
                    last.parts.add(token.term);
                    last.end = token.end;
                    last.numeric = last.numeric && token.numeric;
                    continue;
                }
            }
            Word word = new Word(token.start, token.end, token.numeric);
            word.parts.add(token.term);
            words.add(word);
        }
        return words;
    }

    private boolean endsWithAbbreviation(String sentence) {
        String trimmed = sentence.trim();
        int lastSpace = trimmed.lastIndexOf(' ');
        String lastWord = lastSpace < 0 ? trimmed : trimmed.substring(lastSpace + 1);
        return ABBREVIATIONS.contains(lastWord.toLowerCase(LOCALE)) || INITIAL.matcher(lastWord).matches();
    }

    private boolean startsWithLowercase(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return Character.isLowerCase(c);
            }
        }
        return false;
    }

    private void addTrimmed(List<TextSpan> sentences, String text, int start, int end) {
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            sentences.add(new TextSpan(text.substring(start, end), start, end));
        }
    }

    private static final class Token {
        private final String term;
        private final int start;
        private final int end;
        private final boolean numeric;

        private Token(String term, int start, int end, boolean numeric) {
            this.term = term;
            this.start = start;
            this.end = end;
            this.numeric = numeric;
        }
    }

    private static final class Word {
        private final List<String> parts = new ArrayList<>();
        private final int start;
        private int end;
        private boolean numeric;

        private Word(int start, int end, boolean numeric) {
            this.start = start;
            this.end = end;
            this.numeric = numeric;
        }
    }
}
