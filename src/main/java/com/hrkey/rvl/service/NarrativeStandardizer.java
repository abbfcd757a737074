package com.hrkey.rvl.service;

import com.hrkey.rvl.config.ValidationThresholds;
import com.hrkey.rvl.dto.QualityReport;
import com.hrkey.rvl.dto.QualityReport.QualityIssue;
import com.hrkey.rvl.util.TextUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 추천서 본문 정규화 + 최소 품질 검사 + 역량 키워드 추출.
 * standardize 는 멱등이어야 한다: standardize(standardize(x)) == standardize(x)
 */
@Service
@RequiredArgsConstructor
public class NarrativeStandardizer {

    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200D\\uFEFF]");
    private static final Pattern HORIZONTAL_WS = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern WS_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern SMART_DOUBLE = Pattern.compile("[\\u201C\\u201D\\u201E\\u201F]");
    private static final Pattern SMART_SINGLE = Pattern.compile("[\\u2018\\u2019\\u201A\\u201B]");
    private static final Pattern DASHES = Pattern.compile("[\\u2013\\u2014]");
    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile(" +([,.!?;:])");
    private static final Pattern REPEATED_PUNCT = Pattern.compile("([!?.,;:])\\1{3,}");

    // 자음 7개 이상 연속 (y 는 모음 역할이 많아 제외: rhythms 등)
    private static final Pattern GIBBERISH = Pattern.compile("[bcdfghjklmnpqrstvwxz]{7,}", Pattern.CASE_INSENSITIVE);
    private static final double REPETITION_RATIO = 0.3;
    private static final int REPETITION_MIN_COUNT = 3;

    // 역량 키워드 사전
    private static final List<Pattern> KEY_PHRASES = List.of(
            Pattern.compile("\\b(excellent|great|strong|outstanding|exceptional|solid|good)\\s+(\\w+)\\s+(skills?|abilities|ability|performance|attitude)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(team player|leader|communicator|problem solver|collaborator|mentor|self-starter|fast learner)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(highly\\s+)?(recommend|skilled|talented|capable|reliable|dedicated|motivated|dependable)\\b",
                    Pattern.CASE_INSENSITIVE)
    );

    private final ValidationThresholds thresholds;

    public String standardize(String text) {
        if (text == null || text.isEmpty()) return "";

        String t = ZERO_WIDTH.matcher(text).replaceAll("");
        t = t.replace("\r\n", "\n").replace('\r', '\n');
        t = HORIZONTAL_WS.matcher(t).replaceAll(" ");
        t = WS_AROUND_NEWLINE.matcher(t).replaceAll("\n");
        t = EXCESS_NEWLINES.matcher(t).replaceAll("\n\n");
        t = SMART_DOUBLE.matcher(t).replaceAll("\"");
        t = SMART_SINGLE.matcher(t).replaceAll("'");
        t = DASHES.matcher(t).replaceAll("-");
        t = SPACE_BEFORE_PUNCT.matcher(t).replaceAll("$1");
        t = REPEATED_PUNCT.matcher(t).replaceAll("$1$1$1");
        t = t.strip();

        if (t.isEmpty()) return t;
        return Character.toUpperCase(t.charAt(0)) + t.substring(1);
    }

    public QualityReport validateQuality(String text) {
        if (text == null || text.isBlank()) {
            return QualityReport.of(List.of(QualityIssue.EMPTY));
        }
        String t = text.strip();
        List<QualityIssue> issues = new ArrayList<>();

        if (t.length() < thresholds.minTextLength()) issues.add(QualityIssue.TOO_SHORT);
        if (t.length() > thresholds.maxTextLength()) issues.add(QualityIssue.TOO_LONG);
        if (TextUtils.wordCount(t) < thresholds.minWordCount()) issues.add(QualityIssue.TOO_FEW_WORDS);

        List<String> words = TextUtils.words(t);
        int maxFreq = TextUtils.frequencies(words, 3).values().stream()
                .mapToInt(Integer::intValue).max().orElse(0);
        if (maxFreq >= REPETITION_MIN_COUNT && maxFreq > words.size() * REPETITION_RATIO) {
            issues.add(QualityIssue.EXCESSIVE_REPETITION);
        }

        if (GIBBERISH.matcher(t).find()) issues.add(QualityIssue.GIBBERISH);

        return QualityReport.of(issues);
    }

    public List<String> extractKeyPhrases(String text) {
        if (text == null || text.strip().length() < thresholds.minTextLength()) return List.of();

        LinkedHashSet<String> phrases = new LinkedHashSet<>();
        for (Pattern p : KEY_PHRASES) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String phrase = m.group().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").strip();
                if (phrase.length() > 3) phrases.add(phrase);
            }
        }
        return new ArrayList<>(phrases);
    }
}
