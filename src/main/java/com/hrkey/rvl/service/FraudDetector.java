package com.hrkey.rvl.service;

import com.hrkey.rvl.config.ValidationThresholds;
import com.hrkey.rvl.dto.FraudAssessment;
import com.hrkey.rvl.dto.FraudComponent;
import com.hrkey.rvl.dto.FraudInput;
import com.hrkey.rvl.util.TextUtils;
import com.hrkey.rvl.verify.ReferrerTrustPolicy;
import com.hrkey.rvl.verify.ReferrerTrustPolicy.ReferrerAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 추천서 위조/저신뢰 위험도 (0~100, 높을수록 위험).
 * 신호 4개(본문 품질, 평점 패턴, 일관성, 추천인 평판)를 각 0~100 으로 매긴 뒤
 * 공유 임계값 테이블의 가중치로 합산한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudDetector {

    private static final int SHORT_TEXT = 50;
    private static final int LONG_TEXT = 5000;
    private static final int BOILERPLATE_LIMIT = 5;
    private static final double REPETITION_LIMIT = 0.3;
    private static final double AVERAGE_HIGH = 4.5;

    private static final List<String> BOILERPLATE = List.of(
            "team player", "hard worker", "goes above and beyond", "pleasure to work with",
            "highly recommend", "without hesitation", "asset to any team", "great attitude",
            "self-starter", "detail-oriented", "results-driven", "go-getter");

    private static final Pattern EXAGGERATION = Pattern.compile(
            "\\b(perfect|flawless|best|greatest|always|never|world-class|incredible|unbelievable|amazing)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PUNCTUATION = Pattern.compile("[.!?,;:]");

    private final ValidationThresholds thresholds;
    private final ReferrerTrustPolicy referrerTrustPolicy;

    public int score(FraudInput input) {
        return analyze(input).overallScore();
    }

    public FraudAssessment analyze(FraudInput input) {
        Map<String, FraudComponent> components = new LinkedHashMap<>();
        components.put(FraudAssessment.TEXT_QUALITY, textQuality(input.text()));
        components.put(FraudAssessment.RATING_PATTERNS, ratingPatterns(input.kpiRatings()));
        components.put(FraudAssessment.CONSISTENCY, consistency(input.consistencyScore()));
        components.put(FraudAssessment.REFERRER, referrer(input.referrerEmail()));

        double total = components.values().stream().mapToDouble(FraudComponent::weighted).sum();
        int overall = (int) Math.round(TextUtils.clamp(total, 0, 100));

        log.debug("Fraud analysis: overall={}, text={}, ratings={}, consistency={}, referrer={}",
                overall,
                components.get(FraudAssessment.TEXT_QUALITY).score(),
                components.get(FraudAssessment.RATING_PATTERNS).score(),
                components.get(FraudAssessment.CONSISTENCY).score(),
                components.get(FraudAssessment.REFERRER).score());

        return new FraudAssessment(overall, Collections.unmodifiableMap(components), thresholds.riskLevel(overall));
    }

    // ------------------------ 신호별 점수 ------------------------

    FraudComponent textQuality(String text) {
        double weight = thresholds.textQualityWeight();
        if (text == null || text.strip().length() < thresholds.minTextLength()) {
            return new FraudComponent(100, weight, List.of("Text missing or too short"));
        }

        double score = 0;
        List<String> reasons = new ArrayList<>();

        if (text.length() < SHORT_TEXT) {
            score += 60;
            reasons.add("Text very short");
        } else if (text.length() > LONG_TEXT) {
            score += 20;
            reasons.add("Text suspiciously long");
        }

        String lower = text.toLowerCase(Locale.ROOT);
        long boilerplate = BOILERPLATE.stream().filter(lower::contains).count();
        if (boilerplate > BOILERPLATE_LIMIT) {
            score += 30;
            reasons.add("Too many boilerplate phrases (" + boilerplate + ")");
        }

        List<String> longWords = TextUtils.words(text).stream().filter(w -> w.length() > 3).toList();
        if (!longWords.isEmpty()) {
            double repetition = 1.0 - (double) new HashSet<>(longWords).size() / longWords.size();
            if (repetition > REPETITION_LIMIT) {
                score += 25;
                reasons.add("Excessive word repetition");
            }
        }

        long upper = text.chars().filter(c -> c >= 'A' && c <= 'Z').count();
        if (upper > text.length() * 0.5) {
            score += 20;
            reasons.add("Excessive capitalization");
        }

        if (count(PUNCTUATION, text) < text.length() / 100.0 * 0.5) {
            score += 15;
            reasons.add("Insufficient punctuation");
        }

        int exaggerations = count(EXAGGERATION, text);
        if (exaggerations >= 2) {
            score += 15;
            reasons.add("Exaggerated language (" + exaggerations + " terms)");
        }

        return new FraudComponent(Math.min(100, score), weight, reasons);
    }

    FraudComponent ratingPatterns(Map<String, Double> kpiRatings) {
        double weight = thresholds.ratingPatternWeight();
        List<Double> ratings = kpiRatings == null ? List.of() : kpiRatings.values().stream()
                .filter(Objects::nonNull)
                .filter(r -> Double.isFinite(r))
                .toList();
        if (ratings.isEmpty()) {
            return new FraudComponent(50, weight, List.of("No KPI ratings"));
        }

        double score = 0;
        List<String> reasons = new ArrayList<>();
        DoubleSummaryStatistics stats = ratings.stream().mapToDouble(Double::doubleValue).summaryStatistics();

        if (stats.getAverage() > AVERAGE_HIGH) {
            score += 35;
            reasons.add("Average rating suspiciously high");
        }
        if (ratings.size() >= 2 && new HashSet<>(ratings).size() == 1) {
            score += 40;
            reasons.add("All ratings identical");
        }
        if (ratings.size() > 3 && stats.getMax() - stats.getMin() < 0.5) {
            score += 25;
            reasons.add("No variance across ratings");
        }
        if (ratings.size() >= 3 && stats.getMin() >= thresholds.ratingMax()) {
            score += 25;
            reasons.add("All ratings at scale maximum");
        }
        if (ratings.size() == 1) {
            score += 15;
            reasons.add("Only one KPI rated");
        }

        // 소수부가 같은 평점이 대부분 (예: 전부 x.73)
        Map<Long, Integer> fractions = new HashMap<>();
        for (double r : ratings) {
            long fraction = Math.round((r - Math.floor(r)) * 100) % 100;
            if (fraction != 0) fractions.merge(fraction, 1, Integer::sum);
        }
        int maxSameFraction = fractions.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        if (maxSameFraction >= 3 && maxSameFraction > ratings.size() * 0.8) {
            score += 20;
            reasons.add("Unrealistic rating precision");
        }

        return new FraudComponent(Math.min(100, score), weight, reasons);
    }

    FraudComponent consistency(double consistencyScore) {
        double c = TextUtils.clamp(consistencyScore, 0, 1);
        List<String> reasons = c < 1.0
                ? List.of(String.format(Locale.ROOT, "Consistency score %.2f", c))
                : List.of();
        return new FraudComponent(TextUtils.round((1 - c) * 100, 2), thresholds.consistencyWeight(), reasons);
    }

    FraudComponent referrer(String email) {
        ReferrerAssessment a = referrerTrustPolicy.assess(email);
        return new FraudComponent(a.score(), thresholds.referrerWeight(), a.reasons());
    }

    private static int count(Pattern p, String text) {
        int n = 0;
        Matcher m = p.matcher(text);
        while (m.find()) n++;
        return n;
    }
}
