package com.hrkey.rvl.service;

import com.hrkey.rvl.config.ValidationThresholds;
import com.hrkey.rvl.dto.ConsistencyResult;
import com.hrkey.rvl.dto.Contradiction;
import com.hrkey.rvl.dto.KpiComparison;
import com.hrkey.rvl.dto.PriorReference;
import com.hrkey.rvl.dto.ValidationFlag;
import com.hrkey.rvl.dto.ValidationFlag.FlagType;
import com.hrkey.rvl.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 같은 후보자의 이전 추천서들과 비교한 일관성 점수 + 본문 내부 모순 탐지.
 * 모순/의미 분기 신호는 플래그만 추가하고 점수에는 반영하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsistencyChecker {

    // 절(clause) 경계: 문장부호 또는 역접 접속사
    private static final Pattern CLAUSE_BREAK =
            Pattern.compile("[.;!?,]|\\b(but|however|although|though|yet|whereas)\\b", Pattern.CASE_INSENSITIVE);
    // "never late" 처럼 부정어가 붙은 부정 표현은 긍정으로 본다
    private static final Pattern NEGATOR_BEFORE =
            Pattern.compile("\\b(never|not|rarely|seldom|hardly ever)\\s+$", Pattern.CASE_INSENSITIVE);

    /** 속성별 긍정/부정 표현 사전 */
    private record Attribute(String name, Pattern positive, Pattern negative) {}

    private static final List<Attribute> LEXICON = List.of(
            attribute("punctuality",
                    "punctual|on time|timely",
                    "late|tardy|missed deadlines|not punctual|not on time|unpunctual"),
            attribute("reliability",
                    "reliable|dependable|consistent",
                    "unreliable|undependable|inconsistent|not reliable|not dependable"),
            attribute("communication",
                    "clear communicator|communicated clearly|communicates well|excellent communication|strong communication",
                    "poor communication|communicated poorly|hard to reach|unresponsive|weak communication"),
            attribute("teamwork",
                    "team player|collaborative|worked well with others",
                    "not a team player|difficult to work with|uncooperative|worked poorly with others"),
            attribute("work quality",
                    "high-quality|high quality|thorough|meticulous|attention to detail",
                    "sloppy|careless|error-prone|low-quality|low quality"),
            attribute("initiative",
                    "proactive|self-starter|took initiative",
                    "passive|needed constant supervision|lacked initiative|lack of initiative")
    );

    private final ValidationThresholds thresholds;
    private final EmbeddingService embeddingService;

    /**
     * KPI 평점을 이전 추천서들의 KPI별 평균과 비교한다.
     * REJECTED_* 상태의 이전 추천서는 기준에서 제외한다.
     *
     * @param kpiRatings 이번 추천서 평점 (범위 검증 완료)
     * @param priors     같은 후보자의 이전 추천서들
     */
    public ConsistencyResult check(Map<String, Double> kpiRatings, List<PriorReference> priors) {
        List<PriorReference> usable = usablePriors(priors);
        if (usable.isEmpty() || kpiRatings == null || kpiRatings.isEmpty()) {
            return ConsistencyResult.noHistory();
        }

        List<ValidationFlag> flags = new ArrayList<>();
        List<KpiComparison> comparisons = new ArrayList<>();
        double span = thresholds.ratingSpan();
        double tolerance = thresholds.deviationTolerance();
        int deviationFlags = 0;

        for (Map.Entry<String, Double> e : kpiRatings.entrySet()) {
            String kpi = e.getKey();
            double current = e.getValue();

            double sum = 0;
            int n = 0;
            for (PriorReference p : usable) {
                Double r = p.kpiRatings().get(kpi);
                if (r == null || !Double.isFinite(r)) continue;
                sum += r;
                n++;
            }
            if (n == 0) continue; // 이 KPI 는 비교 대상 없음

            double mean = sum / n;
            double deviation = Math.abs(current - mean);
            double factor = span > tolerance
                    ? 1.0 - Math.max(0.0, deviation - tolerance) / (span - tolerance)
                    : (deviation > 0 ? 0.0 : 1.0);
            factor = TextUtils.clamp(factor, 0.0, 1.0);

            comparisons.add(new KpiComparison(kpi, current, TextUtils.round(mean, 2),
                    TextUtils.round(deviation, 2), n, TextUtils.round(factor, 4)));

            if (deviation >= thresholds.kpiDeviationThreshold()) {
                deviationFlags++;
                flags.add(ValidationFlag.warning(FlagType.KPI_DEVIATION,
                        String.format(Locale.ROOT,
                                "Rating for '%s' (%.1f) deviates from historical average (%.2f) by %.2f",
                                kpi, current, mean, deviation),
                        kpi));
            }
        }

        if (comparisons.isEmpty()) {
            return ConsistencyResult.noHistory();
        }

        double meanFactor = comparisons.stream().mapToDouble(KpiComparison::score).average().orElse(1.0);
        double score = TextUtils.clamp(meanFactor - thresholds.deviationFlagPenalty() * deviationFlags, 0.0, 1.0);
        score = TextUtils.round(score, 4);

        if (score < thresholds.lowConsistencyScore()) {
            flags.add(ValidationFlag.warning(FlagType.LOW_CONSISTENCY,
                    String.format(Locale.ROOT, "Low consistency with previous references (%.2f)", score)));
        }

        log.debug("Consistency checked: priors={}, comparedKpis={}, score={}, flags={}",
                usable.size(), comparisons.size(), score, flags.size());
        return new ConsistencyResult(score, flags, comparisons);
    }

    /**
     * 본문 내부 모순 탐지 (휴리스틱).
     * 같은 속성의 긍정/부정 표현이 서로 다른 절에서 window 이내에 함께 나오면 1건.
     */
    public List<Contradiction> detectContradictions(String text) {
        if (text == null || text.strip().length() < thresholds.minTextLength()) return List.of();

        List<Contradiction> out = new ArrayList<>();
        for (Attribute attr : LEXICON) {
            List<int[]> negatives = matches(attr.negative(), text, true);
            List<int[]> positives = matches(attr.positive(), text, false);
            positives.removeIf(p -> negatives.stream().anyMatch(n -> overlaps(p, n)));

            Contradiction found = firstConflict(attr, text, positives, negatives);
            if (found != null) out.add(found);
        }
        return out;
    }

    public List<ValidationFlag> contradictionFlags(String text) {
        return detectContradictions(text).stream()
                .map(c -> ValidationFlag.warning(FlagType.POTENTIAL_CONTRADICTION,
                        c.reason() + ": \"" + c.span() + "\""))
                .toList();
    }

    /**
     * 이전 추천서 임베딩과의 평균 코사인 유사도가 하한 미만이면 SEMANTIC_DIVERGENCE.
     * 차원이 다른 벡터는 비교에서 제외한다.
     */
    public List<ValidationFlag> semanticFlags(double[] current, List<PriorReference> priors) {
        if (current == null) return List.of();

        double sum = 0;
        int n = 0;
        for (PriorReference p : usablePriors(priors)) {
            if (!p.hasEmbedding() || p.embeddingVector().size() != current.length) continue;
            double[] prior = p.embeddingVector().stream().mapToDouble(Double::doubleValue).toArray();
            sum += embeddingService.cosineSimilarity(current, prior);
            n++;
        }
        if (n == 0) return List.of();

        double mean = sum / n;
        if (mean >= thresholds.semanticSimilarityMin()) return List.of();
        return List.of(ValidationFlag.warning(FlagType.SEMANTIC_DIVERGENCE,
                String.format(Locale.ROOT,
                        "Narrative differs semantically from previous references (similarity %.2f)", mean)));
    }

    // ------------------------ 내부 유틸 ------------------------

    private static Attribute attribute(String name, String positive, String negative) {
        return new Attribute(name,
                Pattern.compile("\\b(" + positive + ")\\b", Pattern.CASE_INSENSITIVE),
                Pattern.compile("\\b(" + negative + ")\\b", Pattern.CASE_INSENSITIVE));
    }

    private static List<PriorReference> usablePriors(List<PriorReference> priors) {
        if (priors == null) return List.of();
        return priors.stream()
                .filter(Objects::nonNull)
                .filter(p -> p.status() == null || !p.status().isRejected())
                .toList();
    }

    private static List<int[]> matches(Pattern p, String text, boolean skipNegated) {
        List<int[]> out = new ArrayList<>();
        Matcher m = p.matcher(text);
        while (m.find()) {
            if (skipNegated && NEGATOR_BEFORE.matcher(text.substring(Math.max(0, m.start() - 16), m.start())).find()) {
                continue;
            }
            out.add(new int[]{m.start(), m.end()});
        }
        return out;
    }

    private static boolean overlaps(int[] a, int[] b) {
        return a[0] < b[1] && b[0] < a[1];
    }

    private Contradiction firstConflict(Attribute attr, String text, List<int[]> positives, List<int[]> negatives) {
        for (int[] pos : positives) {
            for (int[] neg : negatives) {
                int from = Math.min(pos[0], neg[0]);
                int to = Math.max(pos[1], neg[1]);
                if (Math.abs(pos[0] - neg[0]) > thresholds.contradictionWindow()) continue;

                String between = text.substring(Math.min(pos[1], neg[1]), Math.max(pos[0], neg[0]));
                if (!CLAUSE_BREAK.matcher(between).find()) continue; // 같은 절

                String reason = "Conflicting statements about " + attr.name() + " ('"
                        + text.substring(pos[0], pos[1]).toLowerCase(Locale.ROOT) + "' vs '"
                        + text.substring(neg[0], neg[1]).toLowerCase(Locale.ROOT) + "')";
                return new Contradiction(text.substring(from, to).strip(), reason);
            }
        }
        return null;
    }
}
