package com.hrkey.rvl.service;

import com.hrkey.rvl.config.ValidationThresholds;
import com.hrkey.rvl.dto.*;
import com.hrkey.rvl.dto.ValidationFlag.FlagType;
import com.hrkey.rvl.exception.ReferenceValidationException;
import com.hrkey.rvl.exception.ValidationErrorCode;
import com.hrkey.rvl.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * RVL 파이프라인:
 * 정규화 → 품질 게이트 → (임베딩 비동기 시작) → 일관성 + 모순 → fraud → 임베딩 합류 → 의미 분기 → 출력
 */
@Slf4j
@Service
public class ReferenceValidationOrchestrator {

    static final String MDC_OWNER = "ownerId";

    private final NarrativeStandardizer standardizer;
    private final EmbeddingService embeddingService;
    private final ConsistencyChecker consistencyChecker;
    private final FraudDetector fraudDetector;
    private final StructuredOutputGenerator outputGenerator;
    private final ValidationThresholds thresholds;
    private final long embeddingTimeoutMs;

    public ReferenceValidationOrchestrator(NarrativeStandardizer standardizer,
                                           EmbeddingService embeddingService,
                                           ConsistencyChecker consistencyChecker,
                                           FraudDetector fraudDetector,
                                           StructuredOutputGenerator outputGenerator,
                                           ValidationThresholds thresholds,
                                           @Value("${rvl.embedding.timeout-ms:10000}") long embeddingTimeoutMs) {
        this.standardizer = standardizer;
        this.embeddingService = embeddingService;
        this.consistencyChecker = consistencyChecker;
        this.fraudDetector = fraudDetector;
        this.outputGenerator = outputGenerator;
        this.thresholds = thresholds;
        this.embeddingTimeoutMs = embeddingTimeoutMs;
    }

    /** 메인 엔트리 */
    public ValidatedReferenceRecord validateReference(ReferenceSubmission submission, ValidationOptions options) {
        ValidationOptions opts = options == null ? ValidationOptions.defaults() : options;
        long start = System.nanoTime();

        // 호출자가 이미 넣어둔 ownerId 는 끝나고 되돌린다
        String previousOwner = MDC.get(MDC_OWNER);
        if (submission.ownerId() != null) MDC.put(MDC_OWNER, submission.ownerId());
        try {
            log.info("Reference validation started: kpis={}, priors={}, skipEmbeddings={}, skipConsistency={}",
                    submission.kpiRatings().size(), opts.previousReferences().size(),
                    opts.skipEmbeddings(), opts.skipConsistencyCheck());

            ValidatedReferenceRecord record = runPipeline(submission, opts);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            record = record.withMetadata(record.metadata().withProcessingTime(elapsedMs));
            log.info("Reference validation finished: status={}, fraud={}, consistency={}, confidence={}, {}ms",
                    record.validationStatus(), record.fraudScore(), record.consistencyScore(),
                    record.confidence(), elapsedMs);
            return record;
        } catch (ReferenceValidationException e) {
            log.warn("Reference validation aborted: code={}, message={}", e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Reference validation failed", e);
            throw e;
        } finally {
            if (previousOwner != null) {
                MDC.put(MDC_OWNER, previousOwner);
            } else {
                MDC.remove(MDC_OWNER);
            }
        }
    }

    /** 건별 독립 실행. 한 건 실패가 나머지를 막지 않는다. */
    public List<BatchItemResult> validateBatch(List<ReferenceSubmission> submissions, ValidationOptions options) {
        List<BatchItemResult> results = new ArrayList<>();
        if (submissions == null) return results;

        for (int i = 0; i < submissions.size(); i++) {
            try {
                results.add(BatchItemResult.ok(i, validateReference(submissions.get(i), options)));
            } catch (ReferenceValidationException e) {
                results.add(BatchItemResult.failed(i, e.getCode().name(), e.getMessage()));
            } catch (RuntimeException e) {
                results.add(BatchItemResult.failed(i, "INTERNAL_ERROR", String.valueOf(e.getMessage())));
            }
        }
        long ok = results.stream().filter(BatchItemResult::success).count();
        log.info("Batch validation finished: total={}, succeeded={}, failed={}",
                results.size(), ok, results.size() - ok);
        return results;
    }

    public RvlInfo getInfo() {
        EmbeddingServiceStatus embedding = embeddingService.status();

        Map<String, Boolean> features = new LinkedHashMap<>();
        features.put("narrative_standardization", true);
        features.put("embeddings", embedding.ready());
        features.put("consistency_check", true);
        features.put("contradiction_detection", true);
        features.put("semantic_consistency", embedding.ready() && embedding.semantic());
        features.put("fraud_detection", true);
        features.put("batch_validation", true);

        return new RvlInfo(ValidationThresholds.VERSION, features, thresholds.asMap(), embedding);
    }

    // ------------------------ 파이프라인 ------------------------

    private ValidatedReferenceRecord runPipeline(ReferenceSubmission submission, ValidationOptions opts) {
        // 1) 정규화
        String text = standardizer.standardize(submission.summary());

        // 2) 품질 게이트: 길이/단어 수 미달은 호출자 오류
        QualityReport quality = standardizer.validateQuality(text);
        if (quality.isTooShort()) {
            throw new ReferenceValidationException(ValidationErrorCode.TEXT_TOO_SHORT,
                    "Narrative text too short after standardization (minimum "
                            + thresholds.minTextLength() + " characters, " + thresholds.minWordCount() + " words)");
        }
        log.debug("Quality gate: valid={}, issues={}", quality.valid(), quality.issues());

        // 3) 평점 범위 검증
        List<ValidationFlag> flags = new ArrayList<>();
        Map<String, Double> ratings = validRatings(submission.kpiRatings(), flags);

        // 4) 임베딩 비동기 시작
        CompletableFuture<double[]> embeddingFuture = null;
        if (!opts.skipEmbeddings() && quality.valid()) {
            embeddingFuture = embeddingService.embedAsync(text);
        }

        // 5) 일관성 + 모순
        List<PriorReference> priors = opts.previousReferences();
        ConsistencyResult consistency = opts.skipConsistencyCheck() || priors.isEmpty()
                ? ConsistencyResult.noHistory()
                : consistencyChecker.check(ratings, priors);
        flags.addAll(consistency.flags());
        flags.addAll(consistencyChecker.contradictionFlags(text));
        log.debug("Consistency: score={}, flags={}", consistency.consistencyScore(), consistency.flags().size());

        // 6) fraud
        FraudAssessment fraud = fraudDetector.analyze(new FraudInput(
                text, ratings, consistency.consistencyScore(), submission.referrerEmail()));
        log.debug("Fraud: score={}, risk={}, referrer={}",
                fraud.overallScore(), fraud.riskLevel(), TextUtils.maskEmail(submission.referrerEmail()));

        // 7) 임베딩 합류 (실패 시 fail-soft)
        double[] vector = null;
        EmbeddingStatus embeddingStatus = EmbeddingStatus.SKIPPED;
        if (embeddingFuture != null) {
            try {
                vector = embeddingFuture.orTimeout(embeddingTimeoutMs, TimeUnit.MILLISECONDS).join();
                embeddingStatus = EmbeddingStatus.GENERATED;
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Embedding unavailable, continuing without vector: {}", cause.toString());
                embeddingStatus = EmbeddingStatus.UNAVAILABLE;
            }
        }

        // 8) 의미 분기 (의미를 담은 벡터 + 이전 추천서 임베딩이 있을 때만)
        if (vector != null && !opts.skipConsistencyCheck() && embeddingService.semanticVectors()) {
            flags.addAll(consistencyChecker.semanticFlags(vector, priors));
        }

        // 9) 출력
        return outputGenerator.generate(OutputInput.builder()
                .standardizedText(text)
                .kpiRatings(ratings)
                .detailedFeedback(submission.detailedFeedback())
                .consistencyScore(consistency.consistencyScore())
                .fraud(fraud)
                .embeddingVector(vector)
                .embeddingStatus(embeddingStatus)
                .flags(flags)
                .kpiComparisons(consistency.comparisons())
                .qualityIssues(quality.issues())
                .keyPhrases(standardizer.extractKeyPhrases(text))
                .build());
    }

    /** 척도 밖/비정상 평점은 버리고 INVALID_RATING 경고로 남긴다. */
    private Map<String, Double> validRatings(Map<String, Double> raw, List<ValidationFlag> flags) {
        Map<String, Double> valid = new LinkedHashMap<>();
        raw.forEach((kpi, rating) -> {
            if (thresholds.isRatingInRange(rating)) {
                valid.put(kpi, rating);
            } else {
                log.warn("Dropping out-of-range rating: kpi={}, rating={}", kpi, rating);
                flags.add(ValidationFlag.warning(FlagType.INVALID_RATING,
                        String.format(Locale.ROOT, "Rating for '%s' (%s) is outside the %.0f-%.0f scale and was ignored",
                                kpi, rating, thresholds.ratingMin(), thresholds.ratingMax()),
                        kpi));
            }
        });
        return valid;
    }
}
