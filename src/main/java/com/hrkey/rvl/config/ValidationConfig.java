package com.hrkey.rvl.config;

import com.hrkey.rvl.util.MdcTaskDecorator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ValidationConfig {

    // application.yml:
    // rvl:
    //   text:    { min-length: 20, min-words: 5, max-length: 10000 }
    //   ratings: { min: 1, max: 5 }
    //   ...
    @Bean
    public ValidationThresholds validationThresholds(
            @Value("${rvl.text.min-length:20}") int minTextLength,
            @Value("${rvl.text.min-words:5}") int minWordCount,
            @Value("${rvl.text.max-length:10000}") int maxTextLength,
            @Value("${rvl.ratings.min:1.0}") double ratingMin,
            @Value("${rvl.ratings.max:5.0}") double ratingMax,
            @Value("${rvl.consistency.kpi-deviation:2.0}") double kpiDeviation,
            @Value("${rvl.consistency.deviation-tolerance:0.5}") double deviationTolerance,
            @Value("${rvl.consistency.deviation-penalty:0.15}") double deviationPenalty,
            @Value("${rvl.consistency.low-score:0.6}") double lowConsistency,
            @Value("${rvl.consistency.semantic-min:0.6}") double semanticMin,
            @Value("${rvl.consistency.contradiction-window:160}") int contradictionWindow,
            @Value("${rvl.fraud.weights.text-quality:0.30}") double textQualityWeight,
            @Value("${rvl.fraud.weights.rating-patterns:0.30}") double ratingPatternWeight,
            @Value("${rvl.fraud.weights.consistency:0.20}") double consistencyWeight,
            @Value("${rvl.fraud.weights.referrer:0.20}") double referrerWeight,
            @Value("${rvl.status.reject-fraud:70}") int rejectFraud,
            @Value("${rvl.status.warn-fraud:30}") int warnFraud,
            @Value("${rvl.status.reject-consistency:0.4}") double rejectConsistency,
            @Value("${rvl.fraud.risk.medium-from:20}") int mediumRiskFrom,
            @Value("${rvl.fraud.risk.high-from:40}") int highRiskFrom) {
        return ValidationThresholds.builder()
                .minTextLength(minTextLength)
                .minWordCount(minWordCount)
                .maxTextLength(maxTextLength)
                .ratingMin(ratingMin)
                .ratingMax(ratingMax)
                .kpiDeviationThreshold(kpiDeviation)
                .deviationTolerance(deviationTolerance)
                .deviationFlagPenalty(deviationPenalty)
                .lowConsistencyScore(lowConsistency)
                .semanticSimilarityMin(semanticMin)
                .contradictionWindow(contradictionWindow)
                .textQualityWeight(textQualityWeight)
                .ratingPatternWeight(ratingPatternWeight)
                .consistencyWeight(consistencyWeight)
                .referrerWeight(referrerWeight)
                .rejectFraudScore(rejectFraud)
                .warnFraudScore(warnFraud)
                .rejectConsistencyScore(rejectConsistency)
                .mediumRiskFrom(mediumRiskFrom)
                .highRiskFrom(highRiskFrom)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 임베딩 호출 전용 풀 (요청 스레드와 분리).
     * 큐가 차면 TaskRejectedException 으로 즉시 거절하고, 호출 측은 UNAVAILABLE 로 처리한다.
     */
    @Bean
    public ThreadPoolTaskExecutor embeddingExecutor(@Value("${rvl.embedding.pool-size:4}") int poolSize,
                                                    @Value("${rvl.embedding.queue-capacity:16}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, poolSize));
        executor.setMaxPoolSize(Math.max(1, poolSize));
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setThreadNamePrefix("rvl-embedding-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
