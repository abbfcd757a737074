package com.hrkey.rvl.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hrkey.rvl.config.ValidationThresholds;
import com.hrkey.rvl.dto.EmbeddingServiceStatus;
import com.hrkey.rvl.embedding.EmbeddingProvider;
import com.hrkey.rvl.exception.ReferenceValidationException;
import com.hrkey.rvl.exception.ValidationErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class EmbeddingService {

    /** provider 최대 입력 토큰 (ada-002 기준) */
    public static final int MAX_TOKENS = 8191;
    /** 토큰당 대략 4문자로 잘라서 보낸다 */
    public static final int MAX_INPUT_CHARS = MAX_TOKENS * 4;

    private final EmbeddingProvider provider;
    private final Executor embeddingExecutor;
    private final ValidationThresholds thresholds;

    // 같은 본문 재검증 시 provider 재호출 방지
    private final Cache<String, double[]> vectorCache;

    public EmbeddingService(EmbeddingProvider provider,
                            @Qualifier("embeddingExecutor") Executor embeddingExecutor,
                            ValidationThresholds thresholds,
                            @Value("${rvl.embedding.cache-size:1000}") long cacheSize) {
        this.provider = provider;
        this.embeddingExecutor = embeddingExecutor;
        this.thresholds = thresholds;
        this.vectorCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofHours(1))
                .maximumSize(cacheSize)
                .build();
    }

    public double[] embed(String text) {
        if (text == null || text.strip().length() < thresholds.minTextLength()) {
            throw new ReferenceValidationException(ValidationErrorCode.TEXT_TOO_SHORT,
                    "Text too short for embedding (minimum " + thresholds.minTextLength() + " characters)");
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;

        double[] cached = vectorCache.getIfPresent(input);
        if (cached != null) return cached.clone();

        long start = System.currentTimeMillis();
        double[] vector = provider.embed(input);
        log.debug("Embedding generated: provider={}, dims={}, {}ms",
                provider.name(), vector.length, System.currentTimeMillis() - start);

        vectorCache.put(input, vector.clone());
        return vector;
    }

    /**
     * 전용 풀에서 embed 실행. 실패는 future 의 예외로 전달된다.
     * 풀이 가득 차 거절되면 PROVIDER_UNAVAILABLE 로 끝난 future 를 돌려준다.
     * 실행 전에 future 가 이미 끝났으면(호출자 타임아웃) provider 를 호출하지 않는다.
     */
    public CompletableFuture<double[]> embedAsync(String text) {
        CompletableFuture<double[]> future = new CompletableFuture<>();
        try {
            embeddingExecutor.execute(() -> {
                if (future.isDone()) {
                    log.debug("Skipping stale embedding task: caller already gave up");
                    return;
                }
                try {
                    future.complete(embed(text));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Embedding executor saturated, request rejected");
            future.completeExceptionally(new ReferenceValidationException(ValidationErrorCode.PROVIDER_UNAVAILABLE,
                    "Embedding executor is saturated", e));
        }
        return future;
    }

    /** provider 벡터가 의미 유사도를 반영하는지 (hash 는 아님) */
    public boolean semanticVectors() {
        return provider.semantic();
    }

    public double cosineSimilarity(double[] a, double[] b) {
        if (a == null || b == null || a.length != b.length) {
            throw new ReferenceValidationException(ValidationErrorCode.INVALID_VECTORS,
                    "Invalid embedding vectors: both must be non-null and of equal length ("
                            + (a == null ? "null" : a.length) + " vs " + (b == null ? "null" : b.length) + ")");
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    public EmbeddingServiceStatus status() {
        return new EmbeddingServiceStatus(provider.name(), provider.model(), provider.dimensions(),
                provider.apiKeyConfigured(), provider.ready(), provider.semantic());
    }
}
