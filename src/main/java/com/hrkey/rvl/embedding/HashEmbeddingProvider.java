package com.hrkey.rvl.embedding;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 외부 호출 없는 결정적 의사(pseudo) 임베딩.
 * 같은 텍스트는 항상 비트 단위로 같은 벡터. 의미 유사도는 반영하지 않는다(개발/테스트용 기본값).
 */
@Component
@ConditionalOnProperty(name = "rvl.embedding.provider", havingValue = "hash", matchIfMissing = true)
public class HashEmbeddingProvider implements EmbeddingProvider {

    public static final String NAME = "hash";

    private final int dimensions;

    public HashEmbeddingProvider(@Value("${rvl.embedding.dimensions:1536}") int dimensions) {
        this.dimensions = dimensions;
    }

    @Override
    public double[] embed(String text) {
        int hash = text.hashCode();
        double[] v = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            // 차원마다 hash + i 를 시드로 [-1, 1] 값 생성 (StrictMath: 플랫폼 무관 동일 결과)
            double r = StrictMath.sin((double) hash + i) * 10000;
            v[i] = (r - Math.floor(r)) * 2 - 1;
        }
        return v;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String model() {
        return "hash-v1";
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public boolean apiKeyConfigured() {
        return false;
    }

    @Override
    public boolean ready() {
        return true;
    }

    @Override
    public boolean semantic() {
        return false;
    }
}
