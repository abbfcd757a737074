package com.hrkey.rvl.embedding;

public interface EmbeddingProvider {
    /**
     * 텍스트 → 임베딩 벡터.
     * 장애 시 ReferenceValidationException(PROVIDER_UNAVAILABLE) 을 던진다.
     * @return 길이 dimensions() 의 벡터
     */
    double[] embed(String text);

    /** "hash" | "openai" */
    String name();

    String model();

    int dimensions();

    boolean apiKeyConfigured();

    /** 지금 호출하면 벡터를 돌려줄 수 있는 상태인지 */
    boolean ready();

    /** 벡터 간 코사인 유사도가 본문 의미 유사도를 반영하는지. false 면 의미 분기 비교를 하지 않는다. */
    boolean semantic();
}
