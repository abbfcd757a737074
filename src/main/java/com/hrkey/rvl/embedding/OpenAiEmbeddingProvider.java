package com.hrkey.rvl.embedding;

import com.hrkey.rvl.exception.ReferenceValidationException;
import com.hrkey.rvl.exception.ValidationErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@ConditionalOnProperty(name = "rvl.embedding.provider", havingValue = "openai")
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    public static final String NAME = "openai";

    private final RestClient rest;
    private final String apiKey;
    private final String model;
    private final int dimensions;
    private final String baseUrl;

    @Autowired
    public OpenAiEmbeddingProvider(RestClient.Builder builder,
                                   @Value("${rvl.embedding.openai.api-key:}") String apiKey,
                                   @Value("${rvl.embedding.openai.model:text-embedding-ada-002}") String model,
                                   @Value("${rvl.embedding.dimensions:1536}") int dimensions,
                                   @Value("${rvl.embedding.openai.base-url:https://api.openai.com}") String baseUrl,
                                   @Value("${rvl.embedding.timeout-ms:10000}") int timeoutMs) {
        this(builder.requestFactory(timeoutFactory(timeoutMs)), apiKey, model, dimensions, baseUrl);
    }

    // 요청 팩토리는 builder 에 이미 설정된 것을 그대로 쓴다
    OpenAiEmbeddingProvider(RestClient.Builder builder, String apiKey, String model, int dimensions, String baseUrl) {
        this.rest = builder.build();
        this.apiKey = apiKey;
        this.model = model;
        this.dimensions = dimensions;
        this.baseUrl = baseUrl;
    }

    @Override
    @SuppressWarnings("unchecked")
    public double[] embed(String text) {
        if (!apiKeyConfigured()) {
            throw new ReferenceValidationException(ValidationErrorCode.PROVIDER_UNAVAILABLE,
                    "OpenAI API key is not configured");
        }

        Map<String, Object> body = Map.of(
                "model", model,
                "input", text
        );

        Map<?, ?> res;
        try {
            res = rest.post()
                    .uri(baseUrl + "/v1/embeddings")
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve().body(Map.class);
        } catch (RestClientException e) {
            throw new ReferenceValidationException(ValidationErrorCode.PROVIDER_UNAVAILABLE,
                    "Embedding request failed: " + e.getMessage(), e);
        }

        // { "data": [ { "embedding": [ ... ] } ], "usage": {...} }
        var data = res == null ? null : (List<Map<String, Object>>) res.get("data");
        if (data == null || data.isEmpty() || !(data.get(0).get("embedding") instanceof List<?> raw)) {
            throw new ReferenceValidationException(ValidationErrorCode.PROVIDER_UNAVAILABLE,
                    "Embedding response has no vector");
        }

        double[] v = new double[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            v[i] = ((Number) raw.get(i)).doubleValue();
        }
        if (res.get("usage") instanceof Map<?, ?> usage) {
            log.debug("OpenAI embedding generated: dims={}, tokens={}", v.length, usage.get("total_tokens"));
        }
        return v;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public boolean apiKeyConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean ready() {
        return apiKeyConfigured();
    }

    @Override
    public boolean semantic() {
        return true;
    }

    // 응답이 늦어도 작업 스레드가 timeout 이상 묶이지 않게 한다
    static SimpleClientHttpRequestFactory timeoutFactory(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.max(1, timeoutMs));
        factory.setReadTimeout(Math.max(1, timeoutMs));
        return factory;
    }
}
