package com.hrkey.rvl.dto;

import java.util.Map;

public record RvlInfo(
        String version,
        Map<String, Boolean> enabledFeatures,
        Map<String, Object> thresholds,
        EmbeddingServiceStatus embedding
) {}
