package com.hrkey.rvl.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HRKey Reference Validation Layer")
                        .description("추천서 검증 파이프라인 운영자용 API (info / preview)")
                        .version("v" + ValidationThresholds.VERSION)
                        .contact(new Contact().name("HRKey").email("dev@hrkey.xyz")));
    }
}
