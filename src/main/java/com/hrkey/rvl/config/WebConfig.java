package com.hrkey.rvl.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig {

    @Bean
    public WebMvcConfigurer corsConfigurer(@Value("${rvl.cors.allowed-origins:*}") String[] allowedOrigins) {
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/v1/rvl/**")
                        .allowedOrigins(allowedOrigins)  // 운영 환경에서는 관리 콘솔 도메인으로 제한
                        .allowedMethods("GET", "POST", "OPTIONS");
            }
        };
    }
}
