package com.hrkey.rvl.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/** OPENAI_API_KEY 등 비밀값은 저장소 밖 env.properties 로 주입 */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
