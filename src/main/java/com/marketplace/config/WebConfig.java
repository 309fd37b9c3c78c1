package com.marketplace.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the marketplace frontend. The caller identifies itself with {@code X-User-Id}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${marketplace.cors.allowed-origin:*}")
    private String[] allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/realtime/**")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods("GET", "POST", "DELETE")
                .allowedHeaders("Content-Type", "X-User-Id")
                .allowCredentials(true);
        registry.addMapping("/api/debug/**")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods("GET", "POST", "PUT")
                .allowedHeaders("Content-Type");
    }
}
