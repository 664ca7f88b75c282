package com.williamcallahan.lawlens.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS rules so viewer front ends served from another origin can call the API.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private static final String WILDCARD_ORIGIN = "*";

    private final AppProperties.Cors cors;

    public WebMvcConfig(AppProperties appProperties) {
        this.cors = appProperties.getCors();
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = cors.getAllowedOrigins();
        var mapping = registry.addMapping("/api/**");
        if (origins.contains(WILDCARD_ORIGIN)) {
            mapping.allowedOriginPatterns(WILDCARD_ORIGIN);
        } else {
            mapping.allowedOrigins(origins.toArray(String[]::new));
        }
        mapping.allowedMethods(cors.getAllowedMethods().toArray(String[]::new))
                .allowedHeaders(cors.getAllowedHeaders().toArray(String[]::new))
                .allowCredentials(cors.isAllowCredentials())
                .maxAge(cors.getMaxAgeSeconds());
    }
}
