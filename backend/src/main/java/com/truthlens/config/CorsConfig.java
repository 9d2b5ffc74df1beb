package com.truthlens.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/**
 * CORS for the web dashboard and the browser extension. Extension origins
 * ({@code chrome-extension://...}) are matched by pattern.
 */
@Configuration
@Slf4j
public class CorsConfig {

    @Value("${app.cors.allowed-origin-patterns:http://localhost:3000,chrome-extension://*}")
    private List<String> allowedOriginPatterns;

    @Value("${app.cors.allowed-methods:GET,POST,PUT,DELETE,PATCH,OPTIONS}")
    private List<String> allowedMethods;

    @Value("${app.cors.allowed-headers:Authorization,Content-Type,Accept,Origin,Last-Event-ID}")
    private List<String> allowedHeaders;

    @Value("${app.cors.allow-credentials:true}")
    private boolean allowCredentials;

    @Value("${app.cors.max-age:3600}")
    private long maxAge;

    @Bean
    public CorsFilter corsFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        CorsConfiguration config = new CorsConfiguration();

        config.setAllowedOriginPatterns(allowedOriginPatterns);
        log.info("CORS allowed origin patterns: {}", allowedOriginPatterns);

        config.setAllowedMethods(allowedMethods);
        config.setAllowedHeaders(allowedHeaders);
        config.setAllowCredentials(allowCredentials);
        config.setMaxAge(maxAge);
        log.debug("CORS methods={}, headers={}, credentials={}, maxAge={}s",
                allowedMethods, allowedHeaders, allowCredentials, maxAge);

        source.registerCorsConfiguration("/api/**", config);
        return new CorsFilter(source);
    }
}
