package com.example.labelverifier.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets the browser front end, served from another origin, call the API.
 */
@Configuration
public class WebCorsConfiguration implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebCorsConfiguration.class);

    private final VerificationProperties properties;

    public WebCorsConfiguration(VerificationProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = properties.getCors().getAllowedOrigins().toArray(String[]::new);
        log.info("Allowing cross-origin API calls from {}", String.join(", ", origins));
        registry.addMapping("/api/**")
                .allowedOriginPatterns(origins)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }
}
