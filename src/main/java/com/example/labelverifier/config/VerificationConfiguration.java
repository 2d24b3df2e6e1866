package com.example.labelverifier.config;

import com.example.labelverifier.service.LabelVerifier;
import com.example.labelverifier.service.matching.MatchingRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VerificationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VerificationConfiguration.class);

    @Bean
    public LabelVerifier labelVerifier(VerificationProperties properties) {
        MatchingRules rules = properties.toMatchingRules();
        log.info("Label verification rules: {}", rules);
        return new LabelVerifier(rules);
    }
}
