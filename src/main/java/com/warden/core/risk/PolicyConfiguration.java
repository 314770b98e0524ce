package com.warden.core.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Freezes the bound {@link PolicyProperties} into the immutable {@link PolicyConfig} the classifier uses.
 */
@Configuration
public class PolicyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfiguration.class);

    @Bean
    public PolicyConfig policyConfig(PolicyProperties properties) {
        PolicyConfig config = properties.toPolicyConfig();
        log.info("Risk policy loaded: {} blocked patterns, {} critical actions, approval categories {}, {} protected paths",
                config.blockedPatterns().size(), config.criticalActions().size(),
                config.approvalCategories(), config.protectedPaths().size());
        return config;
    }
}
