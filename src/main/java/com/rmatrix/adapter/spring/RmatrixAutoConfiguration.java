package com.rmatrix.adapter.spring;

import com.rmatrix.batch.RuleBatchProcessor;
import com.rmatrix.config.ConfigLoader;
import com.rmatrix.config.RmatrixConfig;
import com.rmatrix.matrix.RMatrixBuilder;
import com.rmatrix.output.BatchOutputWriter;
import com.rmatrix.rule.RuleConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for rmatrix.
 */
@Configuration
@ConditionalOnProperty(prefix = "rmatrix", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RmatrixProperties.class)
public class RmatrixAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RmatrixAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public RmatrixConfig rmatrixConfig(RmatrixProperties properties) {
        log.info("Loading rmatrix configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleConverter ruleConverter(RmatrixConfig config) {
        log.info("Creating RuleConverter with {} clause deduplication", config.dnf().clauseDeduplication());
        return new RuleConverter(config.dnf().clauseDeduplication());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleBatchProcessor ruleBatchProcessor(RuleConverter converter, RmatrixConfig config) {
        return new RuleBatchProcessor(converter, config.batch().failFast());
    }

    @Bean
    @ConditionalOnMissingBean
    public RMatrixBuilder rMatrixBuilder(RmatrixConfig config) {
        return new RMatrixBuilder(config.matrix());
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchOutputWriter batchOutputWriter(RmatrixConfig config, RMatrixBuilder matrixBuilder) {
        return new BatchOutputWriter(config.batch(), matrixBuilder);
    }
}
