package com.example.statements.infrastructure.config;

import com.example.statements.application.service.StatementResponseBuilder;
import com.example.statements.domain.extraction.FilenameExtractor;
import com.example.statements.domain.extraction.StatementTextScanner;
import com.example.statements.domain.service.AccountRegistry;
import com.example.statements.domain.service.RecordValidator;
import com.example.statements.domain.service.TransactionClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free engine classes into the Spring context.
 */
@Configuration
@EnableConfigurationProperties(StatementProperties.class)
public class StatementEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StatementEngineConfiguration.class);

    @Bean
    public AccountRegistry accountRegistry(StatementProperties properties) {
        if (properties.accounts().isEmpty()) {
            log.info("No accounts configured, using the built-in account registry");
            return AccountRegistry.defaultRegistry();
        }
        AccountRegistry registry = new AccountRegistry(properties.accounts().stream()
                .map(StatementProperties.Account::toReference)
                .toList());
        log.info("Loaded {} accounts into the account registry", registry.findAll().size());
        return registry;
    }

    @Bean
    public TransactionClassifier transactionClassifier() {
        return new TransactionClassifier();
    }

    @Bean
    public RecordValidator recordValidator(StatementProperties properties) {
        return new RecordValidator(properties.validationOrder(), properties.malformedTransactionPolicy());
    }

    @Bean
    public StatementTextScanner statementTextScanner() {
        return new StatementTextScanner();
    }

    @Bean
    public FilenameExtractor filenameExtractor() {
        return new FilenameExtractor();
    }

    @Bean
    public StatementResponseBuilder statementResponseBuilder(StatementProperties properties, ObjectMapper objectMapper) {
        return new StatementResponseBuilder(properties.filenameStrategy(), objectMapper);
    }
}
