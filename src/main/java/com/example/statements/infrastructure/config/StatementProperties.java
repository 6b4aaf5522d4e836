package com.example.statements.infrastructure.config;

import com.example.statements.domain.model.AccountReference;
import com.example.statements.domain.model.FilenameStrategy;
import com.example.statements.domain.model.MalformedTransactionPolicy;
import com.example.statements.domain.model.ValidationStep;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Settings bound from the {@code statements.*} keys of {@code application.yml}.
 * Missing keys fall back to the built-in defaults.
 *
 * @param accounts                   account registry entries; empty means the built-in registry
 * @param validationOrder            order in which validation steps run
 * @param malformedTransactionPolicy handling of incomplete transaction rows
 * @param filenameStrategy           how the output filename is chosen
 * @param batch                      worker pool settings for batch runs
 */
@ConfigurationProperties(prefix = "statements")
public record StatementProperties(
        List<Account> accounts,
        List<ValidationStep> validationOrder,
        MalformedTransactionPolicy malformedTransactionPolicy,
        FilenameStrategy filenameStrategy,
        Batch batch
) {

    public StatementProperties {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        validationOrder = validationOrder == null || validationOrder.isEmpty()
                ? ValidationStep.defaultOrder()
                : List.copyOf(validationOrder);
        malformedTransactionPolicy = malformedTransactionPolicy == null
                ? MalformedTransactionPolicy.SKIP
                : malformedTransactionPolicy;
        filenameStrategy = filenameStrategy == null ? FilenameStrategy.SOURCE : filenameStrategy;
        batch = batch == null ? new Batch(0, null) : batch;
    }

    /**
     * One registry entry as written in configuration.
     */
    public record Account(
            String canonicalId,
            String companyName,
            String bankName,
            int digitLength,
            String accountType
    ) {
        public AccountReference toReference() {
            return new AccountReference(canonicalId, companyName, bankName, digitLength, accountType);
        }
    }

    /**
     * @param poolSize number of worker threads, defaults to 4
     * @param timeout  per-document timeout, defaults to 10 seconds
     */
    public record Batch(int poolSize, Duration timeout) {
        public Batch {
            poolSize = poolSize > 0 ? poolSize : 4;
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        }
    }
}
