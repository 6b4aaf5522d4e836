package com.example.statements.domain.service;

import com.example.statements.domain.model.AccountReference;
import com.example.statements.domain.model.ExtractedField;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for account number normalization against the closed registry.
 */
class AccountRegistryTest {

    private final AccountRegistry registry = AccountRegistry.defaultRegistry();

    @Test
    void defaultRegistryListsFiveAccountsInOrder() {
        assertThat(registry.findAll())
                .extracting(AccountReference::canonicalId)
                .containsExactly("000000228239080", "000000954291944", "000000333721212",
                        "00085695149", "000000880865188");
    }

    @Test
    void exactCanonicalIdResolves() {
        ExtractedField<AccountReference> account = registry.normalize("000000954291944", null);

        assertThat(account.present()).isTrue();
        assertThat(account.value().companyName()).isEqualTo("IT DevOps LLC");
    }

    @Test
    void separatorsAreIgnoredForUnmaskedNumbers() {
        assertThat(registry.normalize("000000-954291944", null).value().canonicalId())
                .isEqualTo("000000954291944");
    }

    @Test
    void maskedNumberResolvesThroughCompanyHint() {
        ExtractedField<AccountReference> account = registry.normalize("XXXX1944", "IT DevOps LLC");

        assertThat(account.value().canonicalId()).isEqualTo("000000954291944");
    }

    @Test
    void maskedNumberWithoutHintIsAbsent() {
        ExtractedField<AccountReference> account = registry.normalize("XXXX1944", null);

        assertThat(account.isAbsent()).isTrue();
        assertThat(account.rawSpan()).isEqualTo("XXXX1944");
    }

    @Test
    void maskedNumberWithAmbiguousHintIsAbsent() {
        assertThat(registry.normalize("XXXX1944", "LLC").isAbsent()).isTrue();
    }

    /**
     * Numbers that merely look close to a registry id must not resolve.
     */
    @Test
    void unknownNumberIsNotFuzzyMatched() {
        assertThat(registry.normalize("000000954291945", "IT DevOps LLC").isAbsent()).isTrue();
        assertThat(registry.normalize("954291944", null).isAbsent()).isTrue();
    }

    @Test
    void blankInputIsAbsent() {
        assertThat(registry.normalize("  ", "IT DevOps LLC").isRejected()).isFalse();
        assertThat(registry.normalize(null, null).isAbsent()).isTrue();
    }

    @Test
    void duplicateCanonicalIdsAreRefused() {
        AccountReference account = new AccountReference("000000954291944", "IT DevOps LLC", "Chase", 12, "Business");

        assertThrows(IllegalArgumentException.class, () -> new AccountRegistry(List.of(account, account)));
    }

    @Test
    void alternateRegistryCanBeBuiltForTests() {
        AccountRegistry custom = new AccountRegistry(List.of(
                new AccountReference("123456789012", "Test Co", "Test Bank", 12, "Checking")));

        assertThat(custom.findByCanonicalId("123456789012")).isPresent();
        assertThat(custom.normalize("000000954291944", null).isAbsent()).isTrue();
    }
}
