package com.example.statements.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AccountNumberMaskerTest {

    @Test
    void keepsOnlyLastFourCharacters() {
        assertThat(AccountNumberMasker.mask("000000954291944")).isEqualTo("XXXXXXXXXXX1944");
    }

    @Test
    void shortOrMissingValuesAreFullyMasked() {
        assertThat(AccountNumberMasker.mask("1944")).isEqualTo("XXXX");
        assertThat(AccountNumberMasker.mask(null)).isEqualTo("XXXX");
    }
}
