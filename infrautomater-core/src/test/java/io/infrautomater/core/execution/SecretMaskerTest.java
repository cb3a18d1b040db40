package io.infrautomater.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SecretMaskerTest {

    @Test
    void shouldReplaceEveryOccurrence() {
        SecretMasker masker = new SecretMasker();
        masker.register("s3cr3tPassw0rd");

        String masked = masker.mask("password=s3cr3tPassw0rd again s3cr3tPassw0rd");

        assertThat(masked).isEqualTo("password=******** again ********");
    }

    @Test
    void shouldPreferLongestSecret() {
        SecretMasker masker = new SecretMasker();
        masker.register("abcd");
        masker.register("abcdefgh");

        assertThat(masker.mask("xabcdefghx")).isEqualTo("x********x");
    }

    @Test
    void shouldIgnoreShortAndNullSecrets() {
        SecretMasker masker = new SecretMasker();
        masker.register("ab");
        masker.register(null);

        assertThat(masker.size()).isZero();
        assertThat(masker.mask("ab")).isEqualTo("ab");
    }

    @Test
    void shouldPassNullThrough() {
        assertThat(new SecretMasker().mask(null)).isNull();
    }
}
