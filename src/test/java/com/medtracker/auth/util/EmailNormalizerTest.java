package com.medtracker.auth.util;

import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmailNormalizerTest {

    private final EmailNormalizer normalizer =
            new EmailNormalizer(Validation.buildDefaultValidatorFactory().getValidator());

    @Test
    void normalize_should_trim_and_lowercase() {
        assertThat(normalizer.normalize("  Pat.Lee+meds@Clinic.IO\t")).isEqualTo("pat.lee+meds@clinic.io");
    }

    @Test
    void normalize_should_accept_valid_addresses_with_uncommon_characters() {
        assertThat(normalizer.normalize("O'Brien@clinic.io")).isEqualTo("o'brien@clinic.io");
        assertThat(normalizer.normalize("first_last-1@sub.clinic.co.uk")).isEqualTo("first_last-1@sub.clinic.co.uk");
    }

    @Test
    void normalize_should_reject_implausible_addresses() {
        assertThatThrownBy(() -> normalizer.normalize(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("   ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("no-at-sign")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("a@b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("a b@c.io")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("a@@c.io")).isInstanceOf(IllegalArgumentException.class);
    }
}
