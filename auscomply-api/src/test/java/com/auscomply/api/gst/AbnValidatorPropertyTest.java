package com.auscomply.api.gst;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for the ABN checksum.
 */
class AbnValidatorPropertyTest {

    @Example
    void publishedExampleAbnIsValid() {
        assertThat(AbnValidator.isValid("51 824 753 556")).isTrue();
        assertThat(AbnValidator.format("51824753556")).isEqualTo("51 824 753 556");
    }

    @Property
    void changingAnySingleDigitBreaksTheChecksum(
            @ForAll("validAbns") String abn,
            @ForAll @IntRange(min = 0, max = 10) int position,
            @ForAll @IntRange(min = 1, max = 9) int shift) {

        char[] digits = abn.toCharArray();
        digits[position] = (char) ('0' + (digits[position] - '0' + shift) % 10);

        assertThat(AbnValidator.isValid(new String(digits))).isFalse();
    }

    @Property
    void formattingKeepsTheDigits(@ForAll("validAbns") String abn) {
        String formatted = AbnValidator.format(abn);

        assertThat(formatted).hasSize(14).matches("\\d{2} \\d{3} \\d{3} \\d{3}");
        assertThat(AbnValidator.normalize(formatted)).isEqualTo(abn);
        assertThat(AbnValidator.isValid(formatted)).isTrue();
    }

    @Property
    void wrongLengthIsInvalid(@ForAll("digits") String candidate) {
        Assume.that(candidate.length() != 11);

        assertThat(AbnValidator.isValid(candidate)).isFalse();
    }

    @Example
    void nullAndBlankAreInvalid() {
        assertThat(AbnValidator.isValid(null)).isFalse();
        assertThat(AbnValidator.isValid("   ")).isFalse();
        assertThatThrownBy(() -> AbnValidator.format("123"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Provide
    Arbitrary<String> validAbns() {
        return Arbitraries.strings().numeric().ofLength(11)
                .filter(s -> s.charAt(0) != '0')
                .filter(AbnValidator::isValid);
    }

    @Provide
    Arbitrary<String> digits() {
        return Arbitraries.strings().numeric().ofMinLength(0).ofMaxLength(14);
    }
}
