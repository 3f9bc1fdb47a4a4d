package com.realtyhub.backend.modules.lead;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.modules.lead.application.PhoneNumbers;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class PhoneNumbersTest {

    @Test
    @DisplayName("숫자 이외의 문자는 제거한다")
    void stripsFormatting() {
        assertThat(PhoneNumbers.normalize("(555) 123-4567")).isEqualTo("5551234567");
        assertThat(PhoneNumbers.normalize("+82 10-1234-5678")).isEqualTo("821012345678");
    }

    @Test
    @DisplayName("10자리와 15자리는 허용한다")
    void acceptsBoundaryLengths() {
        assertThat(PhoneNumbers.normalize("1234567890")).hasSize(10);
        assertThat(PhoneNumbers.normalize("123456789012345")).hasSize(15);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"123456789", "1234567890123456", "call me", "555-1234"})
    @DisplayName("10~15자리가 아니면 lead.invalid_phone 오류")
    void rejectsInvalidNumbers(String raw) {
        assertThatThrownBy(() -> PhoneNumbers.normalize(raw))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("lead.invalid_phone"));
    }
}
