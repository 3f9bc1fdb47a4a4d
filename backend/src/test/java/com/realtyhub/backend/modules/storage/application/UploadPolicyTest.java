package com.realtyhub.backend.modules.storage.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.realtyhub.backend.global.error.ProblemException;
import com.realtyhub.backend.support.TestProperties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UploadPolicyTest {

    private final UploadPolicy policy = new UploadPolicy(TestProperties.defaults());

    @Test
    @DisplayName("허용된 이미지 형식은 대소문자와 관계없이 통과한다")
    void allowedTypes() {
        assertThatCode(() -> policy.check("a.jpg", "image/jpeg", 100)).doesNotThrowAnyException();
        assertThatCode(() -> policy.check("a.PNG", "IMAGE/PNG", 100)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("허용되지 않은 형식, 빈 파일, 너무 큰 파일은 거절한다")
    void rejectsInvalidFiles() {
        assertThatThrownBy(() -> policy.check("a.pdf", "application/pdf", 100))
                .isInstanceOf(ProblemException.class)
                .extracting("code").isEqualTo("storage.unsupported_type");
        assertThatThrownBy(() -> policy.check("a.jpg", null, 100))
                .extracting("code").isEqualTo("storage.unsupported_type");
        assertThatThrownBy(() -> policy.check("a.jpg", "image/jpeg", 0))
                .extracting("code").isEqualTo("storage.empty_file");
        assertThatThrownBy(() -> policy.check("a.jpg", "image/jpeg", 10_485_761L))
                .extracting("code").isEqualTo("storage.file_too_large");
    }
}
