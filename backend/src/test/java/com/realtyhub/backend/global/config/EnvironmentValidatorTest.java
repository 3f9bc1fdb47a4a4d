package com.realtyhub.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    @DisplayName("필수 설정이 모두 있으면 통과한다")
    void validEnvironment() {
        EnvironmentValidator validator = new EnvironmentValidator(validEnvironmentProperties());

        assertThat(validator.collectProblems()).isEmpty();
        assertThatCode(validator::validateEnvironment).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("누락된 값, 짧은 비밀키, 범위를 벗어난 만료 시간을 모두 보고한다")
    void reportsEveryProblem() {
        MockEnvironment environment = validEnvironmentProperties()
                .withProperty("jwt.secret", "short")
                .withProperty("jwt.expiration", "1000")
                .withProperty("realtyhub.storage.bucket", " ");

        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.collectProblems())
                .hasSize(3)
                .anyMatch(problem -> problem.startsWith("jwt.secret"))
                .anyMatch(problem -> problem.startsWith("jwt.expiration"))
                .anyMatch(problem -> problem.startsWith("realtyhub.storage.bucket"));
        assertThatThrownBy(validator::validateEnvironment).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("만료 시간이 숫자가 아니면 보고한다")
    void nonNumericExpiration() {
        EnvironmentValidator validator = new EnvironmentValidator(
                validEnvironmentProperties().withProperty("jwt.expiration", "15m"));

        assertThat(validator.collectProblems()).containsExactly("jwt.expiration: 숫자여야 합니다");
    }

    private static MockEnvironment validEnvironmentProperties() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/realtyhub")
                .withProperty("jwt.secret", "realtyhub-unit-test-secret-with-enough-bytes!")
                .withProperty("jwt.expiration", "900000")
                .withProperty("app.cors.allowed-origins", "http://localhost:3000")
                .withProperty("realtyhub.storage.bucket", "realtyhub-test")
                .withProperty("realtyhub.storage.public-base-url", "https://cdn.example.com");
    }
}
