package com.realtyhub.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정값 검증. 누락되거나 잘못된 값이 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "realtyhub.storage.bucket",
            "realtyhub.storage.public-base-url"
    };

    private static final long MIN_EXPIRATION_MS = 300_000L;
    private static final long MAX_EXPIRATION_MS = 86_400_000L;
    private static final int MIN_SECRET_LENGTH = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("환경설정 검증 실패: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("환경설정 검증 완료");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + ": 필수 값이 누락되었습니다");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank() && secret.length() < MIN_SECRET_LENGTH)
                .ifPresent(secret -> problems.add("jwt.secret: " + MIN_SECRET_LENGTH + "자 이상이어야 합니다"));

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long value = Long.parseLong(expiration.trim());
                if (value < MIN_EXPIRATION_MS || value > MAX_EXPIRATION_MS) {
                    problems.add("jwt.expiration: 300000-86400000 밀리초 범위여야 합니다");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: 숫자여야 합니다");
            }
        }
        return problems;
    }
}
