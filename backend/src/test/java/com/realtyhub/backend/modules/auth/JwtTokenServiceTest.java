package com.realtyhub.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.realtyhub.backend.modules.auth.application.JwtTokenService;
import com.realtyhub.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.realtyhub.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.realtyhub.backend.modules.auth.domain.AppUser;
import com.realtyhub.backend.modules.auth.domain.UserRole;
import com.realtyhub.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.realtyhub.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.realtyhub.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "realtyhub-unit-test-secret-with-enough-bytes!";
    private static final Instant ISSUED = Instant.parse("2025-05-01T00:00:00Z");
    private static final long TTL_MILLIS = 900_000L;

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    @DisplayName("발급한 토큰을 해석하면 사용자 ID, 이메일, 역할이 복원된다")
    void issueAndParse() {
        JwtTokenService service = serviceAt(ISSUED);
        AppUser user = TestEntities.user(UUID.randomUUID(), UserRole.ADMIN);

        AccessTokenResponse token = service.issueAccessToken(user);
        ParsedToken parsed = service.parseAccessToken(token.accessToken());

        assertThat(token.tokenType()).isEqualTo("Bearer");
        assertThat(token.expiresIn()).isEqualTo(900L);
        assertThat(parsed.userId()).isEqualTo(user.getId());
        assertThat(parsed.email()).isEqualTo(user.getEmail());
        assertThat(parsed.role()).isEqualTo(UserRole.ADMIN);
        assertThat(parsed.expiresAt()).isEqualTo(OffsetDateTime.parse("2025-05-01T00:15:00Z"));
    }

    @Test
    @DisplayName("만료된 토큰은 거절한다")
    void expiredTokenIsRejected() {
        String token = serviceAt(ISSUED).issueAccessToken(TestEntities.user(UUID.randomUUID(), UserRole.USER)).accessToken();

        JwtTokenService later = serviceAt(ISSUED.plusMillis(TTL_MILLIS).plusSeconds(60));

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("다른 키로 서명된 토큰은 거절한다")
    void foreignSignatureIsRejected() {
        String token = serviceAt(ISSUED).issueAccessToken(TestEntities.user(UUID.randomUUID(), UserRole.USER)).accessToken();
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-secret-that-is-also-long-enough!!"), TTL_MILLIS, fixed(ISSUED));

        assertThatThrownBy(() -> other.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> other.parseAccessToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }

    private JwtTokenService serviceAt(Instant now) {
        return new JwtTokenService(provider, TTL_MILLIS, fixed(now));
    }

    private static Clock fixed(Instant now) {
        return Clock.fixed(now, ZoneOffset.UTC);
    }
}
