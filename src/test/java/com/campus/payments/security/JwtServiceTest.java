package com.campus.payments.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private final JwtService jwtService = new JwtService(TestTokens.SECRET);

    @Test
    @DisplayName("Should read back the subject and role of a login token")
    void shouldParseIssuedToken() {
        String token = TestTokens.issue("student-42", "student");

        Claims claims = jwtService.parse(token);

        assertThat(claims.getSubject()).isEqualTo("student-42");
        assertThat(claims.get(JwtService.ROLE_CLAIM, String.class)).isEqualTo("student");
    }

    @Test
    @DisplayName("Should reject a token whose payload was altered")
    void shouldRejectTamperedToken() {
        String[] parts = TestTokens.issue("student-42", "student").split("\\.");
        String forged = TestTokens.issue("admin", "admin").split("\\.")[1];

        assertThatThrownBy(() -> jwtService.parse(parts[0] + "." + forged + "." + parts[2]))
                .isInstanceOf(JwtException.class);
    }

    @Test
    @DisplayName("Should reject a token signed with another secret")
    void shouldRejectForeignToken() {
        String foreign = TestTokens.issue("another-secret-of-the-required-length-42!", "student-42", "student", 60);

        assertThatThrownBy(() -> jwtService.parse(foreign))
                .isInstanceOf(JwtException.class);
    }

    @Test
    @DisplayName("Should reject an expired token")
    void shouldRejectExpiredToken() {
        String expired = TestTokens.issue(TestTokens.SECRET, "student-42", "student", -1);

        assertThatThrownBy(() -> jwtService.parse(expired))
                .isInstanceOf(ExpiredJwtException.class);
    }
}
