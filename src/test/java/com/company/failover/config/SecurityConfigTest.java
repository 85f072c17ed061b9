package com.company.failover.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JWT authority mapping")
class SecurityConfigTest {

    private static Jwt.Builder jwt() {
        return Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("alice")
                .issuedAt(Instant.now())
                .expiresAt(Instant.now().plusSeconds(300));
    }

    @Test
    @DisplayName("Should map roles to ROLE_ authorities alongside scopes")
    void shouldMapRolesAndScopes() {
        Jwt token = jwt().claim("roles", List.of("ADMIN", "OPERATOR")).claim("scope", "failover.read").build();

        AbstractAuthenticationToken authentication = new SecurityConfig().jwtAuthenticationConverter().convert(token);

        assertThat(authentication.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_ADMIN", "ROLE_OPERATOR", "SCOPE_failover.read");
    }

    @Test
    @DisplayName("Should grant nothing without roles or scopes")
    void shouldHandleMissingClaims() {
        AbstractAuthenticationToken authentication = new SecurityConfig().jwtAuthenticationConverter()
                .convert(jwt().build());

        assertThat(authentication.getAuthorities()).isEmpty();
    }
}
