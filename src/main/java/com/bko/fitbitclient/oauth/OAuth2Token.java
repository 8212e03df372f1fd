package com.bko.fitbitclient.oauth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * An OAuth2 credential as issued by the token endpoint. A null expiry means the token never expires as far as
 * this client can tell.
 */
public record OAuth2Token(String accessToken, String tokenType, String refreshToken, Instant expiry) {
    // Tokens this close to expiry are treated as already expired.
    static final Duration EXPIRY_DELTA = Duration.ofSeconds(10);

    public OAuth2Token(String accessToken) {
        this(accessToken, "Bearer", null, null);
    }

    public boolean isValid(Clock clock) {
        if (accessToken == null || accessToken.isEmpty()) {
            return false;
        }
        return expiry == null || expiry.minus(EXPIRY_DELTA).isAfter(clock.instant());
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    @Override
    public String toString() {
        return "OAuth2Token[tokenType=" + tokenType + ", expiry=" + expiry + "]";
    }
}
