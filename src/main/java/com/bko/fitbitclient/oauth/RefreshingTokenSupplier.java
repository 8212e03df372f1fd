package com.bko.fitbitclient.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.HttpResponseException;
import org.apache.hc.client5.http.fluent.Executor;
import org.apache.hc.client5.http.fluent.Form;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.core5.http.HttpHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * Hands out the current access token and exchanges the refresh token for a new one once the access token has
 * expired. Fitbit refresh tokens are single use, so callers that persist credentials should read
 * {@link #currentToken()} after a refresh.
 */
public class RefreshingTokenSupplier implements TokenSupplier {
    private static final Logger logger = LoggerFactory.getLogger(RefreshingTokenSupplier.class);

    private final OAuth2Config config;
    private final Executor executor;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private OAuth2Token token;

    public RefreshingTokenSupplier(OAuth2Config config, OAuth2Token token, Executor executor, Clock clock) {
        this.config = config;
        this.token = token;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public synchronized String getAccessToken() throws IOException {
        if (token == null || !token.isValid(clock)) {
            token = refresh();
        }
        return token.accessToken();
    }

    public synchronized OAuth2Token currentToken() {
        return token;
    }

    private OAuth2Token refresh() throws IOException {
        if (token == null || !token.hasRefreshToken()) {
            throw new TokenRefreshException("Fitbit access token expired and no refresh token is available");
        }
        logger.info("Refreshing Fitbit access token...");

        String response;
        try {
            response = executor.execute(Request.post(config.tokenUrl())
                            .addHeader(HttpHeaders.AUTHORIZATION, basicCredentials())
                            .bodyForm(Form.form()
                                    .add("grant_type", "refresh_token")
                                    .add("refresh_token", token.refreshToken())
                                    .build()))
                    .returnContent()
                    .asString(StandardCharsets.UTF_8);
        } catch (HttpResponseException e) {
            if (e.getStatusCode() == 400 || e.getStatusCode() == 401) {
                logger.warn("Fitbit token refresh rejected: HTTP {} {}. Check FITBIT_CLIENT_ID, FITBIT_CLIENT_SECRET and FITBIT_REFRESH_TOKEN.",
                        e.getStatusCode(), e.getReasonPhrase());
            }
            throw new TokenRefreshException("Fitbit token refresh failed: HTTP " + e.getStatusCode(), e.getStatusCode(), e);
        } catch (IOException e) {
            throw new TokenRefreshException("Fitbit token refresh failed: " + e.getMessage(), e);
        }

        OAuth2Token refreshed = parseToken(response);
        logger.info("Fitbit access token refreshed, expires at {}", refreshed.expiry());
        return refreshed;
    }

    private OAuth2Token parseToken(String body) throws TokenRefreshException {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TokenRefreshException("Unreadable Fitbit token response", e);
        }
        if (node == null || !node.hasNonNull("access_token")) {
            throw new TokenRefreshException("Fitbit token response has no access_token");
        }

        String accessToken = node.get("access_token").asText();
        String tokenType = node.hasNonNull("token_type") ? node.get("token_type").asText() : "Bearer";
        // Keep the old refresh token if the endpoint did not rotate it.
        String refreshToken = node.hasNonNull("refresh_token")
                ? node.get("refresh_token").asText()
                : token.refreshToken();
        Instant expiry = node.hasNonNull("expires_in")
                ? clock.instant().plusSeconds(node.get("expires_in").asLong())
                : null;
        return new OAuth2Token(accessToken, tokenType, refreshToken, expiry);
    }

    private String basicCredentials() {
        String credentials = config.clientId() + ":" + config.clientSecret();
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
