package com.bko.fitbitclient.shared;

public record FitbitSettings(
        String clientId,
        String clientSecret,
        String accessToken,
        String refreshToken,
        String baseUrl,
        String userAgent
) {
    public static final String DEFAULT_BASE_URL = "https://api.fitbit.com/1";
    public static final String DEFAULT_USER_AGENT = "fitbit-api-client:v0.0.1";

    public FitbitSettings {
        if (!hasText(baseUrl)) {
            baseUrl = DEFAULT_BASE_URL;
        }
        if (!hasText(userAgent)) {
            userAgent = DEFAULT_USER_AGENT;
        }
    }

    public boolean isConfigured() {
        return hasText(accessToken) || hasText(refreshToken);
    }

    public boolean canRefresh() {
        return hasText(clientId) && hasText(clientSecret) && hasText(refreshToken);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
