package com.bko.fitbitclient.oauth;

/** Application credentials registered with Fitbit, plus the endpoint used to refresh tokens. */
public record OAuth2Config(String clientId, String clientSecret, String tokenUrl) {
    public static final String FITBIT_TOKEN_URL = "https://api.fitbit.com/oauth2/token";

    public OAuth2Config {
        if (tokenUrl == null || tokenUrl.isBlank()) {
            tokenUrl = FITBIT_TOKEN_URL;
        }
    }

    public OAuth2Config(String clientId, String clientSecret) {
        this(clientId, clientSecret, FITBIT_TOKEN_URL);
    }
}
