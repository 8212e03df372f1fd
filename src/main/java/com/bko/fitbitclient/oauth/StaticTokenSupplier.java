package com.bko.fitbitclient.oauth;

public class StaticTokenSupplier implements TokenSupplier {
    private final OAuth2Token token;

    public StaticTokenSupplier(OAuth2Token token) {
        this.token = token;
    }

    @Override
    public String getAccessToken() throws TokenRefreshException {
        if (token == null || token.accessToken() == null || token.accessToken().isEmpty()) {
            throw new TokenRefreshException("No Fitbit access token configured and no refresh token to obtain one");
        }
        return token.accessToken();
    }
}
