package com.bko.fitbitclient.oauth;

import java.io.IOException;

public class TokenRefreshException extends IOException {
    private final int statusCode;

    public TokenRefreshException(String message) {
        this(message, -1, null);
    }

    public TokenRefreshException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TokenRefreshException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the token endpoint, or -1 when the failure happened before a response. */
    public int getStatusCode() {
        return statusCode;
    }
}
