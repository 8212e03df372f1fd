package com.bko.fitbitclient.integrations.fitbit;

import java.io.IOException;

/** Base type of every failure reported by {@link FitbitClientPort} and its building blocks. */
public abstract class FitbitApiException extends IOException {

    protected FitbitApiException(String message) {
        super(message);
    }

    protected FitbitApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
