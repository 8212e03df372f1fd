package com.bko.fitbitclient.integrations.fitbit;

public class DecodeException extends FitbitApiException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
