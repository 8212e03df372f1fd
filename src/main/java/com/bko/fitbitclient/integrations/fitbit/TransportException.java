package com.bko.fitbitclient.integrations.fitbit;

public class TransportException extends FitbitApiException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
