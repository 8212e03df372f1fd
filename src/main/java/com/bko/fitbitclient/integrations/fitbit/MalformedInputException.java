package com.bko.fitbitclient.integrations.fitbit;

/** The request could not be built: bad method, bad path or a payload that cannot be written as JSON. */
public class MalformedInputException extends FitbitApiException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
