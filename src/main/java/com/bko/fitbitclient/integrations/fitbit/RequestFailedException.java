package com.bko.fitbitclient.integrations.fitbit;

import java.net.URI;

/**
 * Fitbit answered with a status outside 200-299. The raw body is kept as text so callers can inspect the error
 * payload themselves.
 */
public class RequestFailedException extends FitbitApiException {
    private final String method;
    private final URI uri;
    private final int statusCode;
    private final String reasonPhrase;
    private final String body;

    public RequestFailedException(String method, URI uri, int statusCode, String reasonPhrase, String body) {
        super("Fitbit API error: " + method + " " + uri + " returned HTTP " + statusCode
                + (reasonPhrase != null ? " " + reasonPhrase : ""));
        this.method = method;
        this.uri = uri;
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.body = body;
    }

    public String getMethod() { return method; }
    public URI getUri() { return uri; }
    public int getStatusCode() { return statusCode; }
    public String getReasonPhrase() { return reasonPhrase; }
    public String getBody() { return body; }
}
