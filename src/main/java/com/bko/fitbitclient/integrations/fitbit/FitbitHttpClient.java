package com.bko.fitbitclient.integrations.fitbit;

import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.net.URIBuilder;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Read-only accessors for the Fitbit Web API. Instances come from {@link FitbitClientFactory}; the wrapped HTTP
 * client already carries the bearer token, so every call here is a single stateless request.
 */
public class FitbitHttpClient implements FitbitClientPort, Closeable {
    private final CloseableHttpClient httpClient;
    private final FitbitRequestBuilder requestBuilder;
    private final FitbitRequestExecutor requestExecutor;

    public FitbitHttpClient(CloseableHttpClient httpClient, FitbitRequestBuilder requestBuilder,
                            FitbitRequestExecutor requestExecutor) {
        this.httpClient = httpClient;
        this.requestBuilder = requestBuilder;
        this.requestExecutor = requestExecutor;
    }

    @Override
    public ActivitySummary getActivitySummaryForDay(String day) throws FitbitApiException {
        ClassicHttpRequest request = newRequest("GET", activitySummaryPath(day), null);
        return execute(request, ActivitySummary.class);
    }

    /**
     * The day goes into the path as one percent-encoded segment, so whatever the caller passes is sent to the
     * activity summary endpoint and judged by the remote service.
     */
    static String activitySummaryPath(String day) throws MalformedInputException {
        try {
            return new URIBuilder()
                    .setPathSegments("user", "-", "activities", "date", day + ".json")
                    .build()
                    .getRawPath();
        } catch (URISyntaxException e) {
            throw new MalformedInputException("Invalid day: " + day, e);
        }
    }

    @Override
    public UserProfile getUserProfile() throws FitbitApiException {
        ClassicHttpRequest request = newRequest("GET", "/user/-/profile.json", null);
        return execute(request, UserProfile.class);
    }

    public ClassicHttpRequest newRequest(String method, String path, Object body) throws MalformedInputException {
        return requestBuilder.newRequest(method, path, body);
    }

    public <T> T execute(ClassicHttpRequest request, Class<T> responseType) throws FitbitApiException {
        return requestExecutor.execute(request, responseType);
    }

    public URI getBaseUri() {
        return requestBuilder.getBaseUri();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
