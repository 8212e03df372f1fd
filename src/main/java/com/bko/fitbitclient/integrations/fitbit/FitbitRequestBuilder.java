package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Turns a method, an API-relative path and an optional payload into a request against the configured base
 * URL. Nothing here touches the network.
 */
public class FitbitRequestBuilder {
    private final URI baseUri;
    private final String userAgent;
    private final ObjectMapper objectMapper;

    public FitbitRequestBuilder(URI baseUri, String userAgent, ObjectMapper objectMapper) {
        this.baseUri = withTrailingSlash(baseUri);
        this.userAgent = userAgent;
        this.objectMapper = objectMapper;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    public ClassicHttpRequest newRequest(String method, String path, Object body) throws MalformedInputException {
        Method httpMethod = parseMethod(method);
        URI uri = resolve(path);

        ClassicRequestBuilder builder = ClassicRequestBuilder.create(httpMethod.name())
                .setUri(uri)
                .addHeader(HttpHeaders.USER_AGENT, userAgent);
        if (body != null) {
            builder.setEntity(new StringEntity(toJson(body), ContentType.APPLICATION_JSON));
        }
        return builder.build();
    }

    /**
     * Joins {@code path} onto the base URL. A leading slash is optional: {@code /user/-/profile.json} and
     * {@code user/-/profile.json} address the same resource.
     */
    URI resolve(String path) throws MalformedInputException {
        if (path == null) {
            throw new MalformedInputException("Request path is required");
        }
        String relative = path;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }

        URI relativeUri;
        try {
            relativeUri = new URI(relative);
        } catch (URISyntaxException e) {
            throw new MalformedInputException("Invalid request path: " + path, e);
        }
        if (relativeUri.isAbsolute() || relativeUri.getRawAuthority() != null) {
            throw new MalformedInputException("Request path must be relative to " + baseUri + ": " + path);
        }
        return baseUri.resolve(relativeUri);
    }

    private Method parseMethod(String method) throws MalformedInputException {
        if (method == null || method.isBlank()) {
            throw new MalformedInputException("HTTP method is required");
        }
        try {
            return Method.normalizedValueOf(method.trim());
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException("Unsupported HTTP method: " + method, e);
        }
    }

    private String toJson(Object body) throws MalformedInputException {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Could not encode request body as JSON", e);
        }
    }

    private static URI withTrailingSlash(URI uri) {
        String value = uri.toString();
        return value.endsWith("/") ? uri : URI.create(value + "/");
    }
}
