package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

/**
 * Sends a request exactly once through the authenticated client and decodes a 2xx JSON body. The response is
 * closed before returning on every path.
 */
public class FitbitRequestExecutor {
    private static final Logger logger = LoggerFactory.getLogger(FitbitRequestExecutor.class);

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public FitbitRequestExecutor(CloseableHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * @param responseType type to decode the body into, or null to discard the body
     * @return the decoded body, or null when {@code responseType} is null
     */
    public <T> T execute(ClassicHttpRequest request, Class<T> responseType) throws FitbitApiException {
        URI uri = requestUri(request);
        logger.debug("Fitbit request: {} {}", request.getMethod(), uri);

        ClassicHttpResponse response;
        try {
            response = httpClient.executeOpen(null, request, null);
        } catch (IOException e) {
            throw new TransportException("Fitbit request " + request.getMethod() + " " + uri + " failed: " + e.getMessage(), e);
        }

        try (response) {
            int status = response.getCode();
            logger.debug("Fitbit response: HTTP {} for {} {}", status, request.getMethod(), uri);
            HttpEntity entity = response.getEntity();

            if (status < HttpStatus.SC_OK || status > 299) {
                if (status == HttpStatus.SC_UNAUTHORIZED) {
                    logger.warn("Fitbit 401: Unauthorized. Access token may be invalid, revoked or missing scopes.");
                }
                throw new RequestFailedException(request.getMethod(), uri, status, response.getReasonPhrase(),
                        readBody(entity));
            }

            if (responseType == null || entity == null) {
                EntityUtils.consume(entity);
                return null;
            }
            return decode(entity, responseType);
        } catch (FitbitApiException e) {
            throw e;
        } catch (IOException e) {
            throw new TransportException("Error reading Fitbit response for " + request.getMethod() + " " + uri, e);
        }
    }

    private <T> T decode(HttpEntity entity, Class<T> responseType) throws IOException {
        try (InputStream content = entity.getContent()) {
            return objectMapper.readValue(content, responseType);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Could not decode Fitbit response as " + responseType.getSimpleName(), e);
        }
    }

    private static String readBody(HttpEntity entity) throws IOException {
        if (entity == null) {
            return null;
        }
        return new String(EntityUtils.toByteArray(entity), StandardCharsets.UTF_8);
    }

    private static URI requestUri(ClassicHttpRequest request) throws MalformedInputException {
        try {
            return request.getUri();
        } catch (URISyntaxException e) {
            throw new MalformedInputException("Invalid request URI", e);
        }
    }
}
