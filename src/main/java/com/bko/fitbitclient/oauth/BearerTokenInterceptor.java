package com.bko.fitbitclient.oauth;

import org.apache.hc.core5.http.EntityDetails;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpRequest;
import org.apache.hc.core5.http.HttpRequestInterceptor;
import org.apache.hc.core5.http.protocol.HttpContext;

import java.io.IOException;

/** Sets the Authorization header of every outgoing request from the given {@link TokenSupplier}. */
public class BearerTokenInterceptor implements HttpRequestInterceptor {
    private final TokenSupplier tokenSupplier;

    public BearerTokenInterceptor(TokenSupplier tokenSupplier) {
        this.tokenSupplier = tokenSupplier;
    }

    @Override
    public void process(HttpRequest request, EntityDetails entity, HttpContext context) throws IOException {
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + tokenSupplier.getAccessToken());
    }
}
