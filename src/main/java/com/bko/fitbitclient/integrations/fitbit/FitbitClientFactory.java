package com.bko.fitbitclient.integrations.fitbit;

import com.bko.fitbitclient.oauth.BearerTokenInterceptor;
import com.bko.fitbitclient.oauth.OAuth2Config;
import com.bko.fitbitclient.oauth.OAuth2Token;
import com.bko.fitbitclient.oauth.RefreshingTokenSupplier;
import com.bko.fitbitclient.oauth.StaticTokenSupplier;
import com.bko.fitbitclient.oauth.TokenSupplier;
import com.bko.fitbitclient.shared.FitbitSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.fluent.Executor;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;

import java.net.URI;
import java.time.Clock;

/** Binds OAuth2 application credentials to an access token and produces ready-to-use clients. */
public class FitbitClientFactory {
    private final OAuth2Config config;
    private final String userAgent;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FitbitClientFactory(OAuth2Config config) {
        this(config, FitbitSettings.DEFAULT_USER_AGENT);
    }

    public FitbitClientFactory(OAuth2Config config, String userAgent) {
        this(config, userAgent, Clock.systemUTC());
    }

    /**
     * @param clock decides when an access token counts as expired and gets refreshed
     */
    public FitbitClientFactory(OAuth2Config config, String userAgent, Clock clock) {
        this.config = config;
        this.userAgent = userAgent;
        this.clock = clock;
    }

    public FitbitHttpClient newClient(OAuth2Token token) {
        return newClient(token, URI.create(FitbitSettings.DEFAULT_BASE_URL));
    }

    public FitbitHttpClient newClient(OAuth2Token token, URI baseUri) {
        return newClient(tokenSupplierFor(token), baseUri);
    }

    public FitbitHttpClient newClient(TokenSupplier tokenSupplier, URI baseUri) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .addRequestInterceptorFirst(new BearerTokenInterceptor(tokenSupplier))
                // One attempt per call, including 429/503 answers that would otherwise be retried.
                .disableAutomaticRetries()
                // A 3xx is returned to the executor as is, so the bearer token never follows a redirect.
                .disableRedirectHandling()
                .build();
        return new FitbitHttpClient(
                httpClient,
                new FitbitRequestBuilder(baseUri, userAgent, objectMapper),
                new FitbitRequestExecutor(httpClient, objectMapper)
        );
    }

    TokenSupplier tokenSupplierFor(OAuth2Token token) {
        if (token != null && token.hasRefreshToken()) {
            return new RefreshingTokenSupplier(config, token, Executor.newInstance(), clock);
        }
        return new StaticTokenSupplier(token);
    }
}
