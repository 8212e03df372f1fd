package com.bko.fitbitclient.integrations.fitbit;

import com.bko.fitbitclient.oauth.OAuth2Config;
import com.bko.fitbitclient.oauth.OAuth2Token;
import com.bko.fitbitclient.shared.FitbitSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Clock;

@Configuration
public class FitbitClientConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FitbitClientConfiguration.class);

    @Bean
    public FitbitClientFactory fitbitClientFactory(FitbitSettings settings, Clock clock) {
        return new FitbitClientFactory(new OAuth2Config(settings.clientId(), settings.clientSecret()),
                settings.userAgent(), clock);
    }

    @Bean(destroyMethod = "close")
    public FitbitHttpClient fitbitClient(FitbitClientFactory factory, FitbitSettings settings) {
        if (!settings.isConfigured()) {
            logger.warn("Fitbit credentials missing. Set FITBIT_ACCESS_TOKEN or FITBIT_REFRESH_TOKEN.");
        } else if (settings.refreshToken() != null && !settings.canRefresh()) {
            logger.warn("FITBIT_REFRESH_TOKEN is set but FITBIT_CLIENT_ID or FITBIT_CLIENT_SECRET is missing.");
        }
        // Expiry is unknown for tokens read from the environment; a refresh only happens when no access token is set.
        OAuth2Token token = new OAuth2Token(settings.accessToken(), "Bearer", settings.refreshToken(), null);
        return factory.newClient(token, URI.create(settings.baseUrl()));
    }
}
