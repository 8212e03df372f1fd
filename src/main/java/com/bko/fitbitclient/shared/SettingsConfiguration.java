package com.bko.fitbitclient.shared;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SettingsConfiguration {

    @Bean
    public FitbitSettings fitbitSettings(EnvConfig envConfig) {
        return new FitbitSettings(
                envConfig.get("fitbit.client_id"),
                envConfig.get("fitbit.client_secret"),
                envConfig.get("fitbit.access_token"),
                envConfig.get("fitbit.refresh_token"),
                envConfig.get("fitbit.base_url"),
                envConfig.get("fitbit.user_agent")
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
