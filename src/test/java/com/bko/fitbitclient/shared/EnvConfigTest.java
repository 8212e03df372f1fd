package com.bko.fitbitclient.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnvConfigTest {

    @Test
    void dottedKeysMapToEnvironmentNames() {
        assertEquals("FITBIT_CLIENT_ID", EnvConfig.toEnvKey("fitbit.client_id"));
        assertEquals("FITBIT_BASE_URL", EnvConfig.toEnvKey("fitbit.base-url"));
    }

    @Test
    void valuesFromDotenvAreTrimmed() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("FITBIT_ACCESS_TOKEN")).thenReturn("  eyJhbGciOi \n");

        EnvConfig envConfig = new EnvConfig(dotenv);

        assertEquals("eyJhbGciOi", envConfig.get("fitbit.access_token"));
    }

    @Test
    void unknownKeyIsNull() {
        EnvConfig envConfig = new EnvConfig(mock(Dotenv.class));

        assertNull(envConfig.get("fitbit.definitely_not_configured_anywhere"));
    }
}
