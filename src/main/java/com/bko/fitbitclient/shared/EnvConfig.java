package com.bko.fitbitclient.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    EnvConfig(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    /**
     * Looks up a dotted key such as {@code fitbit.client_id} as {@code FITBIT_CLIENT_ID}, first in the
     * {@code .env} file and then in the process environment.
     */
    public String get(String key) {
        String envKey = toEnvKey(key);
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        // Tokens pasted into .env often carry stray whitespace.
        return value != null ? value.trim() : null;
    }

    static String toEnvKey(String key) {
        return key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
    }
}
