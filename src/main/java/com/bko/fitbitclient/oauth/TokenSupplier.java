package com.bko.fitbitclient.oauth;

import java.io.IOException;

/** Yields a bearer credential that is valid at the time of the call, refreshing it when needed. */
public interface TokenSupplier {
    String getAccessToken() throws IOException;
}
