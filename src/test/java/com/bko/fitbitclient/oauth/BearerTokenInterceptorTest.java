package com.bko.fitbitclient.oauth;

import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BearerTokenInterceptorTest {

    @Test
    void setsAuthorizationHeaderFromSupplier() throws Exception {
        TokenSupplier supplier = mock(TokenSupplier.class);
        when(supplier.getAccessToken()).thenReturn("first", "second");
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(supplier);
        ClassicHttpRequest request = ClassicRequestBuilder.get("https://api.fitbit.com/1/user/-/profile.json").build();

        interceptor.process(request, null, null);
        assertEquals("Bearer first", request.getFirstHeader(HttpHeaders.AUTHORIZATION).getValue());

        interceptor.process(request, null, null);
        assertEquals("Bearer second", request.getFirstHeader(HttpHeaders.AUTHORIZATION).getValue());
        assertEquals(1, request.getHeaders(HttpHeaders.AUTHORIZATION).length);
    }

    @Test
    void supplierFailurePropagates() throws Exception {
        TokenSupplier supplier = mock(TokenSupplier.class);
        when(supplier.getAccessToken()).thenThrow(new TokenRefreshException("expired"));
        BearerTokenInterceptor interceptor = new BearerTokenInterceptor(supplier);
        ClassicHttpRequest request = ClassicRequestBuilder.get("https://api.fitbit.com/1/user/-/profile.json").build();

        assertThrows(TokenRefreshException.class, () -> interceptor.process(request, null, null));
    }
}
