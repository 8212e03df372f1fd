package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FitbitRequestExecutorTest {
    private static final String PROFILE_URL = "https://api.fitbit.com/1/user/-/profile.json";

    private final CloseableHttpClient httpClient = mock(CloseableHttpClient.class);
    private final FitbitRequestExecutor executor = new FitbitRequestExecutor(httpClient, new ObjectMapper());
    private final ClassicHttpRequest request = ClassicRequestBuilder.get(PROFILE_URL).build();

    @Test
    void successfulResponseIsDecodedAndClosed() throws Exception {
        ClassicHttpResponse response = responseWith(200, "{\"user\":{\"fullName\":\"Jane Doe\",\"age\":40}}");

        UserProfile profile = executor.execute(request, UserProfile.class);

        assertEquals("Jane Doe", profile.user().fullName());
        assertEquals(40, profile.user().age());
        verify(response, times(1)).close();
    }

    @Test
    void statusOutsideSuccessRangeIsRequestFailed() throws Exception {
        ClassicHttpResponse response = responseWith(404, "{\"errors\":[{\"errorType\":\"not_found\"}]}");
        when(response.getReasonPhrase()).thenReturn("Not Found");

        RequestFailedException e = assertThrows(RequestFailedException.class,
                () -> executor.execute(request, UserProfile.class));

        assertEquals(404, e.getStatusCode());
        assertEquals("Not Found", e.getReasonPhrase());
        assertEquals("GET", e.getMethod());
        assertEquals(PROFILE_URL, e.getUri().toString());
        assertEquals("{\"errors\":[{\"errorType\":\"not_found\"}]}", e.getBody());
        verify(response, times(1)).close();
    }

    @Test
    void redirectAndInformationalStatusesAreRequestFailed() throws Exception {
        responseWith(302, "");
        assertEquals(302, assertThrows(RequestFailedException.class,
                () -> executor.execute(request, UserProfile.class)).getStatusCode());

        responseWith(199, "");
        assertEquals(199, assertThrows(RequestFailedException.class,
                () -> executor.execute(request, UserProfile.class)).getStatusCode());
    }

    @Test
    void edgesOfSuccessRangeAreAccepted() throws Exception {
        responseWith(299, "{\"user\":{\"fullName\":\"Edge\"}}");

        assertEquals("Edge", executor.execute(request, UserProfile.class).user().fullName());
    }

    @Test
    void malformedBodyIsDecodeErrorAndResponseIsStillClosed() throws Exception {
        ClassicHttpResponse response = responseWith(200, "<html>not json</html>");

        assertThrows(DecodeException.class, () -> executor.execute(request, UserProfile.class));
        verify(response, times(1)).close();
    }

    @Test
    void mismatchedShapeIsDecodeError() throws Exception {
        responseWith(200, "{\"user\":{\"age\":\"forty\"}}");

        assertThrows(DecodeException.class, () -> executor.execute(request, UserProfile.class));
    }

    @Test
    void nullResponseTypeDiscardsBody() throws Exception {
        ClassicHttpResponse response = responseWith(204, "");

        assertNull(executor.execute(request, null));
        verify(response, times(1)).close();
    }

    @Test
    void sendFailureIsTransportError() throws Exception {
        when(httpClient.executeOpen(any(), any(), any())).thenThrow(new ConnectException("Connection refused"));

        TransportException e = assertThrows(TransportException.class,
                () -> executor.execute(request, UserProfile.class));

        assertInstanceOf(ConnectException.class, e.getCause());
    }

    private ClassicHttpResponse responseWith(int status, String body) throws IOException {
        ClassicHttpResponse response = mock(ClassicHttpResponse.class);
        when(response.getCode()).thenReturn(status);
        when(response.getEntity()).thenReturn(new StringEntity(body, ContentType.APPLICATION_JSON));
        when(httpClient.executeOpen(any(), any(), any())).thenReturn(response);
        return response;
    }
}
