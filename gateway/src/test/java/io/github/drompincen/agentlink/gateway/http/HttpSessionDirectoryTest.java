package io.github.drompincen.agentlink.gateway.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpSessionDirectoryTest {

    @Mock private HttpClient httpClient;
    @Mock private HttpResponse<String> response;

    private HttpSessionDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new HttpSessionDirectory(httpClient, new ObjectMapper(), "http://localhost:8765/");
    }

    @Test
    void returnsSessionIdFromBackend() throws Exception {
        when(response.statusCode()).thenReturn(201);
        when(response.body()).thenReturn("{\"session_id\":\"abc\"}");
        doReturn(response).when(httpClient).send(any(), any());

        assertThat(directory.createSession()).contains("abc");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri()).isEqualTo(URI.create("http://localhost:8765/api/sessions"));
        assertThat(request.getValue().method()).isEqualTo("POST");
    }

    @Test
    void fallsBackToIdField() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"id\":\"xyz\"}");
        doReturn(response).when(httpClient).send(any(), any());

        assertThat(directory.createSession()).contains("xyz");
    }

    @Test
    void errorStatusYieldsEmpty() throws Exception {
        when(response.statusCode()).thenReturn(503);
        doReturn(response).when(httpClient).send(any(), any());

        assertThat(directory.createSession()).isEmpty();
    }

    @Test
    void unreachableBackendYieldsEmpty() throws Exception {
        doThrow(new IOException("Connection refused")).when(httpClient).send(any(), any());

        assertThat(directory.createSession()).isEmpty();
    }
}
