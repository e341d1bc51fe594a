package com.gateflow.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateflow.core.persistence.StateCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HttpWorkerInvokerTest {

    private final ObjectMapper mapper = StateCodec.objectMapper();
    private HttpClient httpClient;
    private HttpResponse<String> httpResponse;
    private HttpWorkerInvoker invoker;
    private WorkerRequest request;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        httpResponse = mock(HttpResponse.class);
        invoker = new HttpWorkerInvoker("http://workers:8090/", httpClient, mapper);
        request = new WorkerRequest(new WorkerRequest.Metadata("GF-1", "docsearch", "login", "https://x"),
                1, "test-case-designer", mapper.createObjectNode(), mapper.createObjectNode());
    }

    @Test
    void postsToTheWorkerEndpoint() throws Exception {
        doReturn(httpResponse).when(httpClient).send(any(), any());
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("{\"status\": \"SUCCESS\", \"output\": {\"testCases\": []}}");

        var response = invoker.invoke(request, Duration.ofSeconds(45));

        assertEquals(WorkerResponse.SUCCESS, response.status());
        ArgumentCaptor<HttpRequest> sent = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(sent.capture(), any());
        assertEquals("http://workers:8090/workers/test-case-designer", sent.getValue().uri().toString());
        assertEquals("POST", sent.getValue().method());
        assertEquals(Duration.ofSeconds(45), sent.getValue().timeout().orElseThrow());
    }

    @Test
    void non2xxIsAnInvocationFailure() throws Exception {
        doReturn(httpResponse).when(httpClient).send(any(), any());
        when(httpResponse.statusCode()).thenReturn(502);

        var e = assertThrows(WorkerInvocationException.class, () -> invoker.invoke(request, Duration.ofSeconds(5)));
        assertEquals("test-case-designer returned HTTP 502", e.getMessage());
    }

    @Test
    void timeoutIsReported() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(), any());

        var e = assertThrows(WorkerInvocationException.class, () -> invoker.invoke(request, Duration.ofSeconds(5)));
        assertEquals("test-case-designer timed out after 5s", e.getMessage());
    }

    @Test
    void unreachableWorkerIsReported() throws Exception {
        doThrow(new ConnectException("Connection refused")).when(httpClient).send(any(), any());

        var e = assertThrows(WorkerInvocationException.class, () -> invoker.invoke(request, Duration.ofSeconds(5)));
        assertTrue(e.getMessage().startsWith("test-case-designer unreachable"));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
