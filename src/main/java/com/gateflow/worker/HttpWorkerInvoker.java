package com.gateflow.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Calls workers over HTTP: {@code POST {baseUrl}/workers/{worker}} with the request as JSON.
 * A non-2xx status, a timeout or an unparseable body is an invocation failure.
 */
public class HttpWorkerInvoker implements WorkerInvoker {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerInvoker.class);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpWorkerInvoker(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper);
    }

    HttpWorkerInvoker(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkerResponse invoke(WorkerRequest request, Duration timeout) {
        String worker = request.worker();
        String body = WorkerPayloads.encode(objectMapper, request);
        var httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/workers/" + worker))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("POST {} ({} bytes, timeout {}s)", httpRequest.uri(), body.length(), timeout.toSeconds());
        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new WorkerInvocationException(worker, worker + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new WorkerInvocationException(worker, worker + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerInvocationException(worker, worker + " call interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new WorkerInvocationException(worker, worker + " returned HTTP " + response.statusCode());
        }
        return WorkerPayloads.decode(objectMapper, worker, response.body());
    }
}
