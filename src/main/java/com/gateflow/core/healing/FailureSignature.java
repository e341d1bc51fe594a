package com.gateflow.core.healing;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.TreeSet;

/**
 * Deterministic fingerprint of a failed execution run: SHA-256 over the error text and the
 * sorted set of failed test identifiers.
 * <p>
 * Two runs share a signature only when both parts match exactly; there is no fuzzy matching.
 */
public final class FailureSignature {

    private FailureSignature() {}

    public static String of(String errorText, Collection<String> failedTests) {
        var sorted = new TreeSet<String>();
        if (failedTests != null) {
            failedTests.stream().filter(t -> t != null && !t.isBlank()).map(String::trim).forEach(sorted::add);
        }
        var material = new StringBuilder(errorText != null ? errorText.trim() : "");
        for (String test : sorted) {
            material.append('\n').append(test);
        }
        return sha256(material.toString());
    }

    /**
     * Signature of an execution report. The error text is {@code error}, or the
     * {@code errors} array joined by newlines; failed tests come from {@code failedTests}.
     */
    public static String of(JsonNode executionOutput) {
        if (executionOutput == null || executionOutput.isMissingNode() || executionOutput.isNull()) {
            return of("no execution report", List.of());
        }
        return of(errorText(executionOutput), failedTests(executionOutput));
    }

    static String errorText(JsonNode output) {
        JsonNode error = output.get("error");
        if (error != null && error.isTextual()) {
            return error.asText();
        }
        var parts = new ArrayList<String>();
        for (JsonNode item : output.path("errors")) {
            parts.add(item.asText());
        }
        return String.join("\n", parts);
    }

    static List<String> failedTests(JsonNode output) {
        var tests = new ArrayList<String>();
        for (JsonNode item : output.path("failedTests")) {
            tests.add(item.isTextual() ? item.asText() : item.path("id").asText());
        }
        return tests;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
