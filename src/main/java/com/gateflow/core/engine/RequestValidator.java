package com.gateflow.core.engine;

import com.gateflow.core.model.PipelineRequest;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fast-fail checks run before a pipeline touches the state store.
 */
public final class RequestValidator {

    private RequestValidator() {}

    /**
     * @throws InputValidationException listing every violation found
     */
    public static void validate(PipelineRequest request) {
        List<String> violations = violations(request);
        if (!violations.isEmpty()) {
            throw new InputValidationException(violations);
        }
    }

    public static List<String> violations(PipelineRequest request) {
        List<String> violations = new ArrayList<>();
        if (request == null) {
            violations.add("request is missing");
            return violations;
        }
        if (isBlank(request.domain())) {
            violations.add("domain must not be blank");
        } else if (!request.domain().matches(".*[A-Za-z0-9].*")) {
            violations.add("domain must contain a letter or digit");
        }
        if (isBlank(request.feature())) {
            violations.add("feature must not be blank");
        } else if (!request.feature().matches(".*[A-Za-z0-9].*")) {
            violations.add("feature must contain a letter or digit");
        }
        if (isBlank(request.userStory())) {
            violations.add("userStory must not be blank");
        }
        if (!isHttpUrl(request.url())) {
            violations.add("url must be an absolute http(s) URL");
        }
        if (request.acceptanceCriteria().isEmpty()) {
            violations.add("at least one acceptance criterion is required");
        } else if (request.acceptanceCriteria().stream().anyMatch(RequestValidator::isBlank)) {
            violations.add("acceptance criteria must not be blank");
        }
        if (request.dataRequirements().dataDriven() && request.dataRequirements().count() < 1) {
            violations.add("data-driven mode needs a record count of at least 1");
        }
        if (request.constraints().timeoutSeconds() < 0 || request.constraints().retries() < 0) {
            violations.add("constraints must not be negative");
        }
        return violations;
    }

    private static boolean isHttpUrl(String url) {
        if (isBlank(url)) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            return uri.isAbsolute()
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
