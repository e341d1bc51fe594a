package com.gateflow.core.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateflow.core.model.AuthType;
import com.gateflow.core.model.DataMode;
import com.gateflow.core.model.PipelineRequest;
import com.gateflow.core.model.TestTarget;
import com.gateflow.core.persistence.StateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether raw input is a pipeline request and normalises it.
 * <p>
 * Two input shapes are understood:
 * <ul>
 *   <li>a JSON object with the request fields</li>
 *   <li>free text with an {@code http(s)} URL, a user story, acceptance criteria as bullet or
 *       numbered lines, and optional {@code domain:}, {@code feature:}, {@code target:} and
 *       {@code browsers:} lines</li>
 * </ul>
 * A request needs a URL, a user story and at least one acceptance criterion. Missing domain
 * and feature names are derived from the URL host and the user story. The classifier does not
 * validate the request; the coordinator does that before any state is written.
 */
@Service
public class RequestClassifier {

    private static final Logger log = LoggerFactory.getLogger(RequestClassifier.class);

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s\"'<>]+");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+(.+)$");
    private static final Pattern KEY_VALUE = Pattern.compile("^\\s*([A-Za-z ]+?)\\s*:\\s*(.+)$");
    private static final Pattern USER_STORY = Pattern.compile("(?i)\\bas an?\\b.+\\bi want\\b.*");
    private static final Pattern WANT_CLAUSE = Pattern.compile("(?i)\\bi want (?:to )?(.+?)(?:\\bso that\\b|[.,]|$)");

    private final ObjectMapper objectMapper = StateCodec.objectMapper();

    public ClassificationResult classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return ClassificationResult.rejected("input is empty", List.of("url", "userStory", "acceptanceCriteria"));
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            try {
                return fromJson(objectMapper.readTree(trimmed));
            } catch (JsonProcessingException e) {
                log.debug("Input looks like JSON but does not parse, treating as text: {}", e.getOriginalMessage());
            }
        }
        return fromText(trimmed);
    }

    private ClassificationResult fromJson(JsonNode json) {
        String url = text(json, "url");
        String userStory = text(json, "userStory");
        List<String> criteria = new ArrayList<>();
        for (JsonNode item : json.path("acceptanceCriteria")) {
            if (!item.asText().isBlank()) {
                criteria.add(item.asText().trim());
            }
        }

        JsonNode data = json.path("dataRequirements");
        var dataRequirements = data.isObject()
                ? new PipelineRequest.DataRequirements(
                        enumValue(DataMode.class, firstText(data, "mode", "type"), DataMode.SINGLE),
                        data.path("count").asInt(1),
                        data.hasNonNull("seed") ? data.get("seed").asLong() : null)
                : null;

        JsonNode constraintsNode = json.path("constraints");
        PipelineRequest.Constraints constraints = null;
        if (constraintsNode.isObject()) {
            List<String> browsers = new ArrayList<>();
            constraintsNode.path("browsers").forEach(b -> browsers.add(b.asText().toLowerCase(Locale.ROOT)));
            constraints = new PipelineRequest.Constraints(
                    constraintsNode.path("timeoutSeconds").asInt(30),
                    constraintsNode.path("retries").asInt(0),
                    browsers);
        }

        JsonNode authNode = json.path("authentication");
        var authentication = authNode.isObject()
                ? new PipelineRequest.Authentication(
                        enumValue(AuthType.class, text(authNode, "type"), AuthType.NONE),
                        text(authNode, "credentialsRef"))
                : null;

        return build(text(json, "domain"), text(json, "feature"), url, userStory, criteria,
                dataRequirements, constraints, authentication,
                enumValue(TestTarget.class, text(json, "testTarget"), TestTarget.GUI));
    }

    private ClassificationResult fromText(String text) {
        String url = null;
        Matcher urlMatcher = URL_PATTERN.matcher(text);
        if (urlMatcher.find()) {
            url = stripTrailingPunctuation(urlMatcher.group());
        }

        String domain = null;
        String feature = null;
        String userStory = null;
        TestTarget target = TestTarget.GUI;
        List<String> browsers = new ArrayList<>();
        List<String> criteria = new ArrayList<>();

        for (String line : text.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Matcher bullet = BULLET.matcher(line);
            if (bullet.matches()) {
                criteria.add(bullet.group(1).trim());
                continue;
            }
            Matcher keyValue = KEY_VALUE.matcher(line);
            if (keyValue.matches()) {
                String key = keyValue.group(1).trim().toLowerCase(Locale.ROOT);
                String value = keyValue.group(2).trim();
                switch (key) {
                    case "domain" -> domain = value;
                    case "feature" -> feature = value;
                    case "target", "test target" -> target = enumValue(TestTarget.class, value, TestTarget.GUI);
                    case "browsers", "browser" -> {
                        for (String b : value.split("[,\\s]+")) {
                            if (!b.isBlank()) {
                                browsers.add(b.toLowerCase(Locale.ROOT));
                            }
                        }
                    }
                    case "user story", "story" -> userStory = value;
                    default -> { }
                }
                if (userStory == null && USER_STORY.matcher(value).find()) {
                    userStory = value;
                }
                continue;
            }
            if (userStory == null && USER_STORY.matcher(line).find()) {
                userStory = line.trim();
            }
        }

        var constraints = browsers.isEmpty() ? null
                : new PipelineRequest.Constraints(30, 0, browsers);
        return build(domain, feature, url, userStory, criteria, null, constraints, null, target);
    }

    private ClassificationResult build(String domain, String feature, String url, String userStory,
                                       List<String> criteria,
                                       PipelineRequest.DataRequirements dataRequirements,
                                       PipelineRequest.Constraints constraints,
                                       PipelineRequest.Authentication authentication,
                                       TestTarget target) {
        List<String> missing = new ArrayList<>();
        if (url == null || url.isBlank()) {
            missing.add("url");
        }
        if (userStory == null || userStory.isBlank()) {
            missing.add("userStory");
        }
        if (criteria.isEmpty()) {
            missing.add("acceptanceCriteria");
        }
        if (!missing.isEmpty()) {
            log.info("Input is not a pipeline request; missing {}", missing);
            return ClassificationResult.rejected("not a pipeline request: missing " + String.join(", ", missing),
                    missing);
        }

        String resolvedDomain = domain != null && !domain.isBlank() ? domain : domainFromUrl(url);
        String resolvedFeature = feature != null && !feature.isBlank() ? feature : featureFromStory(userStory);
        var request = new PipelineRequest(null, resolvedDomain, resolvedFeature, url, userStory, criteria,
                dataRequirements, constraints, authentication, target);
        return ClassificationResult.accepted(request, "pipeline request for " + resolvedDomain + "/" + resolvedFeature);
    }

    /**
     * First host label that is not {@code www}, e.g. {@code docsearch} for
     * {@code https://www.docsearch.example.com/login}.
     */
    static String domainFromUrl(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null || host.isBlank()) {
                return "app";
            }
            for (String label : host.split("\\.")) {
                if (!label.equalsIgnoreCase("www") && !label.isBlank()) {
                    return label.toLowerCase(Locale.ROOT);
                }
            }
            return host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "app";
        }
    }

    /**
     * First four words of the "I want ..." clause, or of the story itself.
     */
    static String featureFromStory(String userStory) {
        Matcher want = WANT_CLAUSE.matcher(userStory);
        String source = want.find() ? want.group(1) : userStory;
        String[] words = source.trim().split("[^A-Za-z0-9]+");
        var picked = new ArrayList<String>();
        for (String word : words) {
            if (!word.isBlank()) {
                picked.add(word.toLowerCase(Locale.ROOT));
            }
            if (picked.size() == 4) {
                break;
            }
        }
        return picked.isEmpty() ? "feature" : String.join("-", picked);
    }

    private static String stripTrailingPunctuation(String url) {
        return url.replaceAll("[.,;:)\\]]+$", "");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() && !value.asText().isBlank() ? value.asText().trim() : null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, E fallback) {
        if (value == null) {
            return fallback;
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalised)) {
                return constant;
            }
        }
        return fallback;
    }
}
