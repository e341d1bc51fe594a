package com.gateflow.core.persistence;

import com.gateflow.core.model.Gate;

import java.util.Locale;

/**
 * Record keys derived from (domain, feature).
 * <p>
 * Both parts are slugged (lower case, runs of non-alphanumerics collapsed to a dash) so the
 * same feature always maps to the same records regardless of how it was spelled in the request.
 */
public final class StateKeys {

    public static final String PIPELINE_SUFFIX = "-pipeline";

    private StateKeys() {}

    public static String prefix(String domain, String feature) {
        return slug(domain) + "-" + slug(feature);
    }

    public static String pipeline(String domain, String feature) {
        return prefix(domain, feature) + PIPELINE_SUFFIX;
    }

    public static String gateOutput(String domain, String feature, Gate gate) {
        return prefix(domain, feature) + "-gate" + gate.index() + "-output";
    }

    public static String healing(String domain, String feature) {
        return prefix(domain, feature) + "-gate" + Gate.EXECUTION.index() + "-healing";
    }

    public static String audit(String domain, String feature) {
        return prefix(domain, feature) + "-audit";
    }

    public static String learnings(String domain, String feature) {
        return prefix(domain, feature) + "-learnings";
    }

    public static String slug(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Key part must not be blank");
        }
        String slug = value.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Key part has no alphanumeric characters: " + value);
        }
        return slug;
    }
}
