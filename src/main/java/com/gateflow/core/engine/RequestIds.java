package com.gateflow.core.engine;

import java.time.Clock;
import java.time.Year;
import java.util.Locale;
import java.util.UUID;

/**
 * Generates request ids of the form {@code GF-<yyyy>-<8 hex>}.
 */
public final class RequestIds {

    private RequestIds() {}

    public static String next() {
        return next(Clock.systemUTC());
    }

    static String next(Clock clock) {
        String hex = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "GF-" + Year.now(clock).getValue() + "-" + hex;
    }
}
