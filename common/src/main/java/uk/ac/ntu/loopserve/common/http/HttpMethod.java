package uk.ac.ntu.loopserve.common.http;

import java.util.Locale;
import java.util.Optional;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    public boolean hasBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    public static Optional<HttpMethod> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
