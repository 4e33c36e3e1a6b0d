package io.stockingest.market;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Decoded provider payload for one symbol, handed from the fetcher to the parser and then dropped.
 */
public record RawTimeSeriesResponse(String symbol, JsonNode payload) {
    static final String NOTE = "Note";
    static final String INFORMATION = "Information";
    static final String ERROR_MESSAGE = "Error Message";

    public RawTimeSeriesResponse {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(payload, "payload");
    }

    /** In-band throttling notice ({@code Note}, or {@code Information} on newer API versions). */
    public Optional<String> rateLimitNotice() {
        Optional<String> note = text(NOTE);
        return note.isPresent() ? note : text(INFORMATION);
    }

    public Optional<String> errorMessage() {
        return text(ERROR_MESSAGE);
    }

    private Optional<String> text(String field) {
        if (!payload.isObject()) return Optional.empty();
        JsonNode n = payload.get(field);
        if (n == null || n.isNull()) return Optional.empty();
        return Optional.of(n.isTextual() ? n.asText() : n.toString());
    }
}
