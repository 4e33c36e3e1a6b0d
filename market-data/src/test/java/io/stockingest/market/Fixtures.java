package io.stockingest.market;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/** Provider payloads for tests, in the shape of the daily adjusted endpoint. */
final class Fixtures {
    private Fixtures() {}

    static String resource(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Entry object; null arguments leave the field out. */
    static String entry(String open, String high, String low, String close, String volume) {
        StringJoiner j = new StringJoiner(",", "{", "}");
        if (open != null) j.add("\"1. open\":\"" + open + "\"");
        if (high != null) j.add("\"2. high\":\"" + high + "\"");
        if (low != null) j.add("\"3. low\":\"" + low + "\"");
        if (close != null) j.add("\"4. close\":\"" + close + "\"");
        if (volume != null) j.add("\"6. volume\":\"" + volume + "\"");
        return j.toString();
    }

    /** Full payload from raw entry JSON keyed by date key. */
    static String series(Map<String, String> entries) {
        StringJoiner j = new StringJoiner(",", "{", "}");
        entries.forEach((k, v) -> j.add("\"" + k + "\":" + v));
        return "{\"Meta Data\":{\"2. Symbol\":\"TEST\"},\"Time Series (Daily)\":" + j + "}";
    }

    /** {@code days} consecutive calendar days starting at {@code start}, all with the given close. */
    static Map<String, String> days(LocalDate start, int days, String close) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < days; i++) {
            out.put(start.plusDays(i).toString(), entry("10.0", "11.0", "9.5", close, String.valueOf(1_000 + i)));
        }
        return out;
    }

    static String rateLimitNote() {
        return "{\"Note\":\"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute and 500 calls per day.\"}";
    }

    static String errorMessage() {
        return "{\"Error Message\":\"Invalid API call. Please retry or visit the documentation for TIME_SERIES_DAILY_ADJUSTED.\"}";
    }
}
