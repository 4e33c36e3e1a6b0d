package io.stockingest.market;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Validates the overall shape of a provider payload and wraps its time-series object in a lazily
 * evaluated {@link ParsedSeries}. Stateless.
 */
public class TimeSeriesParser {
    private static final Logger log = LoggerFactory.getLogger(TimeSeriesParser.class);

    static final String SERIES_PREFIX = "Time Series";
    static final String META_DATA = "Meta Data";

    public ParsedSeries parse(String symbol, RawTimeSeriesResponse response) throws UnexpectedResponseShapeException {
        JsonNode payload = response.payload();
        if (!payload.isObject()) {
            throw new UnexpectedResponseShapeException("Expected a JSON object for " + symbol + " but got " + payload.getNodeType());
        }

        JsonNode series = null;
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (f.getKey().startsWith(SERIES_PREFIX)) {
                series = f.getValue();
                break;
            }
        }
        if (series == null) {
            throw new UnexpectedResponseShapeException("No time series found for " + symbol + describe(response));
        }
        if (!series.isObject()) {
            throw new UnexpectedResponseShapeException("Time series for " + symbol + " is a " + series.getNodeType() + ", not an object");
        }
        return new ParsedSeries(symbol, series, zoneOf(payload));
    }

    private static String describe(RawTimeSeriesResponse response) {
        if (response.errorMessage().isPresent()) return "; provider error: " + response.errorMessage().get();
        if (response.rateLimitNotice().isPresent()) return "; provider notice: " + response.rateLimitNotice().get();
        List<String> keys = new ArrayList<>();
        response.payload().fieldNames().forEachRemaining(k -> { if (keys.size() < 5) keys.add(k); });
        return "; keys: " + keys;
    }

    /** Time zone advertised in the payload's metadata block, else UTC. */
    static ZoneId zoneOf(JsonNode payload) {
        JsonNode meta = payload.get(META_DATA);
        if (meta != null && meta.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = meta.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> f = it.next();
                if (f.getKey().endsWith("Time Zone") && f.getValue().isTextual()) {
                    try {
                        return ZoneId.of(f.getValue().asText().trim());
                    } catch (DateTimeException e) {
                        log.warn("Ignoring unknown time zone '{}' in metadata", f.getValue().asText());
                    }
                }
            }
        }
        return ZoneOffset.UTC;
    }
}
