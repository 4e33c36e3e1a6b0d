package io.stockingest.market;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Rows of one symbol's time series, produced on demand. Each call to {@link #iterator()} walks the series
 * again from the start. Entries whose date key does not parse, or whose value is not an object, are left
 * out and reported through {@link #skipped()}; a missing or non-numeric price or volume only nulls that field.
 */
public final class ParsedSeries implements Iterable<StockRow> {
    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    // "1. open" -> "open"
    private static final Pattern ORDINAL_PREFIX = Pattern.compile("^\\d+\\.\\s*");

    private final String symbol;
    private final JsonNode series;
    private final ZoneId zone;
    private List<SkippedEntry> skipped;

    ParsedSeries(String symbol, JsonNode series, ZoneId zone) {
        this.symbol = symbol;
        this.series = series;
        this.zone = zone;
    }

    public String symbol() { return symbol; }

    public ZoneId zone() { return zone; }

    /** Number of entries in the series, valid or not. */
    public int entryCount() { return series.size(); }

    public synchronized List<SkippedEntry> skipped() {
        if (skipped == null) {
            List<SkippedEntry> out = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> it = series.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String reason = rejectReason(e.getKey(), e.getValue());
                if (reason != null) out.add(new SkippedEntry(e.getKey(), reason));
            }
            skipped = List.copyOf(out);
        }
        return skipped;
    }

    public int skippedCount() { return skipped().size(); }

    public List<StockRow> toList() {
        List<StockRow> out = new ArrayList<>(series.size());
        for (StockRow r : this) out.add(r);
        return out;
    }

    @Override
    public Iterator<StockRow> iterator() {
        Iterator<Map.Entry<String, JsonNode>> entries = series.fields();
        return new Iterator<>() {
            private StockRow next;

            @Override
            public boolean hasNext() {
                while (next == null && entries.hasNext()) {
                    Map.Entry<String, JsonNode> e = entries.next();
                    if (rejectReason(e.getKey(), e.getValue()) == null) {
                        next = toRow(e.getKey(), e.getValue());
                    }
                }
                return next != null;
            }

            @Override
            public StockRow next() {
                if (!hasNext()) throw new NoSuchElementException();
                StockRow r = next;
                next = null;
                return r;
            }
        };
    }

    private String rejectReason(String key, JsonNode value) {
        if (value == null || !value.isObject()) {
            return "entry is " + (value == null ? "missing" : value.getNodeType().toString().toLowerCase(Locale.ROOT)) + ", not an object";
        }
        if (parseTimestamp(key) == null) {
            return "unparsable date key";
        }
        return null;
    }

    private StockRow toRow(String key, JsonNode entry) {
        BigDecimal open = null, high = null, low = null, close = null;
        Long volume = null;
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            switch (fieldName(f.getKey())) {
                case "open" -> open = decimal(f.getValue());
                case "high" -> high = decimal(f.getValue());
                case "low" -> low = decimal(f.getValue());
                case "close" -> close = decimal(f.getValue());
                case "volume" -> volume = volume(f.getValue());
                default -> { }
            }
        }
        return new StockRow(symbol, parseTimestamp(key), open, high, low, close, volume, entry.toString());
    }

    OffsetDateTime parseTimestamp(String key) {
        if (key == null) return null;
        String k = key.trim();
        try {
            if (k.length() == 10) {
                return LocalDate.parse(k, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(zone).toOffsetDateTime();
            }
            return LocalDateTime.parse(k, DATE_TIME).atZone(zone).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String fieldName(String key) {
        return ORDINAL_PREFIX.matcher(key.trim()).replaceFirst("").toLowerCase(Locale.ROOT);
    }

    static BigDecimal decimal(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.decimalValue();
        if (!n.isTextual()) return null;
        String t = n.asText().trim();
        if (t.isEmpty()) return null;
        try {
            return new BigDecimal(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Long volume(JsonNode n) {
        BigDecimal d = decimal(n);
        if (d == null || d.signum() < 0) return null;
        try {
            return d.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
