package io.stockingest.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One normalized daily bar, the unit persisted to {@code stock_data}. Price and volume fields are null when
 * the provider omitted them or sent something non-numeric. {@code raw} is the provider's JSON for that date.
 */
public record StockRow(String symbol,
                       OffsetDateTime ts,
                       BigDecimal open,
                       BigDecimal high,
                       BigDecimal low,
                       BigDecimal close,
                       Long volume,
                       String raw) {
    public StockRow {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(ts, "ts");
        if (symbol.isBlank()) throw new IllegalArgumentException("symbol must not be blank");
        if (volume != null && volume < 0) throw new IllegalArgumentException("volume must not be negative: " + volume);
    }

    /** Identity of the row in the store. */
    public Key key() { return new Key(symbol, ts.toInstant()); }

    public record Key(String symbol, Instant ts) {}
}
