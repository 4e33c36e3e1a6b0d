package io.stockingest.market;

import java.io.IOException;

/**
 * One HTTP round trip to the market-data provider for a symbol's daily series. No retries at this level.
 */
@FunctionalInterface
public interface MarketDataClient {
    ProviderResponse get(String symbol, String apiKey) throws IOException, InterruptedException;
}
