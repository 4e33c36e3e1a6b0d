package io.stockingest.market;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Alpha Vantage style query endpoint. The {@link HttpClient} is shared for the whole process so connections
 * are reused across symbols.
 */
public final class HttpMarketDataClient implements MarketDataClient {
    private final HttpClient http;
    private final String baseUrl;
    private final String function;
    private final String outputSize;
    private final Duration timeout;

    public HttpMarketDataClient(HttpClient http, String baseUrl, String function, String outputSize, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.function = function;
        this.outputSize = outputSize;
        this.timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
    }

    @Override
    public ProviderResponse get(String symbol, String apiKey) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uriFor(symbol, apiKey))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new ProviderResponse(resp.statusCode(), resp.body());
    }

    URI uriFor(String symbol, String apiKey) {
        String sep = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + sep
                + "function=" + enc(function)
                + "&symbol=" + enc(symbol)
                + "&outputsize=" + enc(outputSize)
                + "&apikey=" + enc(apiKey));
    }

    private static String enc(String v) {
        return URLEncoder.encode(v == null ? "" : v, StandardCharsets.UTF_8);
    }
}
