package io.stockingest.market;

/** Status and body of one provider HTTP exchange. */
public record ProviderResponse(int statusCode, String body) {}
