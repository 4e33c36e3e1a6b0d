package io.stockingest.market;

/** A series entry the parser could not turn into a row. */
public record SkippedEntry(String dateKey, String reason) {}
