package io.stockingest.market;

import io.stockingest.core.Source;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Emits the configured tickers in order, then completes.
 */
public class SymbolListSource implements Source<String> {
    private final List<String> symbols;
    private int idx = 0;

    public SymbolListSource(List<String> symbols) {
        this.symbols = normalize(symbols);
    }

    /** Trims and upper-cases tickers, dropping blanks and repeats while keeping first-seen order. */
    public static List<String> normalize(List<String> raw) {
        Set<String> seen = new LinkedHashSet<>();
        if (raw != null) {
            for (String s : raw) {
                if (s == null) continue;
                String t = s.trim().toUpperCase(Locale.ROOT);
                if (!t.isEmpty()) seen.add(t);
            }
        }
        return List.copyOf(new ArrayList<>(seen));
    }

    @Override
    public Optional<String> poll() {
        if (idx >= symbols.size()) return Optional.empty();
        return Optional.of(symbols.get(idx++));
    }

    @Override
    public boolean isFinished() {
        return idx >= symbols.size();
    }

    public int size() { return symbols.size(); }

    public int position() { return idx; }
}
