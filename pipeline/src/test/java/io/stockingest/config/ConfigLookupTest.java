package io.stockingest.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLookupTest {
    @AfterEach
    void clearProps() {
        System.clearProperty("test.lookup.value");
    }

    @Test
    void system_property_wins_over_env() {
        ConfigLookup lookup = new ConfigLookup(Map.of("LOOKUP_VALUE", "from-env"));
        assertEquals("from-env", lookup.get("test.lookup.value", "LOOKUP_VALUE", "dflt"));
        System.setProperty("test.lookup.value", "from-prop");
        assertEquals("from-prop", lookup.get("test.lookup.value", "LOOKUP_VALUE", "dflt"));
    }

    @Test
    void falls_back_to_default_for_blank_values() {
        ConfigLookup lookup = new ConfigLookup(Map.of("LOOKUP_VALUE", "  "));
        assertEquals("dflt", lookup.get("test.lookup.value", "LOOKUP_VALUE", "dflt"));
        assertEquals(7, lookup.getInt("test.lookup.value", "LOOKUP_VALUE", 7));
    }

    @Test
    void splits_lists_and_drops_blanks() {
        ConfigLookup lookup = new ConfigLookup(Map.of("LOOKUP_VALUE", " AAPL, ,MSFT,"));
        assertEquals(List.of("AAPL", "MSFT"), lookup.getList("test.lookup.value", "LOOKUP_VALUE", "SPY"));
    }

    @Test
    void rejects_malformed_numbers() {
        ConfigLookup lookup = new ConfigLookup(Map.of("LOOKUP_VALUE", "twelve"));
        assertThrows(IllegalStateException.class, () -> lookup.getDouble("test.lookup.value", "LOOKUP_VALUE", 12.0));
    }
}
