package com.mimecast.phishguard.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeywordsConfig.
 */
class KeywordsConfigTest {

    @Test
    void testDefaultValues() {
        KeywordsConfig config = new KeywordsConfig();

        assertEquals("2024.1", config.getVersion(), "Default version should be 2024.1");
        assertEquals(20, config.getSuspiciousKeywords().size(), "Default suspicious list should have 20 phrases");
        assertEquals(10, config.getTrustKeywords().size(), "Default trust list should have 10 phrases");
        assertEquals(9, config.getSuspiciousDomains().size(), "Default domain list should have 9 suffixes");
        assertEquals("verify your account", config.getSuspiciousKeywords().get(0), "Order should be preserved");
        assertTrue(config.getSuspiciousDomains().contains(".tk"), "Domains should contain .tk");
    }

    @Test
    void testCustomListsReplaceDefaults() {
        Map<String, Object> map = new HashMap<>();
        map.put("version", "custom");
        map.put("trust", new ArrayList<>(List.of("Team Update", "team update", "", "roadmap")));
        map.put("suspiciousDomains", new ArrayList<>(List.of(".ZIP")));

        KeywordsConfig config = new KeywordsConfig(map);

        assertEquals("custom", config.getVersion(), "Version should be custom");
        assertEquals(List.of("team update", "roadmap"), config.getTrustKeywords(),
                "Trust list should be normalized and deduplicated in order");
        assertEquals(List.of(".zip"), config.getSuspiciousDomains(), "Domains should be lower-cased");
        assertEquals(KeywordsConfig.DEFAULT_SUSPICIOUS, config.getSuspiciousKeywords(),
                "Missing suspicious list should use default");
    }

    @Test
    void testNullEntriesSkipped() {
        Map<String, Object> map = new HashMap<>();
        map.put("suspicious", new ArrayList<>(Arrays.asList("gift card", null)));

        KeywordsConfig config = new KeywordsConfig(map);

        assertEquals(List.of("gift card"), config.getSuspiciousKeywords(), "Null entries should be skipped");
    }

    @Test
    void testListsAreUnmodifiable() {
        Map<String, Object> map = new HashMap<>();
        map.put("trust", new ArrayList<>(List.of("roadmap")));

        KeywordsConfig config = new KeywordsConfig(map);

        assertThrows(UnsupportedOperationException.class, () -> config.getTrustKeywords().add("x"),
                "Configured list should be unmodifiable");
        assertThrows(UnsupportedOperationException.class, () -> config.getSuspiciousKeywords().add("x"),
                "Default list should be unmodifiable");
    }
}
