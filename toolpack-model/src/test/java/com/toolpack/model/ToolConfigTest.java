package com.toolpack.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolConfigTest {

    private static final String SAMPLE_CONFIG_JSON = """
            {
              "name": "weather",
              "description": "Current weather for a city",
              "meta": { "author": "alice", "version": "1.2.0", "homepage": "https://example.com" },
              "build": { "entry": "weather.jar", "module": "com.example.weather.WeatherTool" }
            }
            """;

    @Test
    void fromJson_parsesNestedSectionsAndIgnoresUnknownKeys() {
        ToolConfig config = ToolJson.fromJson(SAMPLE_CONFIG_JSON, ToolConfig.class);

        assertEquals("weather", config.getName());
        assertEquals("alice", config.getMeta().getAuthor());
        assertEquals("1.2.0", config.getMeta().getVersion());
        assertEquals("weather.jar", config.getBuild().getEntry());
        assertEquals("com.example.weather.WeatherTool", config.getBuild().getModule());
        assertNull(config.getLicense());
    }

    @Test
    void toMetadata_appliesDefaultsForMissingValues() {
        ToolMetadata metadata = ToolJson.fromJson("{\"name\":\"draft\"}", ToolConfig.class).toMetadata();

        assertEquals("draft", metadata.getName());
        assertNull(metadata.getAuthor());
        assertNull(metadata.getVersion());
        assertEquals("Unknown", metadata.getLicense());
        assertEquals("tool.jar", metadata.getEntry());
        assertEquals("Tool", metadata.getModule());
    }

    @Test
    void of_mirrorsMetadataAsConfigMap() {
        ToolMetadata metadata = new ToolMetadata("bob", "calc", "2.0.0", "MIT", "calc.jar", "Calc");

        Map<String, Object> map = ToolJson.toMap(ToolConfig.of(metadata));

        assertEquals("calc", map.get("name"));
        assertEquals("MIT", map.get("license"));
        assertEquals(Map.of("author", "bob", "version", "2.0.0"), map.get("meta"));
        assertEquals(Map.of("entry", "calc.jar", "module", "Calc"), map.get("build"));
    }

    @Test
    void empty_hasEmptySections() {
        ToolConfig config = ToolConfig.empty();

        assertNull(config.getMeta().getAuthor());
        assertNull(config.getBuild().getEntry());
        assertTrue(ToolJson.toMap(config).containsKey("meta"));
    }
}
