package org.readacademy.engine.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigTest {

    @Test
    void unsetKeysFallBackToDefaults() {
        EngineConfig config = EngineConfig.fromSource(key -> null);

        assertEquals(EngineConfig.StoreMode.MEMORY, config.getStoreMode());
        assertEquals(EngineConfig.DEFAULT_CALLBACK_PORT, config.getCallbackPort());
        assertEquals(EngineConfig.DEFAULT_ALLOCATION_INTERVAL, config.getAllocationIntervalSeconds());
        assertEquals(EngineConfig.DEFAULT_CALENDAR_FILE, config.getCalendarFile());
        assertTrue(config.isSchedulerEnabled());
        assertFalse(config.isFileLoggingEnabled());
    }

    @Test
    void environmentValuesAreApplied() {
        Map<String, String> env = new HashMap<>();
        env.put("STORE_MODE", "rest");
        env.put("STORE_BASE_URL", "http://store:9000");
        env.put("STORE_API_KEY", "secret");
        env.put("ENGINE_CALLBACK_PORT", "9090");
        env.put("ALLOCATION_INTERVAL_SECONDS", "15");
        env.put("ALLOCATION_SCHEDULER_ENABLED", "false");
        env.put("CALENDAR_CONFIG_FILE", "/etc/academy/calendar.json");
        env.put("ENGINE_FILE_LOGGING_ENABLED", "1");

        EngineConfig config = EngineConfig.fromSource(env::get);

        assertEquals(EngineConfig.StoreMode.REST, config.getStoreMode());
        assertEquals("http://store:9000", config.getStoreBaseUrl());
        assertEquals("secret", config.getStoreApiKey());
        assertEquals(9090, config.getCallbackPort());
        assertEquals(15, config.getAllocationIntervalSeconds());
        assertFalse(config.isSchedulerEnabled());
        assertEquals("/etc/academy/calendar.json", config.getCalendarFile());
        assertTrue(config.isFileLoggingEnabled());
    }

    @Test
    void malformedValuesUseDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put("ENGINE_CALLBACK_PORT", "eighty");
        env.put("STORE_MODE", "postgres");

        EngineConfig config = EngineConfig.fromSource(env::get);

        assertEquals(EngineConfig.DEFAULT_CALLBACK_PORT, config.getCallbackPort());
        assertEquals(EngineConfig.StoreMode.MEMORY, config.getStoreMode());
    }

    @Test
    void builderRejectsInvalidInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new EngineConfig.Builder().allocationIntervalSeconds(0));
    }

    @Test
    void toStringDoesNotLeakApiKey() {
        EngineConfig config = new EngineConfig.Builder().storeApiKey("top-secret").build();

        assertFalse(config.toString().contains("top-secret"));
    }
}
