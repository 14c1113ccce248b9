package org.readacademy.engine.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.domain.service.SlotDemandAnalyzer;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalendarConfigLoaderTest {

    private final CalendarConfigLoader loader = new CalendarConfigLoader();

    @Test
    void loadsSlotsWeightsAndThresholdFromClasspath() throws IOException {
        CalendarConfig config = loader.load("calendar-test.json");

        assertEquals(3, config.getSlots().size());
        TimeSlot first = config.getSlots().get(0);
        assertEquals("MON-1400", first.getSlotId());
        assertEquals(2, first.getCapacity());
        assertTrue(config.getSlots().get(2).isBlackout());
        assertEquals(5000, config.getWeights().getSiblingBonus());
        assertEquals(1000, config.getWeights().getCompletenessBonus());
        assertEquals(4, config.getDemandHighlightThreshold());
    }

    @Test
    void fileOnDiskTakesPrecedence(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("calendar.json");
        Files.write(file, ("{\"slots\":[{\"slot_id\":\"X\",\"start\":\"2025-03-03T10:00\","
                + "\"end\":\"2025-03-03T10:30\",\"capacity\":1}]}").getBytes(StandardCharsets.UTF_8));

        CalendarConfig config = loader.load(file.toString());

        assertEquals(1, config.getSlots().size());
        assertEquals(SlotDemandAnalyzer.DEFAULT_HIGHLIGHT_THRESHOLD, config.getDemandHighlightThreshold());
        assertEquals(3000, config.getWeights().getSiblingBonus());
    }

    @Test
    void missingConfigurationIsReported() {
        assertThrows(FileNotFoundException.class, () -> loader.load("no-such-calendar.json"));
    }

    @Test
    void duplicateSlotIdsAreRejected() {
        String json = "{\"slots\":["
                + "{\"slot_id\":\"A\",\"start\":\"2025-03-03T10:00\",\"end\":\"2025-03-03T10:30\",\"capacity\":1},"
                + "{\"slot_id\":\"A\",\"start\":\"2025-03-03T11:00\",\"end\":\"2025-03-03T11:30\",\"capacity\":1}]}";

        assertThrows(IllegalArgumentException.class, () -> loader.load(stream(json)));
    }

    @Test
    void negativeWeightIsRejected() {
        String json = "{\"slots\":[],\"weights\":{\"urgency_weight\":-2}}";

        assertThrows(IllegalArgumentException.class, () -> loader.load(stream(json)));
    }

    @Test
    void nonPositiveCapacityIsRejected() {
        String json = "{\"slots\":[{\"slot_id\":\"A\",\"start\":\"2025-03-03T10:00\","
                + "\"end\":\"2025-03-03T10:30\",\"capacity\":0}]}";

        assertThrows(IllegalArgumentException.class, () -> loader.load(stream(json)));
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
