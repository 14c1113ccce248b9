package org.readacademy.engine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.readacademy.engine.api.RequestMapper;
import org.readacademy.engine.api.dto.SlotDto;
import org.readacademy.engine.domain.model.ScoringWeights;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.domain.service.SlotDemandAnalyzer;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads the calendar JSON file:
 * <pre>
 * {
 *   "slots": [{"slot_id": "MON-1400", "start": "2025-03-03T14:00", "end": "2025-03-03T14:30",
 *              "capacity": 2, "blackout": false}],
 *   "weights": {"sibling_bonus": 3000, "completeness_bonus": 1000, "distance_weight": 10, "urgency_weight": 1},
 *   "demand_highlight_threshold": 3
 * }
 * </pre>
 */
public final class CalendarConfigLoader {

    private static final Logger LOG = Logger.getLogger(CalendarConfigLoader.class.getName());

    private final ObjectMapper mapper;

    public CalendarConfigLoader() {
        this(new ObjectMapper());
    }

    public CalendarConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public CalendarConfig load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            CalendarConfig config = load(in);
            LOG.info(() -> "Loaded calendar from " + file.toAbsolutePath() + ": " + config);
            return config;
        }
    }

    /**
     * Loads from the file system when {@code location} exists there, else from the classpath.
     */
    public CalendarConfig load(String location) throws IOException {
        Path file = Paths.get(location);
        if (Files.isRegularFile(file)) {
            return load(file);
        }
        String resource = location.startsWith("/") ? location : "/" + location;
        try (InputStream in = CalendarConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("Calendar configuration not found: " + location);
            }
            CalendarConfig config = load(in);
            LOG.info(() -> "Loaded calendar from classpath " + resource + ": " + config);
            return config;
        }
    }

    /**
     * @throws IllegalArgumentException for invalid slots, duplicate ids or bad weights
     */
    public CalendarConfig load(InputStream in) throws IOException {
        CalendarFile file = mapper.readValue(in, CalendarFile.class);

        List<TimeSlot> slots = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        if (file.slots != null) {
            for (SlotDto dto : file.slots) {
                TimeSlot slot = RequestMapper.toSlot(dto);
                if (!ids.add(slot.getSlotId())) {
                    throw new IllegalArgumentException("Duplicate slot id in calendar: " + slot.getSlotId());
                }
                slots.add(slot);
            }
        }

        ScoringWeights weights = file.weights != null
                ? ScoringWeights.fromMap(file.weights)
                : ScoringWeights.defaults();
        int threshold = file.demandHighlightThreshold != null
                ? file.demandHighlightThreshold
                : SlotDemandAnalyzer.DEFAULT_HIGHLIGHT_THRESHOLD;

        return new CalendarConfig(slots, weights, threshold);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class CalendarFile {
        @JsonProperty("slots")
        List<SlotDto> slots;

        @JsonProperty("weights")
        Map<String, Integer> weights = new LinkedHashMap<>();

        @JsonProperty("demand_highlight_threshold")
        Integer demandHighlightThreshold;
    }
}
