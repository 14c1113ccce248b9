package org.readacademy.engine;

import org.readacademy.engine.config.CalendarConfig;
import org.readacademy.engine.config.CalendarConfigLoader;
import org.readacademy.engine.config.EngineConfig;
import org.readacademy.engine.domain.model.TimeSlot;
import org.readacademy.engine.domain.service.AllocationCycleService;
import org.readacademy.engine.domain.service.Allocator;
import org.readacademy.engine.domain.service.AllocatorImpl;
import org.readacademy.engine.domain.service.ConflictChecker;
import org.readacademy.engine.domain.service.GuardianConflictChecker;
import org.readacademy.engine.domain.service.InMemorySlotCalendar;
import org.readacademy.engine.domain.service.PriorityScorer;
import org.readacademy.engine.domain.service.PriorityScorerImpl;
import org.readacademy.engine.domain.service.SlotCalendar;
import org.readacademy.engine.domain.service.SlotDemandAnalyzer;
import org.readacademy.engine.http.CallbackServer;
import org.readacademy.engine.scheduler.AllocationScheduler;
import org.readacademy.engine.store.InMemoryScheduleStore;
import org.readacademy.engine.store.RestScheduleStore;
import org.readacademy.engine.store.ScheduleStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the consultation scheduling engine.
 *
 * The engine assigns consultation requests to slots by priority, keeps
 * per-slot waitlists and promotes from them when a booking is cancelled.
 *
 * Trigger modes:
 * - Staff UI: POST /allocate, /cancel/{id}, /assign/{requestId}/{slotId}, /close
 * - Periodic: Scheduler allocates newly submitted requests every N seconds
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Reading Academy Consultation Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        configureLogging(config);

        CalendarConfig calendarConfig = new CalendarConfigLoader().load(config.getCalendarFile());

        // Create store and resolve slots
        ScheduleStore store;
        List<TimeSlot> slots;
        if (config.getStoreMode() == EngineConfig.StoreMode.REST) {
            store = new RestScheduleStore(config.getStoreBaseUrl(), config.getStoreApiKey());
            LOG.info(() -> "Schedule store configured for: " + config.getStoreBaseUrl());
            slots = store.loadSlots();
            if (slots.isEmpty()) {
                LOG.warning("Store returned no slots, using calendar file");
                slots = calendarConfig.getSlots();
            }
        } else {
            slots = calendarConfig.getSlots();
            store = new InMemoryScheduleStore(slots);
            LOG.info("Using in-memory schedule store");
        }
        if (slots.isEmpty()) {
            throw new IllegalStateException("No consultation slots configured");
        }

        // Create services
        SlotCalendar calendar = new InMemorySlotCalendar(slots);
        PriorityScorer scorer = new PriorityScorerImpl(calendarConfig.getWeights());
        ConflictChecker conflictChecker = new GuardianConflictChecker();
        Allocator allocator = new AllocatorImpl(calendar, scorer, conflictChecker, store);
        AllocationCycleService cycleService = new AllocationCycleService(store, allocator);
        SlotDemandAnalyzer demandAnalyzer = new SlotDemandAnalyzer(calendar, scorer,
                calendarConfig.getDemandHighlightThreshold());

        // Start callback server
        CallbackServer callbackServer = new CallbackServer(config.getCallbackPort(), cycleService, calendar,
                demandAnalyzer);
        callbackServer.start();

        // Start scheduler if enabled
        AllocationScheduler scheduler = null;
        if (config.isSchedulerEnabled()) {
            scheduler = new AllocationScheduler(cycleService, config.getAllocationIntervalSeconds());
            scheduler.start();
        } else {
            LOG.info("Allocation scheduler disabled");
        }

        // Register shutdown hook
        final AllocationScheduler finalScheduler = scheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            callbackServer.stop();
            if (finalScheduler != null) {
                finalScheduler.stop();
            }
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Consultation Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: http://localhost:" + config.getCallbackPort() + "/health");
        LOG.info(() -> "  - Allocate: POST http://localhost:" + config.getCallbackPort() + "/allocate");
        LOG.info(() -> "  - Cancel: POST http://localhost:" + config.getCallbackPort() + "/cancel/{assignmentId}");
        LOG.info(() -> "  - Demand: http://localhost:" + config.getCallbackPort() + "/demand");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
