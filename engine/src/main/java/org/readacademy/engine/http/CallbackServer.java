package org.readacademy.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.readacademy.engine.api.RequestMapper;
import org.readacademy.engine.api.dto.ConsultationRequestDto;
import org.readacademy.engine.domain.exception.CapacityExceededException;
import org.readacademy.engine.domain.exception.CommitFailedException;
import org.readacademy.engine.domain.exception.SchedulingException;
import org.readacademy.engine.domain.exception.UnknownSlotException;
import org.readacademy.engine.domain.model.AllocationDecision;
import org.readacademy.engine.domain.model.AllocationResult;
import org.readacademy.engine.domain.model.Assignment;
import org.readacademy.engine.domain.model.CancellationResult;
import org.readacademy.engine.domain.model.ConsultationRequest;
import org.readacademy.engine.domain.service.AllocationCycleService;
import org.readacademy.engine.domain.service.Allocator;
import org.readacademy.engine.domain.service.SlotCalendar;
import org.readacademy.engine.domain.service.SlotDemandAnalyzer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * HTTP server for the staff UI.
 * Exposes allocation triggers, cancellation, manual overrides and read-only reports.
 */
public final class CallbackServer {

    private static final Logger LOG = Logger.getLogger(CallbackServer.class.getName());

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper mapper;
    private final AllocationCycleService cycleService;
    private final Allocator allocator;
    private final SlotCalendar calendar;
    private final SlotDemandAnalyzer demandAnalyzer;

    /**
     * @param port port to bind; 0 picks a free one
     */
    public CallbackServer(int port, AllocationCycleService cycleService, SlotCalendar calendar,
                          SlotDemandAnalyzer demandAnalyzer) throws IOException {
        this.cycleService = Objects.requireNonNull(cycleService, "cycleService must not be null");
        this.allocator = cycleService.getAllocator();
        this.calendar = Objects.requireNonNull(calendar, "calendar must not be null");
        this.demandAnalyzer = Objects.requireNonNull(demandAnalyzer, "demandAnalyzer must not be null");

        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "Callback server initialized on port " + getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", this::handleHealth);
        server.createContext("/requests", this::handleSubmit);
        server.createContext("/allocate", this::handleAllocate);
        server.createContext("/cancel/", this::handleCancel);
        server.createContext("/assign/", this::handleAssign);
        server.createContext("/withdraw/", this::handleWithdraw);
        server.createContext("/close", this::handleClose);
        server.createContext("/report", this::handleReport);
        server.createContext("/demand", this::handleDemand);
        server.createContext("/waitlist/", this::handleWaitlist);
    }

    /**
     * Start the callback server.
     */
    public void start() {
        server.start();
        LOG.info("Callback server started");
    }

    /**
     * Stop the callback server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdown();
        LOG.info("Callback server stopped");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Health check endpoint.
     * GET /health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("slots", calendar.slots().size());
        body.put("active_assignments", allocator.activeAssignments().size());
        sendJson(exchange, 200, body);
    }

    /**
     * Intake of finalized requests. Invalid records are reported, the rest are stored.
     * POST /requests with a JSON array of request records
     */
    private void handleSubmit(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        List<ConsultationRequestDto> dtos;
        try (InputStream in = exchange.getRequestBody()) {
            dtos = mapper.readValue(in, new TypeReference<List<ConsultationRequestDto>>() { });
        } catch (JsonProcessingException e) {
            LOG.warning(() -> "Malformed request body: " + e.getOriginalMessage());
            sendError(exchange, 400, "malformed request body");
            return;
        }
        List<String> rejected = new ArrayList<>();
        List<ConsultationRequest> requests = RequestMapper.toRequests(dtos, rejected);
        List<String> accepted = cycleService.submit(requests);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accepted", accepted);
        body.put("rejected", rejected);
        sendJson(exchange, 202, body);
    }

    /**
     * Run an allocation pass over the pending requests in the store.
     * POST /allocate
     */
    private void handleAllocate(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        LOG.info("Received allocation request");
        try {
            AllocationResult result = cycleService.runPendingCycle();
            if (result == null) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", "idle");
                body.put("decisions", Collections.emptyList());
                sendJson(exchange, 200, body);
                return;
            }
            sendJson(exchange, 200, resultBody("allocated", result));
        } catch (CommitFailedException e) {
            LOG.log(Level.SEVERE, "Allocation commit failed", e);
            Map<String, Object> body = e.getProvisionalResult() != null
                    ? resultBody("provisional", e.getProvisionalResult())
                    : new LinkedHashMap<>();
            body.put("error", e.getMessage());
            sendJson(exchange, 503, body);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Allocation failed", e);
            sendError(exchange, 500, "allocation failed");
        }
    }

    /**
     * Cancel an assignment and promote from the slot's waitlist.
     * POST /cancel/{assignmentId}
     */
    private void handleCancel(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        List<String> segments = pathSegments(exchange, "/cancel/");
        if (segments.size() != 1) {
            sendError(exchange, 400, "missing assignment ID");
            return;
        }
        String assignmentId = segments.get(0);
        LOG.info(() -> "Received cancellation for assignment: " + assignmentId);
        try {
            CancellationResult result = allocator.cancel(assignmentId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "cancelled");
            body.put("cancelled", RequestMapper.toDto(result.getCancelled()));
            body.put("promoted", result.getPromoted().stream().map(RequestMapper::toDto).collect(Collectors.toList()));
            sendJson(exchange, 200, body);
        } catch (Exception e) {
            handleFailure(exchange, "Cancellation failed for " + assignmentId, e);
        }
    }

    /**
     * Staff override.
     * POST /assign/{requestId}/{slotId}
     */
    private void handleAssign(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        List<String> segments = pathSegments(exchange, "/assign/");
        if (segments.size() != 2) {
            sendError(exchange, 400, "expected /assign/{requestId}/{slotId}");
            return;
        }
        String requestId = segments.get(0);
        String slotId = segments.get(1);
        LOG.info(() -> "Received manual assignment: " + requestId + " -> " + slotId);
        try {
            Assignment assignment = allocator.assignManually(requestId, slotId);
            sendJson(exchange, 200, RequestMapper.toDto(assignment));
        } catch (Exception e) {
            handleFailure(exchange, "Manual assignment failed for " + requestId, e);
        }
    }

    /**
     * Take a request off the waitlist.
     * POST /withdraw/{requestId}
     */
    private void handleWithdraw(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        List<String> segments = pathSegments(exchange, "/withdraw/");
        if (segments.size() != 1) {
            sendError(exchange, 400, "missing request ID");
            return;
        }
        String requestId = segments.get(0);
        try {
            AllocationDecision decision = allocator.withdraw(requestId);
            sendJson(exchange, 200, RequestMapper.toDto(decision));
        } catch (Exception e) {
            handleFailure(exchange, "Withdrawal failed for " + requestId, e);
        }
    }

    /**
     * Close the admission cycle.
     * POST /close
     */
    private void handleClose(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        try {
            int expired = allocator.closeCycle();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "closed");
            body.put("expired", expired);
            sendJson(exchange, 200, body);
        } catch (Exception e) {
            handleFailure(exchange, "Closing the cycle failed", e);
        }
    }

    /**
     * Latest decision per request.
     * GET /report
     */
    private void handleReport(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        sendJson(exchange, 200, allocator.report().stream().map(RequestMapper::toDto).collect(Collectors.toList()));
    }

    /**
     * Per-slot demand.
     * GET /demand
     */
    private void handleDemand(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        try {
            sendJson(exchange, 200, demandAnalyzer.analyze(cycleService.openRequests()).stream()
                    .map(RequestMapper::toDto)
                    .collect(Collectors.toList()));
        } catch (Exception e) {
            handleFailure(exchange, "Demand report failed", e);
        }
    }

    /**
     * GET /waitlist/{slotId}
     */
    private void handleWaitlist(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        List<String> segments = pathSegments(exchange, "/waitlist/");
        if (segments.size() != 1) {
            sendError(exchange, 400, "missing slot ID");
            return;
        }
        String slotId = segments.get(0);
        if (!calendar.contains(slotId)) {
            sendError(exchange, 404, "unknown slot: " + slotId);
            return;
        }
        sendJson(exchange, 200, RequestMapper.toWaitlistDtos(allocator.waitlist(slotId)));
    }

    /**
     * Maps engine exceptions to status codes.
     */
    private void handleFailure(HttpExchange exchange, String context, Exception e) throws IOException {
        if (e instanceof UnknownSlotException) {
            LOG.warning(() -> context + ": " + e.getMessage());
            sendError(exchange, 404, e.getMessage());
        } else if (e instanceof CapacityExceededException) {
            LOG.warning(() -> context + ": " + e.getMessage());
            sendError(exchange, 409, e.getMessage());
        } else if (e instanceof CommitFailedException) {
            LOG.log(Level.SEVERE, context, e);
            sendError(exchange, 503, e.getMessage());
        } else if (e instanceof SchedulingException) {
            LOG.warning(() -> context + ": " + e.getMessage());
            sendError(exchange, 409, e.getMessage());
        } else if (e instanceof IllegalArgumentException) {
            LOG.warning(() -> context + ": " + e.getMessage());
            sendError(exchange, 404, e.getMessage());
        } else {
            LOG.log(Level.SEVERE, context, e);
            sendError(exchange, 500, "internal error");
        }
    }

    private Map<String, Object> resultBody(String status, AllocationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("decisions", result.getDecisions().stream().map(RequestMapper::toDto).collect(Collectors.toList()));
        body.put("assignments", result.getAssignments().stream().map(RequestMapper::toDto).collect(Collectors.toList()));
        return body;
    }

    /**
     * Path segments after a prefix, e.g. /assign/R1/S1 gives [R1, S1].
     */
    private List<String> pathSegments(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        List<String> segments = new ArrayList<>();
        if (path == null || !path.startsWith(prefix)) {
            return segments;
        }
        for (String part : path.substring(prefix.length()).split("/")) {
            if (!part.isEmpty()) {
                segments.add(part);
            }
        }
        return segments;
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equals(exchange.getRequestMethod())) {
            return true;
        }
        sendError(exchange, 405, "method not allowed");
        return false;
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Collections.singletonMap("error", message));
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            LOG.log(Level.SEVERE, "Failed to serialize response", e);
            statusCode = 500;
            json = "{\"error\":\"serialization failed\"}";
        }
        sendResponse(exchange, statusCode, json);
    }

    /**
     * Send HTTP response.
     */
    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
