package org.smarttask.allocator.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.smarttask.allocator.api.DtoMapper;
import org.smarttask.allocator.api.JsonMapperFactory;
import org.smarttask.allocator.api.dto.MemberDto;
import org.smarttask.allocator.api.dto.TaskDto;
import org.smarttask.allocator.domain.model.AllocationOutcome;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.service.AllocationService;
import org.smarttask.allocator.store.TeamStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Instant;
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
 * JSON HTTP API for the allocator.
 * Exposes members, tasks, allocation and reset endpoints.
 */
public final class AllocatorHttpServer {

    private static final Logger LOG = Logger.getLogger(AllocatorHttpServer.class.getName());
    private static final ObjectMapper MAPPER = JsonMapperFactory.create();

    private final HttpServer server;
    private final ExecutorService executor;
    private final TeamStore store;
    private final AllocationService allocationService;

    public AllocatorHttpServer(int port, TeamStore store, AllocationService allocationService) throws IOException {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.allocationService = Objects.requireNonNull(allocationService, "allocationService must not be null");

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "HTTP server initialized on port " + getPort());
    }

    private void registerHandlers() {
        server.createContext("/", this::handleRoot);
        server.createContext("/api/health", this::handleHealth);
        server.createContext("/api/members", this::handleMembers);
        server.createContext("/api/tasks", this::handleTasks);
        server.createContext("/api/allocate", this::handleAllocate);
        server.createContext("/api/reset", this::handleReset);
    }

    /**
     * Start the HTTP server.
     */
    public void start() {
        server.start();
        LOG.info("HTTP server started");
    }

    /**
     * Stop the HTTP server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdown();
        LOG.info("HTTP server stopped");
    }

    /**
     * Port the server is bound to; differs from the configured one when 0 was requested.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Welcome message. Any other unmatched path is a 404.
     * GET /
     */
    private void handleRoot(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            sendError(exchange, 404, "not found");
            return;
        }
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }
        sendJson(exchange, 200, Map.of("message", "Welcome to Smart Task Allocator API"));
    }

    /**
     * Health check endpoint.
     * GET /api/health
     */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!isExactPath(exchange, "/api/health")) {
            return;
        }
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Smart Task Allocator API is running!");
        body.put("status", store.isInitialized() ? "healthy" : "initializing");
        body.put("timestamp", Instant.now().toString());
        sendJson(exchange, 200, body);
    }

    /**
     * List or create members.
     * GET /api/members, POST /api/members
     */
    private void handleMembers(HttpExchange exchange) throws IOException {
        if (!isExactPath(exchange, "/api/members")) {
            return;
        }
        try {
            switch (exchange.getRequestMethod()) {
                case "GET":
                    List<MemberDto> members = store.getState().getMembers().stream()
                            .map(DtoMapper::toDto)
                            .collect(Collectors.toList());
                    sendJson(exchange, 200, members);
                    break;
                case "POST":
                    Member member = DtoMapper.toMember(readBody(exchange, MemberDto.class));
                    sendJson(exchange, 201, DtoMapper.toDto(allocationService.addMember(member)));
                    break;
                default:
                    sendError(exchange, 405, "method not allowed");
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.info(() -> "Rejected member request: " + e.getMessage());
            sendError(exchange, 400, e.getMessage());
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Member request failed", e);
            sendError(exchange, 500, "member request failed");
        }
    }

    /**
     * List or create tasks.
     * GET /api/tasks, POST /api/tasks
     */
    private void handleTasks(HttpExchange exchange) throws IOException {
        if (!isExactPath(exchange, "/api/tasks")) {
            return;
        }
        try {
            switch (exchange.getRequestMethod()) {
                case "GET":
                    List<TaskDto> tasks = store.getState().getTasks().stream()
                            .map(DtoMapper::toDto)
                            .collect(Collectors.toList());
                    sendJson(exchange, 200, tasks);
                    break;
                case "POST":
                    Task task = DtoMapper.toTask(readBody(exchange, TaskDto.class));
                    sendJson(exchange, 201, DtoMapper.toDto(allocationService.addTask(task)));
                    break;
                default:
                    sendError(exchange, 405, "method not allowed");
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.info(() -> "Rejected task request: " + e.getMessage());
            sendError(exchange, 400, e.getMessage());
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Task request failed", e);
            sendError(exchange, 500, "task request failed");
        }
    }

    /**
     * Run an allocation over the stored members and tasks.
     * POST /api/allocate
     */
    private void handleAllocate(HttpExchange exchange) throws IOException {
        if (!isExactPath(exchange, "/api/allocate")) {
            return;
        }
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        LOG.info("Received allocation request");
        AllocationOutcome outcome = allocationService.allocate();
        if (outcome.isSuccess()) {
            sendJson(exchange, 200, DtoMapper.toResponse(outcome.getReport()));
        } else {
            sendJson(exchange, 500, DtoMapper.failure(outcome.getError()));
        }
    }

    /**
     * Clear all workloads and assignments.
     * POST /api/reset
     */
    private void handleReset(HttpExchange exchange) throws IOException {
        if (!isExactPath(exchange, "/api/reset")) {
            return;
        }
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "method not allowed");
            return;
        }

        LOG.info("Received reset request");
        try {
            allocationService.reset();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("message", "All assignments have been reset");
            sendJson(exchange, 200, body);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Reset failed", e);
            sendError(exchange, 500, "reset failed");
        }
    }

    /**
     * Contexts match by prefix; anything below the registered path is a 404.
     */
    private boolean isExactPath(HttpExchange exchange, String expected) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (expected.equals(path) || (expected + "/").equals(path)) {
            return true;
        }
        sendError(exchange, 404, "not found");
        return false;
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length == 0) {
                throw new IllegalArgumentException("request body must not be empty");
            }
            return MAPPER.readValue(bytes, type);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message != null ? message : "error"));
    }

    /**
     * Send JSON response.
     */
    private void sendJson(HttpExchange exchange, int statusCode, Object payload) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(payload);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
