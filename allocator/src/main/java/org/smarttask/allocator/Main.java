package org.smarttask.allocator;

import org.smarttask.allocator.api.TeamApiClientImpl;
import org.smarttask.allocator.config.AllocatorConfig;
import org.smarttask.allocator.domain.model.TeamState;
import org.smarttask.allocator.domain.service.AllocationReporter;
import org.smarttask.allocator.domain.service.AllocationService;
import org.smarttask.allocator.domain.service.AllocationServiceImpl;
import org.smarttask.allocator.domain.service.GreedyTaskAllocator;
import org.smarttask.allocator.domain.service.ScoringService;
import org.smarttask.allocator.domain.service.ScoringServiceImpl;
import org.smarttask.allocator.http.AllocatorHttpServer;
import org.smarttask.allocator.store.InMemoryTeamStore;
import org.smarttask.allocator.store.RemoteTeamStore;
import org.smarttask.allocator.store.SeedDataLoader;
import org.smarttask.allocator.store.TeamStore;
import org.smarttask.allocator.store.TeamStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the Smart Task Allocator.
 *
 * Members and tasks live either in memory (seeded from JSON) or behind an
 * external team API. Allocation is triggered on demand through
 * POST /api/allocate and greedily places tasks, most urgent first, on the
 * best-matching member with spare capacity.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private static final int LOG_FILE_LIMIT_BYTES = 5 * 1024 * 1024;
    private static final int LOG_FILE_COUNT = 3;

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Allocator startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Smart Task Allocator ===");

        // Load configuration
        AllocatorConfig config = AllocatorConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        // Apply log level and optional file output
        configureLogging(config);

        // Create store
        TeamStore store = createStore(config);

        // Create services
        ScoringService scoringService = new ScoringServiceImpl(config.getScoringConfig());
        AllocationService allocationService = new AllocationServiceImpl(
                store, new GreedyTaskAllocator(scoringService), new AllocationReporter());

        // Start HTTP server
        AllocatorHttpServer httpServer = new AllocatorHttpServer(config.getHttpPort(), store, allocationService);
        httpServer.start();

        // Register shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down allocator...");
            httpServer.stop();
            LOG.info("Allocator shutdown complete");
        }));

        int port = httpServer.getPort();
        LOG.info("=== Smart Task Allocator started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: http://localhost:" + port + "/api/health");
        LOG.info(() -> "  - Members: http://localhost:" + port + "/api/members");
        LOG.info(() -> "  - Tasks: http://localhost:" + port + "/api/tasks");
        LOG.info(() -> "  - Allocate: POST http://localhost:" + port + "/api/allocate");
        LOG.info(() -> "  - Reset: POST http://localhost:" + port + "/api/reset");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    private TeamStore createStore(AllocatorConfig config) throws IOException {
        if (config.isRemoteStoreEnabled()) {
            LOG.info(() -> "Using team API at " + config.getTeamApiBaseUrl());
            RemoteTeamStore remote = new RemoteTeamStore(new TeamApiClientImpl(config.getTeamApiBaseUrl()));
            try {
                TeamState initial = remote.getState();
                LOG.info(() -> String.format("Team API reachable: %d members, %d tasks",
                        initial.getMembers().size(), initial.getTasks().size()));
            } catch (TeamStoreException e) {
                LOG.log(Level.WARNING, e, () -> "Team API not ready, health reports initializing until it answers");
            }
            return remote;
        }

        if (!config.isSeedEnabled()) {
            LOG.info("Using empty in-memory store");
            return new InMemoryTeamStore();
        }

        SeedDataLoader loader = new SeedDataLoader();
        TeamState seed = config.getSeedFile().isEmpty()
                ? loader.loadResource(SeedDataLoader.DEFAULT_RESOURCE)
                : loader.loadFile(Paths.get(config.getSeedFile()));
        return new InMemoryTeamStore(seed);
    }

    /**
     * Applies the configured level to the root logger and its console handler,
     * then attaches a rotating file handler when file logging is on.
     */
    private void configureLogging(AllocatorConfig config) {
        Logger root = Logger.getLogger("");
        Level level = config.getLogLevel();
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }

        if (config.isFileLoggingEnabled()) {
            attachFileHandler(root, Paths.get(config.getLogFilePath()).toAbsolutePath(), level);
        }
    }

    private void attachFileHandler(Logger root, Path logFile, Level level) {
        try {
            Path directory = logFile.getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            FileHandler fileHandler = new FileHandler(logFile.toString(), LOG_FILE_LIMIT_BYTES, LOG_FILE_COUNT, true);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(level);
            root.addHandler(fileHandler);
            LOG.info(() -> String.format("Logging %s and above to %s (%d rotating files)", level, logFile, LOG_FILE_COUNT));
        } catch (IOException e) {
            LOG.log(Level.WARNING, e, () -> "Cannot open log file " + logFile + ", keeping console logging only");
        }
    }
}
