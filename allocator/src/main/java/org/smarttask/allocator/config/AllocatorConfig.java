package org.smarttask.allocator.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.smarttask.allocator.domain.model.ScoringConfig;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable configuration for the allocator service.
 * Values are read from environment variables, then from a .env file
 * (working directory, then its parent), with sensible defaults.
 */
public final class AllocatorConfig {

    private static final Logger LOG = Logger.getLogger(AllocatorConfig.class.getName());

    public static final int DEFAULT_HTTP_PORT = 3001;
    public static final String DEFAULT_LOG_FILE = "logs/allocator.log";

    // HTTP Configuration
    private final int httpPort;

    // Store Configuration
    private final String teamApiBaseUrl;
    private final boolean seedEnabled;
    private final String seedFile;

    // Scoring Configuration
    private final double skillLevelMultiplier;
    private final double workloadPenaltyWeight;

    // Logging Configuration
    private final Level logLevel;
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private AllocatorConfig(Builder builder) {
        this.httpPort = builder.httpPort;
        this.teamApiBaseUrl = builder.teamApiBaseUrl;
        this.seedEnabled = builder.seedEnabled;
        this.seedFile = builder.seedFile;
        this.skillLevelMultiplier = builder.skillLevelMultiplier;
        this.workloadPenaltyWeight = builder.workloadPenaltyWeight;
        this.logLevel = builder.logLevel;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables and .env files.
     */
    public static AllocatorConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parentDotenv = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromLookup(key -> firstNonBlank(System.getenv(key), dotenv.get(key), parentDotenv.get(key)));
    }

    /**
     * Creates configuration from an arbitrary key lookup. Blank or missing values use defaults.
     */
    public static AllocatorConfig fromLookup(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .httpPort(getInt(lookup, "ALLOCATOR_HTTP_PORT", DEFAULT_HTTP_PORT))
                .teamApiBaseUrl(getString(lookup, "TEAM_API_BASE_URL", ""))
                .seedEnabled(getBoolean(lookup, "ALLOCATOR_SEED_ENABLED", true))
                .seedFile(getString(lookup, "ALLOCATOR_SEED_FILE", ""))
                .skillLevelMultiplier(getDouble(lookup, "ALLOCATOR_SKILL_LEVEL_MULTIPLIER",
                        ScoringConfig.DEFAULT_SKILL_LEVEL_MULTIPLIER))
                .workloadPenaltyWeight(getDouble(lookup, "ALLOCATOR_WORKLOAD_PENALTY_WEIGHT",
                        ScoringConfig.DEFAULT_WORKLOAD_PENALTY_WEIGHT))
                .logLevel(getLevel(lookup, "ALLOCATOR_LOG_LEVEL", Level.INFO))
                .logFilePath(getString(lookup, "ALLOCATOR_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "ALLOCATOR_FILE_LOGGING_ENABLED", false))
                .build();
    }

    // Getters
    public int getHttpPort() {
        return httpPort;
    }

    public String getTeamApiBaseUrl() {
        return teamApiBaseUrl;
    }

    /**
     * Whether members and tasks live behind the remote team API rather than in memory.
     */
    public boolean isRemoteStoreEnabled() {
        return !teamApiBaseUrl.isEmpty();
    }

    public boolean isSeedEnabled() {
        return seedEnabled;
    }

    public String getSeedFile() {
        return seedFile;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public ScoringConfig getScoringConfig() {
        Map<String, Double> values = new HashMap<>();
        values.put(ScoringConfig.SKILL_LEVEL_MULTIPLIER, skillLevelMultiplier);
        values.put(ScoringConfig.WORKLOAD_PENALTY_WEIGHT, workloadPenaltyWeight);
        return ScoringConfig.fromMap(values);
    }

    // Lookup helpers
    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.trim().isEmpty()) {
                return candidate;
            }
        }
        return null;
    }

    private static String getString(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static double getDouble(Function<String, String> lookup, String key, double defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid number for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static Level getLevel(Function<String, String> lookup, String key, Level defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Level.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> String.format("Invalid log level for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "AllocatorConfig{" +
                "httpPort=" + httpPort +
                ", teamApiBaseUrl='" + teamApiBaseUrl + '\'' +
                ", seedEnabled=" + seedEnabled +
                ", seedFile='" + seedFile + '\'' +
                ", skillLevelMultiplier=" + skillLevelMultiplier +
                ", workloadPenaltyWeight=" + workloadPenaltyWeight +
                ", logLevel=" + logLevel +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for AllocatorConfig.
     */
    public static final class Builder {
        private int httpPort = DEFAULT_HTTP_PORT;
        private String teamApiBaseUrl = "";
        private boolean seedEnabled = true;
        private String seedFile = "";
        private double skillLevelMultiplier = ScoringConfig.DEFAULT_SKILL_LEVEL_MULTIPLIER;
        private double workloadPenaltyWeight = ScoringConfig.DEFAULT_WORKLOAD_PENALTY_WEIGHT;
        private Level logLevel = Level.INFO;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;

        public Builder httpPort(int httpPort) {
            if (httpPort < 0 || httpPort > 65535) {
                throw new IllegalArgumentException("httpPort must be between 0 and 65535");
            }
            this.httpPort = httpPort;
            return this;
        }

        public Builder teamApiBaseUrl(String teamApiBaseUrl) {
            this.teamApiBaseUrl = Objects.requireNonNull(teamApiBaseUrl, "teamApiBaseUrl must not be null");
            return this;
        }

        public Builder seedEnabled(boolean seedEnabled) {
            this.seedEnabled = seedEnabled;
            return this;
        }

        public Builder seedFile(String seedFile) {
            this.seedFile = Objects.requireNonNull(seedFile, "seedFile must not be null");
            return this;
        }

        public Builder skillLevelMultiplier(double skillLevelMultiplier) {
            this.skillLevelMultiplier = skillLevelMultiplier;
            return this;
        }

        public Builder workloadPenaltyWeight(double workloadPenaltyWeight) {
            this.workloadPenaltyWeight = workloadPenaltyWeight;
            return this;
        }

        public Builder logLevel(Level logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel must not be null");
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public AllocatorConfig build() {
            return new AllocatorConfig(this);
        }
    }
}
