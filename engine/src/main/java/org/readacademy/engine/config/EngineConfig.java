package org.readacademy.engine.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the consultation engine.
 * Values come from environment variables, then a {@code .env} file, then defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_STORE_URL = "http://localhost:8081";
    public static final int DEFAULT_CALLBACK_PORT = 8082;
    public static final int DEFAULT_ALLOCATION_INTERVAL = 60;
    public static final String DEFAULT_CALENDAR_FILE = "calendar.json";
    public static final String DEFAULT_LOG_FILE = "logs/engine/engine.log";

    /**
     * Where schedule state lives.
     */
    public enum StoreMode {
        MEMORY,
        REST
    }

    // Store Configuration
    private final StoreMode storeMode;
    private final String storeBaseUrl;
    private final String storeApiKey;

    // Calendar Configuration
    private final String calendarFile;

    // Callback Server Configuration
    private final int callbackPort;

    // Scheduler Configuration
    private final int allocationIntervalSeconds;
    private final boolean schedulerEnabled;

    // Logging Configuration
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.storeMode = builder.storeMode;
        this.storeBaseUrl = builder.storeBaseUrl;
        this.storeApiKey = builder.storeApiKey;
        this.calendarFile = builder.calendarFile;
        this.callbackPort = builder.callbackPort;
        this.allocationIntervalSeconds = builder.allocationIntervalSeconds;
        this.schedulerEnabled = builder.schedulerEnabled;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables, falling back to a {@code .env} file.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return fromSource(key -> {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = dotenv.get(key);
            }
            return value;
        });
    }

    /**
     * Creates configuration from an arbitrary key lookup. Unset or blank keys use defaults.
     */
    public static EngineConfig fromSource(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .storeMode(parseStoreMode(get(lookup, "STORE_MODE", "memory")))
                .storeBaseUrl(get(lookup, "STORE_BASE_URL", DEFAULT_STORE_URL))
                .storeApiKey(get(lookup, "STORE_API_KEY", ""))
                .calendarFile(get(lookup, "CALENDAR_CONFIG_FILE", DEFAULT_CALENDAR_FILE))
                .callbackPort(getInt(lookup, "ENGINE_CALLBACK_PORT", DEFAULT_CALLBACK_PORT))
                .allocationIntervalSeconds(getInt(lookup, "ALLOCATION_INTERVAL_SECONDS", DEFAULT_ALLOCATION_INTERVAL))
                .schedulerEnabled(getBoolean(lookup, "ALLOCATION_SCHEDULER_ENABLED", true))
                .logFilePath(get(lookup, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "ENGINE_FILE_LOGGING_ENABLED", false))
                .build();
    }

    // Getters
    public StoreMode getStoreMode() {
        return storeMode;
    }

    public String getStoreBaseUrl() {
        return storeBaseUrl;
    }

    public String getStoreApiKey() {
        return storeApiKey;
    }

    public String getCalendarFile() {
        return calendarFile;
    }

    public int getCallbackPort() {
        return callbackPort;
    }

    public int getAllocationIntervalSeconds() {
        return allocationIntervalSeconds;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Lookup helpers
    private static String get(Function<String, String> lookup, String key, String defaultValue) {
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

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static StoreMode parseStoreMode(String value) {
        try {
            return StoreMode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> "Unknown STORE_MODE " + value + ", using memory");
            return StoreMode.MEMORY;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "storeMode=" + storeMode +
                ", storeBaseUrl='" + storeBaseUrl + '\'' +
                ", calendarFile='" + calendarFile + '\'' +
                ", callbackPort=" + callbackPort +
                ", allocationIntervalSeconds=" + allocationIntervalSeconds +
                ", schedulerEnabled=" + schedulerEnabled +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private StoreMode storeMode = StoreMode.MEMORY;
        private String storeBaseUrl = DEFAULT_STORE_URL;
        private String storeApiKey = "";
        private String calendarFile = DEFAULT_CALENDAR_FILE;
        private int callbackPort = DEFAULT_CALLBACK_PORT;
        private int allocationIntervalSeconds = DEFAULT_ALLOCATION_INTERVAL;
        private boolean schedulerEnabled = true;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled;

        public Builder storeMode(StoreMode storeMode) {
            this.storeMode = Objects.requireNonNull(storeMode, "storeMode must not be null");
            return this;
        }

        public Builder storeBaseUrl(String storeBaseUrl) {
            this.storeBaseUrl = Objects.requireNonNull(storeBaseUrl, "storeBaseUrl must not be null");
            return this;
        }

        public Builder storeApiKey(String storeApiKey) {
            this.storeApiKey = storeApiKey;
            return this;
        }

        public Builder calendarFile(String calendarFile) {
            this.calendarFile = Objects.requireNonNull(calendarFile, "calendarFile must not be null");
            return this;
        }

        public Builder callbackPort(int callbackPort) {
            if (callbackPort <= 0 || callbackPort > 65535) {
                throw new IllegalArgumentException("callbackPort must be between 1 and 65535");
            }
            this.callbackPort = callbackPort;
            return this;
        }

        public Builder allocationIntervalSeconds(int allocationIntervalSeconds) {
            if (allocationIntervalSeconds < 1) {
                throw new IllegalArgumentException("allocationIntervalSeconds must be at least 1");
            }
            this.allocationIntervalSeconds = allocationIntervalSeconds;
            return this;
        }

        public Builder schedulerEnabled(boolean schedulerEnabled) {
            this.schedulerEnabled = schedulerEnabled;
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

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
