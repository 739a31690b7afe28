package com.aiverse.fabric.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the Data Fabric worker.
 * <p>
 * Redis: FABRIC_REDIS_HOST, FABRIC_REDIS_PORT (used when FABRIC_RATE_LIMIT_STORE=redis).
 * Ledger DB: FABRIC_DB_HOST, FABRIC_DB_PORT, FABRIC_DB_NAME, FABRIC_DB_USER, FABRIC_DB_PASSWORD
 * (used when FABRIC_LEDGER_STORE=jdbc).
 * Tenant config: FABRIC_TENANT_CONFIG_FILE, a JSON array read by {@link TenantEntry#parse}.
 */
public final class FabricConfig {

    private static final String ENV_TENANT_IDS = "FABRIC_TENANT_IDS";
    private static final String ENV_DEFAULT_TENANT_ID = "FABRIC_DEFAULT_TENANT_ID";
    private static final String ENV_REDIS_HOST = "FABRIC_REDIS_HOST";
    private static final String ENV_REDIS_PORT = "FABRIC_REDIS_PORT";
    private static final String ENV_RATE_LIMIT_STORE = "FABRIC_RATE_LIMIT_STORE";
    private static final String ENV_RATE_LIMIT_READ = "FABRIC_RATE_LIMIT_READ";
    private static final String ENV_RATE_LIMIT_WRITE = "FABRIC_RATE_LIMIT_WRITE";
    private static final String ENV_RATE_LIMIT_COMPUTE = "FABRIC_RATE_LIMIT_COMPUTE";
    private static final String ENV_LEDGER_STORE = "FABRIC_LEDGER_STORE";
    private static final String ENV_DB_HOST = "FABRIC_DB_HOST";
    private static final String ENV_DB_PORT = "FABRIC_DB_PORT";
    private static final String ENV_DB_NAME = "FABRIC_DB_NAME";
    private static final String ENV_DB_USER = "FABRIC_DB_USER";
    private static final String ENV_DB_PASSWORD = "FABRIC_DB_PASSWORD";
    private static final String ENV_CARDS_DIR = "FABRIC_CARDS_DIR";
    private static final String ENV_SIGNALS_DIR = "FABRIC_SIGNALS_DIR";
    private static final String ENV_ADAPTERS_DIR = "FABRIC_ADAPTERS_DIR";
    private static final String ENV_INTENT_ENGINE = "FABRIC_INTENT_ENGINE";
    private static final String ENV_TENANT_CONFIG_FILE = "FABRIC_TENANT_CONFIG_FILE";

    private static final String DEFAULT_TENANT_ID = "default";
    private static final String TENANT_PLACEHOLDER = "<tenant>";
    private static final String RATE_LIMIT_KEY_PREFIX = "<tenant>:fabric:ratelimit";

    public static final int DEFAULT_READ_LIMIT = 1000;
    public static final int DEFAULT_WRITE_LIMIT = 100;
    public static final int DEFAULT_COMPUTE_LIMIT = 50;

    /** Where rate-limit windows are counted. */
    public enum CounterStore { MEMORY, REDIS }

    /** Where intent executions are recorded. */
    public enum LedgerStore { MEMORY, JDBC }

    /** How decomposed intents are dispatched to units. */
    public enum IntentEngineMode { INPROCESS, NONE }

    private final List<String> tenantIds;
    private final String redisHost;
    private final int redisPort;
    private final CounterStore rateLimitStore;
    private final int readLimitPerMinute;
    private final int writeLimitPerMinute;
    private final int computeLimitPerMinute;
    private final LedgerStore ledgerStore;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String cardsDir;
    private final String signalsDir;
    private final String adaptersDir;
    private final IntentEngineMode intentEngine;
    private final String tenantConfigFile;

    private FabricConfig(Builder b) {
        this.tenantIds = Collections.unmodifiableList(new ArrayList<>(b.tenantIds));
        this.redisHost = b.redisHost;
        this.redisPort = b.redisPort;
        this.rateLimitStore = b.rateLimitStore;
        this.readLimitPerMinute = b.readLimitPerMinute;
        this.writeLimitPerMinute = b.writeLimitPerMinute;
        this.computeLimitPerMinute = b.computeLimitPerMinute;
        this.ledgerStore = b.ledgerStore;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName;
        this.dbUser = b.dbUser;
        this.dbPassword = b.dbPassword;
        this.cardsDir = b.cardsDir;
        this.signalsDir = b.signalsDir;
        this.adaptersDir = b.adaptersDir;
        this.intentEngine = b.intentEngine;
        this.tenantConfigFile = b.tenantConfigFile;
    }

    /**
     * Normalizes a tenant id for registry and key use: null/blank → FABRIC_DEFAULT_TENANT_ID from env,
     * or {@value #DEFAULT_TENANT_ID}.
     */
    public static String normalizeTenantId(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            String envDefault = System.getenv(ENV_DEFAULT_TENANT_ID);
            return (envDefault != null && !envDefault.isBlank()) ? envDefault.trim() : DEFAULT_TENANT_ID;
        }
        return tenantId.trim();
    }

    /** Tenant ids to register units for at bootstrap (FABRIC_TENANT_IDS). Default {@code ["default"]}. */
    public List<String> getTenantIds() {
        return tenantIds;
    }

    /**
     * Redis key prefix for the tenant's rate-limit windows, e.g. {@code acme/ws1:fabric:ratelimit}.
     */
    public String getRateLimitKeyPrefix(String tenantId) {
        return RATE_LIMIT_KEY_PREFIX.replace(TENANT_PLACEHOLDER, normalizeTenantId(tenantId));
    }

    public String getRedisHost() {
        return redisHost;
    }

    public int getRedisPort() {
        return redisPort;
    }

    public CounterStore getRateLimitStore() {
        return rateLimitStore;
    }

    /** Read requests per minute per tenant. Default 1000. */
    public int getReadLimitPerMinute() {
        return readLimitPerMinute;
    }

    /** Write intents per minute per tenant. Default 100. */
    public int getWriteLimitPerMinute() {
        return writeLimitPerMinute;
    }

    /** Compute intents per minute per tenant. Default 50. */
    public int getComputeLimitPerMinute() {
        return computeLimitPerMinute;
    }

    public LedgerStore getLedgerStore() {
        return ledgerStore;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** Directory of registry card JSON files; null = load from the classpath index. */
    public String getCardsDir() {
        return cardsDir;
    }

    /** Directory of feedback signal JSON files; null = load from the classpath index. */
    public String getSignalsDir() {
        return signalsDir;
    }

    /** Directory scanned for adapter JARs (port implementations); null = classpath only. */
    public String getAdaptersDir() {
        return adaptersDir;
    }

    public IntentEngineMode getIntentEngine() {
        return intentEngine;
    }

    /** JSON file of tenant entries with per-tenant config; null = no tenant config. */
    public String getTenantConfigFile() {
        return tenantConfigFile;
    }

    public static FabricConfig fromEnvironment() {
        List<String> tenants = parseCommaSeparated(System.getenv(ENV_TENANT_IDS));
        if (tenants.isEmpty()) tenants = List.of(normalizeTenantId(null));

        return builder()
                .tenantIds(tenants)
                .redisHost(getEnv(ENV_REDIS_HOST, "localhost"))
                .redisPort(parseInt(System.getenv(ENV_REDIS_PORT), 6379))
                .rateLimitStore(parseEnum(System.getenv(ENV_RATE_LIMIT_STORE), CounterStore.class, CounterStore.MEMORY))
                .readLimitPerMinute(parseInt(System.getenv(ENV_RATE_LIMIT_READ), DEFAULT_READ_LIMIT))
                .writeLimitPerMinute(parseInt(System.getenv(ENV_RATE_LIMIT_WRITE), DEFAULT_WRITE_LIMIT))
                .computeLimitPerMinute(parseInt(System.getenv(ENV_RATE_LIMIT_COMPUTE), DEFAULT_COMPUTE_LIMIT))
                .ledgerStore(parseEnum(System.getenv(ENV_LEDGER_STORE), LedgerStore.class, LedgerStore.MEMORY))
                .dbHost(getEnv(ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(System.getenv(ENV_DB_PORT), 5432))
                .dbName(getEnv(ENV_DB_NAME, "fabric"))
                .dbUser(getEnv(ENV_DB_USER, "fabric"))
                .dbPassword(getEnv(ENV_DB_PASSWORD, ""))
                .cardsDir(getEnv(ENV_CARDS_DIR, null))
                .signalsDir(getEnv(ENV_SIGNALS_DIR, null))
                .adaptersDir(getEnv(ENV_ADAPTERS_DIR, null))
                .intentEngine(parseEnum(System.getenv(ENV_INTENT_ENGINE), IntentEngineMode.class, IntentEngineMode.INPROCESS))
                .tenantConfigFile(getEnv(ENV_TENANT_CONFIG_FILE, null))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static <E extends Enum<E>> E parseEnum(String value, Class<E> type, E defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<String> tenantIds = List.of(DEFAULT_TENANT_ID);
        private String redisHost = "localhost";
        private int redisPort = 6379;
        private CounterStore rateLimitStore = CounterStore.MEMORY;
        private int readLimitPerMinute = DEFAULT_READ_LIMIT;
        private int writeLimitPerMinute = DEFAULT_WRITE_LIMIT;
        private int computeLimitPerMinute = DEFAULT_COMPUTE_LIMIT;
        private LedgerStore ledgerStore = LedgerStore.MEMORY;
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = "fabric";
        private String dbUser = "fabric";
        private String dbPassword = "";
        private String cardsDir;
        private String signalsDir;
        private String adaptersDir;
        private IntentEngineMode intentEngine = IntentEngineMode.INPROCESS;
        private String tenantConfigFile;

        public Builder tenantIds(List<String> tenantIds) {
            this.tenantIds = tenantIds != null && !tenantIds.isEmpty() ? new ArrayList<>(tenantIds) : List.of(DEFAULT_TENANT_ID);
            return this;
        }

        public Builder redisHost(String redisHost) {
            this.redisHost = redisHost;
            return this;
        }

        public Builder redisPort(int redisPort) {
            this.redisPort = redisPort;
            return this;
        }

        public Builder rateLimitStore(CounterStore rateLimitStore) {
            this.rateLimitStore = Objects.requireNonNull(rateLimitStore, "rateLimitStore");
            return this;
        }

        public Builder readLimitPerMinute(int readLimitPerMinute) {
            this.readLimitPerMinute = readLimitPerMinute;
            return this;
        }

        public Builder writeLimitPerMinute(int writeLimitPerMinute) {
            this.writeLimitPerMinute = writeLimitPerMinute;
            return this;
        }

        public Builder computeLimitPerMinute(int computeLimitPerMinute) {
            this.computeLimitPerMinute = computeLimitPerMinute;
            return this;
        }

        public Builder ledgerStore(LedgerStore ledgerStore) {
            this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore");
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder cardsDir(String cardsDir) {
            this.cardsDir = cardsDir;
            return this;
        }

        public Builder signalsDir(String signalsDir) {
            this.signalsDir = signalsDir;
            return this;
        }

        public Builder adaptersDir(String adaptersDir) {
            this.adaptersDir = adaptersDir;
            return this;
        }

        public Builder intentEngine(IntentEngineMode intentEngine) {
            this.intentEngine = Objects.requireNonNull(intentEngine, "intentEngine");
            return this;
        }

        public Builder tenantConfigFile(String tenantConfigFile) {
            this.tenantConfigFile = tenantConfigFile;
            return this;
        }

        public FabricConfig build() {
            return new FabricConfig(this);
        }
    }
}
