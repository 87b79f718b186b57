package com.ac.iisc.cardinal;

import java.util.Map;
import java.util.Properties;

/**
 * Connection and execution settings for {@link PostgresExecutionAdapter}.
 *
 * Fields and defaults:
 * - host ({@code localhost}), port (5432), database ({@code cardinal_test}),
 *   user ({@code postgres}), password ({@code postgres}).
 * - statementTimeoutSeconds (30): applied to every statement; 0 disables it. This is
 *   the only bound on a query that never returns.
 * - connectTimeoutSeconds (10): driver connect timeout.
 * - sampleResultLimit (5): rows kept from a plain run for display.
 *
 * Instances are immutable; use {@link #builder()} or {@link #load()}.
 */
public final class DatabaseConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 5432;
    public static final String DEFAULT_DATABASE = "cardinal_test";
    public static final String DEFAULT_USER = "postgres";
    public static final String DEFAULT_PASSWORD = "postgres";
    public static final int DEFAULT_STATEMENT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_SAMPLE_RESULT_LIMIT = 5;

    private final String host;
    private final int port;
    private final String database;
    private final String user;
    private final String password;
    private final int statementTimeoutSeconds;
    private final int connectTimeoutSeconds;
    private final int sampleResultLimit;

    private DatabaseConfig(Builder b) {
        if (b.host == null || b.host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (b.port <= 0 || b.port > 65535) throw new IllegalArgumentException("port out of range: " + b.port);
        if (b.database == null || b.database.isBlank()) throw new IllegalArgumentException("database must not be blank");
        if (b.statementTimeoutSeconds < 0) throw new IllegalArgumentException("statementTimeoutSeconds must be >= 0");
        if (b.connectTimeoutSeconds < 0) throw new IllegalArgumentException("connectTimeoutSeconds must be >= 0");
        if (b.sampleResultLimit < 0) throw new IllegalArgumentException("sampleResultLimit must be >= 0");
        this.host = b.host;
        this.port = b.port;
        this.database = b.database;
        this.user = b.user;
        this.password = b.password;
        this.statementTimeoutSeconds = b.statementTimeoutSeconds;
        this.connectTimeoutSeconds = b.connectTimeoutSeconds;
        this.sampleResultLimit = b.sampleResultLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Settings from config.properties and the POSTGRES_* environment variables. */
    public static DatabaseConfig load() {
        return from(FileIO.getConfig(), System.getenv());
    }

    /** Settings from explicit sources; used by {@link #load()} and by tests. */
    static DatabaseConfig from(Properties props, Map<String, String> env) {
        return builder()
            .host(FileIO.resolve(props, env, FileIO.PG_HOST, DEFAULT_HOST))
            .port(FileIO.parseInt(FileIO.PG_PORT,
                FileIO.resolve(props, env, FileIO.PG_PORT, null), DEFAULT_PORT))
            .database(FileIO.resolve(props, env, FileIO.PG_DATABASE, DEFAULT_DATABASE))
            .user(FileIO.resolve(props, env, FileIO.PG_USER, DEFAULT_USER))
            .password(FileIO.resolve(props, env, FileIO.PG_PASSWORD, DEFAULT_PASSWORD))
            .statementTimeoutSeconds(FileIO.parseInt(FileIO.STATEMENT_TIMEOUT_SECONDS,
                FileIO.resolve(props, env, FileIO.STATEMENT_TIMEOUT_SECONDS, null), DEFAULT_STATEMENT_TIMEOUT_SECONDS))
            .connectTimeoutSeconds(FileIO.parseInt(FileIO.CONNECT_TIMEOUT_SECONDS,
                FileIO.resolve(props, env, FileIO.CONNECT_TIMEOUT_SECONDS, null), DEFAULT_CONNECT_TIMEOUT_SECONDS))
            .sampleResultLimit(FileIO.parseInt(FileIO.SAMPLE_RESULT_LIMIT,
                FileIO.resolve(props, env, FileIO.SAMPLE_RESULT_LIMIT, null), DEFAULT_SAMPLE_RESULT_LIMIT))
            .build();
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public int getStatementTimeoutSeconds() { return statementTimeoutSeconds; }
    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public int getSampleResultLimit() { return sampleResultLimit; }

    /** {@code jdbc:postgresql://host:port/database}, for logs and diagnostics. */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        // no password
        return "DatabaseConfig[" + getJdbcUrl() + ", user=" + user
            + ", statementTimeoutSeconds=" + statementTimeoutSeconds + "]";
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String database = DEFAULT_DATABASE;
        private String user = DEFAULT_USER;
        private String password = DEFAULT_PASSWORD;
        private int statementTimeoutSeconds = DEFAULT_STATEMENT_TIMEOUT_SECONDS;
        private int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;
        private int sampleResultLimit = DEFAULT_SAMPLE_RESULT_LIMIT;

        private Builder() {}

        public Builder host(String host) { this.host = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder database(String database) { this.database = database; return this; }
        public Builder user(String user) { this.user = user; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder statementTimeoutSeconds(int seconds) { this.statementTimeoutSeconds = seconds; return this; }
        public Builder connectTimeoutSeconds(int seconds) { this.connectTimeoutSeconds = seconds; return this; }
        public Builder sampleResultLimit(int limit) { this.sampleResultLimit = limit; return this; }

        public DatabaseConfig build() {
            return new DatabaseConfig(this);
        }
    }
}
