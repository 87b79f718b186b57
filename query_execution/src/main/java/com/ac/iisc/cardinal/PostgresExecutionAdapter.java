package com.ac.iisc.cardinal;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import javax.sql.DataSource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.postgresql.ds.PGSimpleDataSource;

/**
 * {@link ExecutionAdapter} over the PostgreSQL JDBC driver.
 *
 * Key features:
 * - Opens a fresh connection per call (try-with-resources closes it on every path),
 *   so the adapter holds no per-query state and can serve many worker threads.
 * - Plans are obtained with EXPLAIN (FORMAT JSON); the analyzed variant adds
 *   ANALYZE and BUFFERS and therefore really executes the statement.
 * - Every statement gets the configured query timeout; a statement that exceeds it
 *   fails with the driver's cancellation error instead of blocking its worker forever.
 * - Hinted execution prefixes the directive to the SQL text; pg_hint_plan must be
 *   loaded on the server for the directive to have any effect. Only a failure to
 *   connect is reported with the "Failed to execute with hints" prefix.
 */
public class PostgresExecutionAdapter implements ExecutionAdapter {

    private static final Logger LOGGER = LogManager.getLogger(PostgresExecutionAdapter.class);

    static final String EXPLAIN = "EXPLAIN (FORMAT JSON) ";
    static final String EXPLAIN_ANALYZE = "EXPLAIN (ANALYZE true, BUFFERS true, FORMAT JSON) ";
    static final String HINTED_CONNECT_FAILURE = "Failed to execute with hints: ";

    private final DatabaseConfig config;
    private final DataSource dataSource;

    public PostgresExecutionAdapter(DatabaseConfig config) {
        this(config, createDataSource(config));
    }

    /** Use an externally managed data source (e.g. a pool); {@code config} still supplies timeouts. */
    public PostgresExecutionAdapter(DatabaseConfig config, DataSource dataSource) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        if (dataSource == null) throw new IllegalArgumentException("dataSource must not be null");
        this.config = config;
        this.dataSource = dataSource;
    }

    private static DataSource createDataSource(DatabaseConfig config) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        PGSimpleDataSource ds = new PGSimpleDataSource();
        ds.setServerNames(new String[] { config.getHost() });
        ds.setPortNumbers(new int[] { config.getPort() });
        ds.setDatabaseName(config.getDatabase());
        ds.setUser(config.getUser());
        ds.setPassword(config.getPassword());
        ds.setConnectTimeout(config.getConnectTimeoutSeconds());
        ds.setApplicationName("cardinal");
        return ds;
    }

    @Override
    public ExecutionResult planOnly(String query) {
        return explain(query, false, "");
    }

    @Override
    public ExecutionResult planAndAnalyze(String query) {
        return explain(query, true, "");
    }

    @Override
    public ExecutionResult run(String query) {
        if (query == null || query.isBlank()) return ExecutionResult.failure(query, "query is empty");

        try (Connection conn = dataSource.getConnection();
             Statement st = createStatement(conn)) {
            long start = System.nanoTime();
            boolean hasResultSet = st.execute(query);
            int rowCount = 0;
            List<List<Object>> sample = new ArrayList<>();
            if (hasResultSet) {
                try (ResultSet rs = st.getResultSet()) {
                    int columns = rs.getMetaData().getColumnCount();
                    while (rs.next()) {
                        if (sample.size() < config.getSampleResultLimit()) {
                            sample.add(readRow(rs, columns));
                        }
                        rowCount++;
                    }
                }
            } else {
                rowCount = Math.max(st.getUpdateCount(), 0);
            }
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

            return ExecutionResult.success(query)
                .executionTimeMs(round2(elapsedMs))
                .rowCount(rowCount)
                .sampleRows(sample)
                .build();
        } catch (SQLException e) {
            LOGGER.debug("Query failed: {}", e.getMessage());
            return ExecutionResult.failure(query, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.warn("Unexpected failure while running query", e);
            return ExecutionResult.failure(query, e.toString());
        }
    }

    @Override
    public ExecutionResult runWithDirective(String query, String directive) {
        String hints = directive == null ? "" : directive;
        String hintedQuery = hints + "\n" + query;

        ExecutionResult analyzed = explain(hintedQuery, true, HINTED_CONNECT_FAILURE);
        if (!analyzed.isSuccess()) {
            return ExecutionResult.failure(query, analyzed.getError(), hints);
        }
        return ExecutionResult.success(analyzed.getQuery())
            .hints(hints)
            .executionPlan(analyzed.getExecutionPlan())
            .analyzed(true)
            .explainTimeMs(analyzed.getExplainTimeMs())
            .actualTotalTime(analyzed.getActualTotalTime())
            .actualRows(analyzed.getActualRows())
            .planningTime(analyzed.getPlanningTime())
            .executionTime(analyzed.getExecutionTime())
            .build();
    }

    /**
     * Run EXPLAIN (optionally ANALYZE) and lift the fields the harness reports.
     *
     * Expected shape from PostgreSQL: [ { "Plan": { ... }, "Planning Time": ..., "Execution Time": ... } ]
     *
     * @param connectFailurePrefix prepended to the error when no connection could be opened;
     *                             errors raised by the statement itself are reported as is
     */
    private ExecutionResult explain(String query, boolean analyze, String connectFailurePrefix) {
        if (query == null || query.isBlank()) return ExecutionResult.failure(query, "query is empty");

        try (Connection conn = dataSource.getConnection()) {
            return explainOn(conn, query, analyze);
        } catch (SQLException e) {
            LOGGER.debug("Connection failed: {}", e.getMessage());
            return ExecutionResult.failure(query, connectFailurePrefix + e.getMessage());
        }
    }

    private ExecutionResult explainOn(Connection conn, String query, boolean analyze) {
        String explainQuery = (analyze ? EXPLAIN_ANALYZE : EXPLAIN) + query;
        try (Statement st = createStatement(conn)) {
            long start = System.nanoTime();
            JSONObject root;
            try (ResultSet rs = st.executeQuery(explainQuery)) {
                if (!rs.next()) {
                    return ExecutionResult.failure(query, "EXPLAIN returned no rows");
                }
                root = firstExplainObject(rs.getString(1));
            }
            double explainMs = (System.nanoTime() - start) / 1_000_000.0;

            if (root == null) {
                return ExecutionResult.failure(query, "EXPLAIN output has an unexpected shape");
            }
            JSONObject plan = root.optJSONObject(PlanParser.PLAN);
            if (plan == null) {
                return ExecutionResult.failure(query, "EXPLAIN output has no 'Plan' object");
            }

            ExecutionResult.Builder b = ExecutionResult.success(query)
                .executionPlan(root)
                .analyzed(analyze)
                .explainTimeMs(round2(explainMs))
                .planningTime(PlanParser.optDouble(root, "Planning Time"));
            if (analyze) {
                b.actualTotalTime(PlanParser.optDouble(plan, PlanParser.ACTUAL_TOTAL_TIME))
                 .actualRows(PlanParser.optDouble(plan, PlanParser.ACTUAL_ROWS))
                 .executionTime(PlanParser.optDouble(root, "Execution Time"));
            } else {
                b.estimatedCost(PlanParser.optDouble(plan, PlanParser.TOTAL_COST))
                 .estimatedRows(PlanParser.optDouble(plan, PlanParser.PLAN_ROWS));
            }
            return b.build();
        } catch (SQLException e) {
            LOGGER.debug("EXPLAIN failed: {}", e.getMessage());
            return ExecutionResult.failure(query, e.getMessage());
        } catch (JSONException e) {
            return ExecutionResult.failure(query, "Unreadable EXPLAIN output: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.warn("Unexpected failure while explaining query", e);
            return ExecutionResult.failure(query, e.toString());
        }
    }

    private Statement createStatement(Connection conn) throws SQLException {
        Statement st = conn.createStatement();
        if (config.getStatementTimeoutSeconds() > 0) {
            st.setQueryTimeout(config.getStatementTimeoutSeconds());
        }
        return st;
    }

    private static JSONObject firstExplainObject(String json) {
        if (json == null) return null;
        JSONArray arr = new JSONArray(json);
        if (arr.isEmpty()) return null;
        return arr.optJSONObject(0);
    }

    private static List<Object> readRow(ResultSet rs, int columns) throws SQLException {
        List<Object> row = new ArrayList<>(columns);
        for (int c = 1; c <= columns; c++) {
            Object v = rs.getObject(c);
            // keep samples printable and detached from the connection
            row.add(v == null || v instanceof Number || v instanceof Boolean ? v : String.valueOf(v));
        }
        return row;
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
