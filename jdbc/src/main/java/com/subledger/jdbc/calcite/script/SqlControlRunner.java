package com.subledger.jdbc.calcite.script;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.apache.calcite.jdbc.CalciteConnection;

/**
 * Executes a SQL control script against a subledger connection and collects the rows of every
 * query in it. A control query is expected to return exceptions only, so any returned row is
 * logged as a break.
 */
public final class SqlControlRunner {

    private static final Logger LOGGER = Logger.getLogger(SqlControlRunner.class.getName());

    private final Connection connection;
    private final SubledgerSqlScriptEngine scriptEngine;

    public SqlControlRunner(Connection connection) throws SQLException {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.scriptEngine = new SubledgerSqlScriptEngine(connection.unwrap(CalciteConnection.class).config());
    }

    public List<QueryResult> run(String script) throws SQLException {
        List<QueryResult> results = new ArrayList<>();
        for (SubledgerSqlScriptEngine.ScriptStatement statement : scriptEngine.parse(script)) {
            try (Statement jdbc = connection.createStatement()) {
                if (!statement.query()) {
                    jdbc.execute(statement.sql());
                    continue;
                }
                try (ResultSet rs = jdbc.executeQuery(statement.sql())) {
                    QueryResult result = collect(statement.sql(), rs);
                    if (!result.rows().isEmpty()) {
                        LOGGER.warning("Control query returned " + result.rows().size() + " rows: " + statement.sql());
                    }
                    results.add(result);
                }
            }
        }
        return results;
    }

    private static QueryResult collect(String sql, ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return new QueryResult(sql, List.copyOf(rows));
    }

    /** Rows of one query, each keyed by column label in select-list order. */
    public record QueryResult(String sql, List<Map<String, Object>> rows) {
        public boolean isClean() {
            return rows.isEmpty();
        }
    }
}
