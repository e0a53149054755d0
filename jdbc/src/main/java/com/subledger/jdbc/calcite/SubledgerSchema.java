package com.subledger.jdbc.calcite;

import com.subledger.engine.SubledgerEngine;
import com.subledger.engine.SubledgerException;
import com.subledger.engine.SubledgerInput;
import com.subledger.engine.SubledgerOptions;
import com.subledger.engine.SubledgerResult;
import com.subledger.jdbc.feed.FeedLoader;
import com.subledger.schema.ControlTables;
import com.subledger.schema.GlPostingsTable;
import com.subledger.schema.SubledgerTables;
import com.subledger.schema.TableDefinition;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.apache.calcite.schema.impl.ViewTable;

/**
 * Calcite schema over one completed subledger run: every record set is a table, and the ledger
 * reconciliations that are naturally expressed in SQL are views over {@code gl_postings} and the
 * control tables.
 *
 * <p>The run is either handed over directly, looked up in {@link SubledgerRunRegistry} (operand
 * {@code run}), or computed on first access from a feed directory (operand {@code feeds}, with any
 * {@code subledger.*} operand entries forwarded as run options).
 */
public final class SubledgerSchema extends AbstractSchema {

    public static final String JOURNAL_DAILY_TOTALS = "journal_daily_totals";
    public static final String LEDGER_REBUILD = "ledger_rebuild";
    public static final String CONTROL_BREAKS = "control_breaks";

    private static final String SIGNED_AMOUNT =
            "CASE WHEN \"dr_cr\" = 'DR' THEN \"amount\" ELSE -\"amount\" END";
    private static final Map<String, String> VIEW_SQL = buildViewSql();

    private final SchemaPlus parentSchema;
    private final String schemaName;
    private final Map<String, Object> operand;
    private volatile SubledgerResult result;
    private volatile Map<String, Table> tables;
    private volatile SchemaPlus schemaPlus;
    private final Object viewLock = new Object();
    private volatile boolean viewsRegistered;

    SubledgerSchema(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        this.parentSchema = Objects.requireNonNull(parentSchema, "parentSchema");
        this.schemaName = Objects.requireNonNull(name, "name");
        this.operand = Map.copyOf(Objects.requireNonNull(operand, "operand"));
        if (!this.operand.containsKey("run") && !this.operand.containsKey("feeds")) {
            throw new IllegalArgumentException("Subledger schema operand must include 'run' or 'feeds'");
        }
    }

    SubledgerSchema(SchemaPlus parentSchema, String name, SubledgerResult result) {
        this.parentSchema = Objects.requireNonNull(parentSchema, "parentSchema");
        this.schemaName = Objects.requireNonNull(name, "name");
        this.operand = Map.of();
        this.result = Objects.requireNonNull(result, "result");
    }

    public SubledgerResult getResult() {
        return loadResult();
    }

    @Override
    protected Map<String, Table> getTableMap() {
        Map<String, Table> local = tables;
        if (local == null) {
            local = buildTables();
        }
        return local;
    }

    private Map<String, Table> buildTables() {
        Map<String, TableDefinition> definitions = SubledgerTables.definitions();
        Map<String, List<Object[]>> rows = SubledgerTables.materialize(loadResult());
        Map<String, Table> map = new LinkedHashMap<>();
        for (Map.Entry<String, TableDefinition> entry : definitions.entrySet()) {
            map.put(entry.getKey(), new RowsCalciteTable(entry.getValue(), rows.get(entry.getKey())));
        }
        Map<String, Table> immutable = Map.copyOf(map);
        this.tables = immutable;
        registerViews();
        return immutable;
    }

    private SubledgerResult loadResult() {
        SubledgerResult current = result;
        if (current == null) {
            synchronized (this) {
                current = result;
                if (current == null) {
                    current = resolveResult(operand);
                    result = current;
                }
            }
        }
        return current;
    }

    private static SubledgerResult resolveResult(Map<String, Object> operand) {
        Object run = operand.get("run");
        if (run != null) {
            SubledgerResult registered = SubledgerRunRegistry.get(run.toString());
            if (registered == null) {
                throw new IllegalStateException("No subledger run registered under '" + run + "'");
            }
            return registered;
        }
        Path feeds = Paths.get(operand.get("feeds").toString()).toAbsolutePath().normalize();
        Properties properties = new Properties();
        for (Map.Entry<String, Object> entry : operand.entrySet()) {
            if (entry.getKey().startsWith(SubledgerOptions.PREFIX)) {
                properties.setProperty(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }
        try {
            SubledgerInput input = FeedLoader.load(feeds);
            return new SubledgerEngine(SubledgerOptions.fromProperties(properties)).run(input);
        } catch (SubledgerException ex) {
            throw new IllegalStateException("Failed to run subledger over feeds: " + feeds, ex);
        }
    }

    private void registerViews() {
        if (viewsRegistered) {
            return;
        }
        synchronized (viewLock) {
            if (viewsRegistered) {
                return;
            }
            viewsRegistered = true;
            SchemaPlus schema = resolveSchemaPlus();
            List<String> schemaPath = buildSchemaPath(schema);
            for (Map.Entry<String, String> entry : VIEW_SQL.entrySet()) {
                List<String> viewPath = new ArrayList<>(schemaPath);
                viewPath.add(entry.getKey());
                try {
                    var macro = ViewTable.viewMacro(schema, entry.getValue(), schemaPath, viewPath, Boolean.FALSE);
                    macro.apply(Collections.emptyList());
                    schema.add(entry.getKey(), macro);
                } catch (RuntimeException ex) {
                    viewsRegistered = false;
                    throw new IllegalStateException(
                            "Failed to register Calcite view '" + entry.getKey() + "' with SQL:\n" + entry.getValue(),
                            ex);
                }
            }
        }
    }

    private SchemaPlus resolveSchemaPlus() {
        SchemaPlus local = schemaPlus;
        if (local == null) {
            local = parentSchema.getSubSchema(schemaName);
            if (local == null) {
                throw new IllegalStateException("Schema not registered yet: " + schemaName);
            }
            schemaPlus = local;
        }
        return local;
    }

    private static List<String> buildSchemaPath(SchemaPlus schema) {
        List<String> path = new ArrayList<>();
        SchemaPlus current = schema;
        while (current != null) {
            String name = current.getName();
            if (name != null && !name.isEmpty()) {
                path.add(0, name);
            }
            current = current.getParentSchema();
        }
        return List.copyOf(path);
    }

    private static Map<String, String> buildViewSql() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(
                JOURNAL_DAILY_TOTALS,
                """
                SELECT "posting_date", "currency",
                       SUM(CASE WHEN "dr_cr" = 'DR' THEN "amount" ELSE 0 END) AS "total_dr",
                       SUM(CASE WHEN "dr_cr" = 'CR' THEN "amount" ELSE 0 END) AS "total_cr",
                       SUM(%s) AS "net"
                FROM %s
                GROUP BY "posting_date", "currency"
                """
                        .formatted(SIGNED_AMOUNT, quoteIdentifier(GlPostingsTable.NAME)));
        map.put(
                LEDGER_REBUILD,
                """
                SELECT "posting_date", "account_code", "currency", "day_change",
                       SUM("day_change") OVER (
                           PARTITION BY "account_code", "currency"
                           ORDER BY "posting_date"
                           ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW) AS "balance"
                FROM (
                    SELECT "posting_date", "account_code", "currency", SUM(%s) AS "day_change"
                    FROM %s
                    GROUP BY "posting_date", "account_code", "currency") AS d
                """
                        .formatted(SIGNED_AMOUNT, quoteIdentifier(GlPostingsTable.NAME)));
        map.put(CONTROL_BREAKS, buildControlBreaksSql());
        return Collections.unmodifiableMap(map);
    }

    private static String buildControlBreaksSql() {
        StringBuilder sql = new StringBuilder();
        for (TableDefinition control : ControlTables.getDefinitions()) {
            if (sql.length() > 0) {
                sql.append("\nUNION ALL\n");
            }
            sql.append("SELECT CAST('")
                    .append(control.getName())
                    .append("' AS VARCHAR(64)) AS \"control_name\", \"difference\", \"status\" FROM ")
                    .append(quoteIdentifier(control.getName()))
                    .append(" WHERE \"status\" <> 'MATCHED'");
        }
        return sql.toString();
    }

    private static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
