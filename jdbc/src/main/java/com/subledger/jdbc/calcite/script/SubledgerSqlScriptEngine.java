package com.subledger.jdbc.calcite.script;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.calcite.config.CalciteConnectionConfig;
import org.apache.calcite.sql.SqlDialect;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.SqlParserImplFactory;
import org.apache.calcite.sql.parser.impl.SqlParserImpl;

/**
 * Splits a control script into statements with Calcite's stmt-list parser, so semicolons separate
 * statements and a trailing semicolon is optional. Each statement is unparsed back to SQL for
 * execution on the same connection.
 */
public final class SubledgerSqlScriptEngine {

    private final CalciteConnectionConfig config;
    private final SqlDialect dialect;

    public SubledgerSqlScriptEngine(CalciteConnectionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.dialect = SqlDialect.DatabaseProduct.CALCITE.getDialect();
    }

    public List<ScriptStatement> parse(String sql) throws SQLException {
        Objects.requireNonNull(sql, "sql");
        try {
            SqlNodeList stmtList = SqlParser.create(sql, parserConfig()).parseStmtList();
            List<ScriptStatement> statements = new ArrayList<>(stmtList.size());
            for (SqlNode node : stmtList) {
                if (node != null) {
                    statements.add(new ScriptStatement(node.toSqlString(dialect).getSql(), isQuery(node)));
                }
            }
            if (statements.isEmpty()) {
                throw new SQLException("SQL script contained no statements.");
            }
            return statements;
        } catch (SqlParseException ex) {
            throw new SQLException("Failed to parse SQL script: " + ex.getMessage(), ex);
        }
    }

    private SqlParser.Config parserConfig() {
        SqlParserImplFactory parserFactory = config.parserFactory(SqlParserImplFactory.class, SqlParserImpl.FACTORY);
        return SqlParser.config()
                .withCaseSensitive(config.caseSensitive())
                .withQuotedCasing(config.quotedCasing())
                .withUnquotedCasing(config.unquotedCasing())
                .withQuoting(config.quoting())
                .withConformance(config.conformance())
                .withParserFactory(parserFactory);
    }

    private static boolean isQuery(SqlNode node) {
        return node.getKind().belongsTo(SqlKind.QUERY);
    }

    public record ScriptStatement(String sql, boolean query) {}
}
