package com.subledger.jdbc.calcite;

import com.subledger.engine.SubledgerResult;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Helper for opening Calcite connections that are pre-wired with a subledger run as the default
 * schema {@value #SCHEMA_NAME}.
 */
public final class CalciteConnectionFactory {

    public static final String SCHEMA_NAME = "subledger";

    private CalciteConnectionFactory() {}

    public static Connection connect(SubledgerResult result, Properties properties) throws SQLException {
        Objects.requireNonNull(result, "result");
        Properties calciteProps = new Properties();
        if (properties != null) {
            for (String key : properties.stringPropertyNames()) {
                calciteProps.setProperty(key, properties.getProperty(key));
            }
        }
        setDefault(calciteProps, "lex", "JAVA");
        setDefault(calciteProps, "quoting", "DOUBLE_QUOTE");
        setDefault(calciteProps, "quotedCasing", "UNCHANGED");
        setDefault(calciteProps, "unquotedCasing", "UNCHANGED");
        setDefault(calciteProps, "caseSensitive", "true");
        setDefault(calciteProps, "parserFactory", "org.apache.calcite.server.ServerDdlExecutor#PARSER_FACTORY");
        setDefault(calciteProps, "conformance", "BABEL");
        setDefault(calciteProps, "mutable", "true");

        Connection connection = DriverManager.getConnection("jdbc:calcite:", calciteProps);
        CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
        SchemaPlus root = calcite.getRootSchema();
        root.add(SCHEMA_NAME, new SubledgerSchema(root, SCHEMA_NAME, result));
        calcite.setSchema(SCHEMA_NAME);
        return connection;
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }
}
