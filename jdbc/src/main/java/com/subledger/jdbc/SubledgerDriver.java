package com.subledger.jdbc;

import com.subledger.engine.SubledgerEngine;
import com.subledger.engine.SubledgerException;
import com.subledger.engine.SubledgerInput;
import com.subledger.engine.SubledgerMessage;
import com.subledger.engine.SubledgerOptions;
import com.subledger.engine.SubledgerResult;
import com.subledger.jdbc.calcite.CalciteConnectionFactory;
import com.subledger.jdbc.calcite.script.SubledgerSqlScriptEngine;
import com.subledger.jdbc.feed.FeedLoader;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.calcite.config.CalciteConnectionConfig;
import org.apache.calcite.jdbc.CalciteConnection;

/**
 * JDBC driver that runs the subledger over a directory of staging feeds and opens a Calcite
 * connection on the result.
 *
 * <pre>
 *   jdbc:subledger:/path/to/feeds?subledger.asOfDate=2025-01-08&amp;subledger.parallelism=4
 * </pre>
 *
 * URL parameters and connection properties named {@code subledger.*} become run options. Run
 * diagnostics at WARNING or ERROR level are attached to the connection as {@link SQLWarning}s.
 */
public final class SubledgerDriver implements Driver {

    static final String URL_PREFIX = "jdbc:subledger:";
    private static final Logger LOGGER = Logger.getLogger(SubledgerDriver.class.getName());

    static {
        try {
            DriverManager.registerDriver(new SubledgerDriver());
        } catch (SQLException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        ParsedUrl parsed = parseUrl(url);
        Properties properties = new Properties();
        if (info != null) {
            for (String key : info.stringPropertyNames()) {
                properties.setProperty(key, info.getProperty(key));
            }
        }
        properties.putAll(parsed.properties());
        SubledgerResult result;
        try {
            SubledgerInput input = FeedLoader.load(parsed.feedDirectory());
            result = new SubledgerEngine(SubledgerOptions.fromProperties(properties)).run(input);
        } catch (SubledgerException ex) {
            throw new SQLException("Failed to run subledger over feeds: " + parsed.feedDirectory(), ex);
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Invalid subledger option: " + ex.getMessage(), ex);
        }
        Connection connection = CalciteConnectionFactory.connect(result, properties);
        logWarnings(result, parsed.feedDirectory());
        return wrapCalciteConnection(connection, buildWarningChain(result, parsed.feedDirectory()));
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        DriverPropertyInfo asOf = new DriverPropertyInfo(SubledgerOptions.AS_OF_DATE, null);
        asOf.description = "ISO cut-off date for trades and feeds.";
        DriverPropertyInfo parallelism = new DriverPropertyInfo(SubledgerOptions.PARALLELISM, "1");
        parallelism.description = "Worker threads used per position group.";
        DriverPropertyInfo tolerance = new DriverPropertyInfo(SubledgerOptions.TOLERANCE, "0.000001");
        tolerance.description = "Absolute difference above which a control row is a break.";
        return new DriverPropertyInfo[] {asOf, parallelism, tolerance};
    }

    @Override
    public int getMajorVersion() {
        return Version.MAJOR;
    }

    @Override
    public int getMinorVersion() {
        return Version.MINOR;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    private static ParsedUrl parseUrl(String url) throws SQLException {
        String remainder = url.substring(URL_PREFIX.length());
        if (remainder.isEmpty()) {
            throw new SQLException("Feed directory missing from JDBC URL.");
        }
        String feedSegment = remainder;
        Properties props = new Properties();
        int paramIndex = remainder.indexOf('?');
        if (paramIndex >= 0) {
            feedSegment = remainder.substring(0, paramIndex);
            for (String pair : remainder.substring(paramIndex + 1).split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                if (eq >= 0) {
                    props.setProperty(pair.substring(0, eq), pair.substring(eq + 1));
                } else {
                    props.setProperty(pair, "");
                }
            }
        }
        Path feedDirectory;
        if (feedSegment.startsWith("file:")) {
            try {
                feedDirectory = Paths.get(java.net.URI.create(feedSegment));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + feedSegment, ex);
            }
        } else {
            feedDirectory = Paths.get(feedSegment);
        }
        feedDirectory = feedDirectory.toAbsolutePath().normalize();
        if (!Files.isDirectory(feedDirectory)) {
            throw new SQLException("Feed directory not found: " + feedDirectory);
        }
        return new ParsedUrl(feedDirectory, props);
    }

    private Connection wrapCalciteConnection(Connection delegate, SQLWarning warnings) throws SQLException {
        CalciteConnection calcite = delegate.unwrap(CalciteConnection.class);
        return (Connection)
                Proxy.newProxyInstance(
                        Connection.class.getClassLoader(),
                        new Class<?>[] {Connection.class},
                        new DelegatingHandler(delegate) {
                            private SQLWarning localWarnings = warnings;

                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getMetaData" -> wrapMetaData((DatabaseMetaData) invokeDelegate(method, args));
                                    case "createStatement" -> wrapStatement(
                                            (Statement) invokeDelegate(method, args), calcite.config(), (Connection) proxy);
                                    case "getWarnings" -> localWarnings;
                                    case "clearWarnings" -> {
                                        localWarnings = null;
                                        yield null;
                                    }
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    private DatabaseMetaData wrapMetaData(DatabaseMetaData delegate) {
        return (DatabaseMetaData)
                Proxy.newProxyInstance(
                        DatabaseMetaData.class.getClassLoader(),
                        new Class<?>[] {DatabaseMetaData.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getDatabaseProductName" -> "Subledger";
                                    case "getDatabaseProductVersion", "getDriverVersion" -> Version.RUNTIME;
                                    case "getDriverName" -> "Subledger JDBC Driver (Calcite)";
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    private Statement wrapStatement(Statement delegate, CalciteConnectionConfig config, Connection owningConnection) {
        SubledgerSqlScriptEngine scriptEngine = new SubledgerSqlScriptEngine(config);
        return (Statement)
                Proxy.newProxyInstance(
                        Statement.class.getClassLoader(),
                        new Class<?>[] {Statement.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                if (isExecuteWithSql(method, args)) {
                                    return executeScript(delegate, method, args, scriptEngine);
                                } else if ("getConnection".equals(method.getName())) {
                                    return owningConnection;
                                }
                                return super.handle(proxy, method, args);
                            }
                        });
    }

    private static boolean isExecuteWithSql(Method method, Object[] args) {
        if (args == null || args.length == 0 || !(args[0] instanceof String)) {
            return false;
        }
        return switch (method.getName()) {
            case "execute", "executeQuery", "executeUpdate", "executeLargeUpdate" -> true;
            default -> false;
        };
    }

    private static Object executeScript(
            Statement delegate, Method method, Object[] args, SubledgerSqlScriptEngine scriptEngine)
            throws Throwable {
        List<SubledgerSqlScriptEngine.ScriptStatement> statements = scriptEngine.parse((String) args[0]);
        SubledgerSqlScriptEngine.ScriptStatement last = statements.get(statements.size() - 1);
        // Leading statements run for their side effects only.
        for (int i = 0; i < statements.size() - 1; i++) {
            if (delegate.execute(statements.get(i).sql())) {
                delegate.getResultSet().close();
            }
        }
        Object[] adjustedArgs = args.clone();
        adjustedArgs[0] = last.sql();
        return switch (method.getName()) {
            case "executeQuery" -> {
                if (!last.query()) {
                    throw new SQLException("executeQuery() requires the final statement to be a query.");
                }
                yield invoke(delegate, method, adjustedArgs);
            }
            case "executeUpdate", "executeLargeUpdate" -> {
                if (last.query()) {
                    throw new SQLException(method.getName() + " cannot be used when the final statement is a query.");
                }
                yield invoke(delegate, method, adjustedArgs);
            }
            default -> invoke(delegate, method, adjustedArgs);
        };
    }

    private static SQLWarning buildWarningChain(SubledgerResult result, Path feedDirectory) {
        SQLWarning head = null;
        SQLWarning tail = null;
        for (SubledgerMessage message : result.getMessages()) {
            if (message.getLevel() == SubledgerMessage.Level.INFO) {
                continue;
            }
            SQLWarning warning =
                    new SQLWarning(
                            "[Subledger " + message.getLevel() + "] " + message.getMessage() + " ("
                                    + message.getSubject() + ", " + feedDirectory.getFileName() + ")");
            if (head == null) {
                head = warning;
            } else {
                tail.setNextWarning(warning);
            }
            tail = warning;
        }
        return head;
    }

    private static void logWarnings(SubledgerResult result, Path feedDirectory) {
        int breaks = result.breakCount();
        if (breaks > 0) {
            LOGGER.log(
                    Level.WARNING,
                    "[Subledger] {0} control breaks in run over {1}",
                    new Object[] {breaks, feedDirectory.getFileName()});
        }
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException ex) {
            throw ex.getCause();
        }
    }

    private record ParsedUrl(Path feedDirectory, Properties properties) {}

    private abstract static class DelegatingHandler implements InvocationHandler {
        private final Object delegate;

        DelegatingHandler(Object delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return SubledgerDriver.invoke(delegate, method, args);
            }
            return handle(proxy, method, args);
        }

        Object invokeDelegate(Method method, Object[] args) throws Throwable {
            return SubledgerDriver.invoke(delegate, method, args);
        }

        Object handle(Object proxy, Method method, Object[] args) throws Throwable {
            return invokeDelegate(method, args);
        }
    }
}
