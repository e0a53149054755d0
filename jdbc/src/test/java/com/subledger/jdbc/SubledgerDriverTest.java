package com.subledger.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.subledger.jdbc.testing.TestResources;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import org.junit.jupiter.api.Test;

final class SubledgerDriverTest {

    private static final String SAMPLE = TestResources.feedDirectory("sample").toString();

    @Test
    void oversoldSellSurfacesAsConnectionWarning() throws Exception {
        Class.forName("com.subledger.jdbc.SubledgerDriver");
        try (Connection connection = DriverManager.getConnection("jdbc:subledger:" + SAMPLE)) {
            SQLWarning warning = connection.getWarnings();
            assertNotNull(warning, "Expected the oversold sell to be reported");
            boolean found = false;
            for (SQLWarning w = warning; w != null; w = w.getNextWarning()) {
                found |= w.getMessage().contains("T008");
            }
            assertTrue(found);
            connection.clearWarnings();
            assertNull(connection.getWarnings());
        }
    }

    @Test
    void urlParametersBecomeRunOptions() throws Exception {
        Class.forName("com.subledger.jdbc.SubledgerDriver");
        try (Connection connection =
                        DriverManager.getConnection("jdbc:subledger:" + SAMPLE + "?subledger.asOfDate=2025-01-07");
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM oversold_sells")) {
            assertTrue(rs.next());
            assertEquals(0, rs.getInt(1));
        }
    }

    @Test
    void executesScriptReturningLastResult() throws Exception {
        Class.forName("com.subledger.jdbc.SubledgerDriver");
        try (Connection connection = DriverManager.getConnection("jdbc:subledger:" + SAMPLE);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT 1; SELECT COUNT(*) FROM open_trades;")) {
            assertTrue(rs.next(), "Expected a row from the final SELECT");
            assertEquals(3, rs.getInt(1));
            assertFalse(rs.next());
        }
    }

    @Test
    void metadataNamesTheProduct() throws Exception {
        Class.forName("com.subledger.jdbc.SubledgerDriver");
        try (Connection connection = DriverManager.getConnection("jdbc:subledger:" + SAMPLE)) {
            assertEquals("Subledger", connection.getMetaData().getDatabaseProductName());
            assertEquals(Version.RUNTIME, connection.getMetaData().getDriverVersion());
        }
    }

    @Test
    void rejectsMissingDirectoryAndBadOptions() throws Exception {
        Class.forName("com.subledger.jdbc.SubledgerDriver");
        assertThrows(SQLException.class, () -> DriverManager.getConnection("jdbc:subledger:/no/such/feeds"));
        assertThrows(
                SQLException.class,
                () -> DriverManager.getConnection("jdbc:subledger:" + SAMPLE + "?subledger.oversellPolicy=SKIP"));
        assertThrows(
                SQLException.class,
                () -> DriverManager.getConnection("jdbc:subledger:" + SAMPLE + "?subledger.oversellPolicy=REJECT"));
    }
}
