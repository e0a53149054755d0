package com.subledger.testing;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class TestResources {

    private TestResources() {}

    /** Non-blank lines of a classpath resource, header included. */
    public static List<String> readLines(String resourceName) {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(normalized)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + normalized);
            }
            List<String> lines = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!line.isBlank()) {
                        lines.add(line);
                    }
                }
            }
            return lines;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + normalized, ex);
        }
    }

    /** Data rows of a comma separated fixture, split into cells; the header line is skipped. */
    public static List<String[]> readCsv(String resourceName) {
        List<String> lines = readLines(resourceName);
        List<String[]> rows = new ArrayList<>(Math.max(0, lines.size() - 1));
        for (int i = 1; i < lines.size(); i++) {
            rows.add(lines.get(i).split(",", -1));
        }
        return rows;
    }
}
