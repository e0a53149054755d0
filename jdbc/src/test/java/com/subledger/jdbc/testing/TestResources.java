package com.subledger.jdbc.testing;

import com.subledger.jdbc.feed.FeedLoader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/** Extracts feed directories packaged under {@code feeds/} on the test classpath. */
public final class TestResources {

    private static final List<String> FEED_FILES =
            List.of(
                    FeedLoader.TRADES,
                    FeedLoader.POSITIONS,
                    FeedLoader.VALUATIONS,
                    FeedLoader.MTM_SERIES,
                    FeedLoader.THIN_LEDGER);

    private TestResources() {}

    public static Path feedDirectory(String name) {
        try {
            Path dir = Files.createTempDirectory("subledger_feeds_" + name);
            dir.toFile().deleteOnExit();
            for (String file : FEED_FILES) {
                copyIfPresent("feeds/" + name + "/" + file, dir.resolve(file));
            }
            return dir;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to extract feeds: " + name, ex);
        }
    }

    /** Escaped for use inside a JSON model string. */
    public static String jsonPath(Path path) {
        return path.toAbsolutePath().toString().replace("\\", "\\\\");
    }

    private static void copyIfPresent(String resourceName, Path target) throws IOException {
        try (InputStream in = TestResources.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                return;
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
        }
    }
}
