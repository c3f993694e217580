package com.eventfunnel.analytics.pipeline;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * Opens a newline-delimited JSON event log, plain or gzip-compressed ({@code .gz}), as a lazy line stream.
 * The caller owns the stream and must close it.
 */
public final class EventLogReader {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(EventLogReader.class);

    private EventLogReader() {}

    public static Stream<String> lines(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Event log not found: " + path);
        }
        InputStream in = null;
        try {
            in = Files.newInputStream(path);
            if (path.getFileName().toString().endsWith(".gz")) {
                in = new GZIPInputStream(in);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            LOG.info("Reading event log {}", path);
            return reader.lines().onClose(() -> close(reader, path));
        } catch (IOException ex) {
            if (in != null) {
                try {
                    in.close();
                } catch (IOException suppressed) {
                    ex.addSuppressed(suppressed);
                }
            }
            throw new IllegalStateException("Failed to open event log: " + path, ex);
        }
    }

    private static void close(BufferedReader reader, Path path) {
        try {
            reader.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to close event log: " + path, ex);
        }
    }
}
