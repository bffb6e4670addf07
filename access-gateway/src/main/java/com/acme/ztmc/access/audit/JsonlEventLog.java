package com.acme.ztmc.access.audit;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Append-only JSONL event log on a single file.
 *
 * <p>Each entry is encoded up front and written to the file stream in one unbuffered call, so a
 * failed append leaves nothing behind that a later close could flush. With {@code fsync} enabled
 * the file descriptor is synced as well. A failed write closes the stream; the next attempt
 * reopens the file in append mode and starts on a fresh line, so a torn tail stays one malformed
 * line that readers skip.</p>
 */
public final class JsonlEventLog implements EventLog {
    private static final Logger LOG = Logger.getLogger(JsonlEventLog.class.getName());
    private static final byte[] NEWLINE = {'\n'};

    private final Path file;
    private final boolean fsync;

    private FileOutputStream outputStream;
    private boolean tornTail;

    public JsonlEventLog(Path file, boolean fsync) {
        this.file = Objects.requireNonNull(file, "file");
        this.fsync = fsync;
    }

    @Override
    public void append(EventLogEntry entry) throws IOException {
        byte[] line = (EventLogCodec.toJsonLine(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            ensureOpen();
            if (tornTail) {
                outputStream.write(NEWLINE);
                tornTail = false;
            }
            outputStream.write(line);
            if (fsync) {
                outputStream.getFD().sync();
            }
        } catch (IOException e) {
            tornTail = true;
            closeQuietly();
            throw e;
        }
    }

    private void ensureOpen() throws IOException {
        if (outputStream != null) {
            return;
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        outputStream = new FileOutputStream(file.toFile(), true);
        LOG.fine(() -> "Audit log opened " + file);
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            LOG.fine("Audit log close after failure: " + e.getClass().getSimpleName());
        }
    }

    @Override
    public void close() throws IOException {
        FileOutputStream out = outputStream;
        outputStream = null;
        if (out != null) {
            out.close();
        }
    }
}
