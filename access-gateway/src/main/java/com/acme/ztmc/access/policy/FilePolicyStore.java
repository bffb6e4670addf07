package com.acme.ztmc.access.policy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Policy store backed by a JSON document on disk.
 *
 * <p>The initial load is fail-fast. A failed {@link #reload()} keeps the
 * last-known-good set; the published set is swapped by reference only after
 * the new document parsed completely.</p>
 */
public final class FilePolicyStore implements PolicyStore {
    private static final Logger LOG = Logger.getLogger(FilePolicyStore.class.getName());

    private final Path path;
    private final AtomicReference<PolicySet> current = new AtomicReference<>();
    private final AtomicLong reloadFailures = new AtomicLong();
    private volatile long loadedModifiedMillis;
    private volatile BiConsumer<PolicySet, PolicySet> changeListener = (previous, next) -> { };

    private FilePolicyStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    /**
     * Loads the document at {@code path}.
     *
     * @throws PolicyConfigException if the file is missing, unreadable or invalid
     */
    public static FilePolicyStore load(Path path) {
        FilePolicyStore store = new FilePolicyStore(path);
        store.current.set(store.readAndParse());
        PolicySet loaded = store.current.get();
        LOG.info(() -> "Policy set loaded path=" + path + " version=" + loaded.version()
            + " policies=" + loaded.policies().size() + " default=" + loaded.defaultDecision());
        return store;
    }

    @Override
    public PolicySet activePolicySet() {
        return current.get();
    }

    /**
     * Registers the callback invoked with (previous, next) after every published reload.
     */
    public void onChange(BiConsumer<PolicySet, PolicySet> listener) {
        this.changeListener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Re-reads the document. Returns {@code true} if a new set was published.
     */
    public boolean reload() {
        PolicySet next;
        try {
            next = readAndParse();
        } catch (PolicyConfigException e) {
            reloadFailures.incrementAndGet();
            LOG.warning("Policy reload failed, keeping version=" + current.get().version() + ": " + e.getMessage());
            return false;
        }
        PolicySet previous = current.getAndSet(next);
        LOG.info("Policy set reloaded version=" + next.version() + " policies=" + next.policies().size());
        try {
            changeListener.accept(previous, next);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Policy change listener failed", e);
        }
        return true;
    }

    /**
     * Reloads only when the file modification time moved since the last successful load.
     */
    public boolean reloadIfModified() {
        long modified;
        try {
            modified = Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            reloadFailures.incrementAndGet();
            LOG.warning("Policy file not readable, keeping version=" + current.get().version()
                + ": " + e.getClass().getSimpleName());
            return false;
        }
        if (modified == loadedModifiedMillis) {
            return false;
        }
        return reload();
    }

    public long reloadFailureCount() {
        return reloadFailures.get();
    }

    public Path path() {
        return path;
    }

    private PolicySet readAndParse() {
        String raw;
        long modified;
        try {
            modified = Files.getLastModifiedTime(path).toMillis();
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PolicyConfigException("cannot read policy file " + path + ": " + e.getClass().getSimpleName(), e);
        }
        PolicySet parsed = PolicyDocumentParser.parse(raw);
        loadedModifiedMillis = modified;
        return parsed;
    }
}
