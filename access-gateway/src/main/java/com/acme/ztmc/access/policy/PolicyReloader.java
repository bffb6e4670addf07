package com.acme.ztmc.access.policy;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls the policy file and hot-reloads it when it changes.
 */
public final class PolicyReloader implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PolicyReloader.class.getName());

    private final FilePolicyStore store;
    private final long intervalSeconds;
    private final ScheduledExecutorService executor;

    public PolicyReloader(FilePolicyStore store, long intervalSeconds) {
        this.store = Objects.requireNonNull(store, "store");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "policy-reloader");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleWithFixedDelay(this::poll, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        LOG.info(() -> "Policy hot reload enabled path=" + store.path() + " intervalSec=" + intervalSeconds);
    }

    private void poll() {
        try {
            store.reloadIfModified();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Policy reload poll failed", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
