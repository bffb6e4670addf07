package com.acme.ztmc.access.remediation;

import com.acme.ztmc.access.audit.AuditWriteException;
import com.acme.ztmc.access.audit.EventLogEntry;
import com.acme.ztmc.access.audit.EventType;
import com.acme.ztmc.access.policy.Decision;
import com.acme.ztmc.access.telemetry.CentralMonitor;
import com.acme.ztmc.access.telemetry.NoopPipelineMetrics;
import com.acme.ztmc.access.telemetry.PipelineMetrics;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps a non-ALLOW decision to corrective actions and records them as one REMEDIATION event.
 *
 * <p>Adapter calls run on a dedicated daemon pool and are bounded by a timeout. A failing or
 * hanging adapter produces a failure description instead of an exception; the access decision
 * itself is never changed here.</p>
 */
public final class AutoRemediationDispatcher implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(AutoRemediationDispatcher.class.getName());
    public static final String MODULE = "ARM";

    private final Map<CloudProvider, CloudAdapter> adapters;
    private final CentralMonitor monitor;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final long timeoutMs;
    private final ExecutorService executor;

    public AutoRemediationDispatcher(List<CloudAdapter> adapters,
                                     CentralMonitor monitor,
                                     long timeoutMs,
                                     int threads,
                                     PipelineMetrics metrics,
                                     Clock clock) {
        Objects.requireNonNull(adapters, "adapters");
        EnumMap<CloudProvider, CloudAdapter> byProvider = new EnumMap<>(CloudProvider.class);
        for (CloudAdapter adapter : adapters) {
            CloudAdapter previous = byProvider.put(adapter.provider(), adapter);
            if (previous != null) {
                throw new IllegalArgumentException("duplicate adapter for " + adapter.provider());
            }
        }
        this.adapters = Collections.unmodifiableMap(byProvider);
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.timeoutMs = Math.max(1L, timeoutMs);
        AtomicInteger threadIds = new AtomicInteger(1);
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "remediation-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    public static List<CloudAdapter> defaultAdapters() {
        return List.of(new AwsCloudAdapter(), new AzureCloudAdapter(), new GcpCloudAdapter());
    }

    /**
     * Performs remediation for a DENY or REVIEW decision.
     *
     * @param cloud target cloud name, resolved case-insensitively; an unknown cloud yields no adapter action
     * @return descriptions of the actions taken, in order
     * @throws IllegalArgumentException if {@code decision} is ALLOW
     */
    public List<String> remediate(String user, String resource, Decision decision, String reason, String cloud) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(decision, "decision");
        if (decision == Decision.ALLOW) {
            throw new IllegalArgumentException("remediation requires a DENY or REVIEW decision");
        }

        List<String> actions = new ArrayList<>(1);
        Map<String, String> details = new LinkedHashMap<>();
        if (decision == Decision.DENY) {
            Optional<CloudProvider> provider = CloudProvider.match(cloud);
            CloudAdapter adapter = provider.map(adapters::get).orElse(null);
            if (adapter == null) {
                details.put("adapter", "none");
                LOG.warning("No remediation adapter for cloud=" + cloud + " user=" + user);
            } else {
                details.put("adapter", adapter.provider().name());
                actions.add(revoke(adapter, user));
            }
        } else {
            actions.add("Admin review needed for " + user + " on " + resource + ": " + reason);
        }

        List<String> result = Collections.unmodifiableList(actions);
        recordRemediation(user, resource, decision, reason, cloud, result, details);
        return result;
    }

    private String revoke(CloudAdapter adapter, String user) {
        String cloudName = adapter.provider().displayName();
        Future<String> call = executor.submit(() -> adapter.revokeAccess(user));
        try {
            String description = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            return description == null ? cloudName + " remediation completed for " + user : description;
        } catch (TimeoutException e) {
            call.cancel(true);
            metrics.incRemediationFailures(1L);
            LOG.warning(cloudName + " remediation timed out user=" + user + " timeoutMs=" + timeoutMs);
            return cloudName + " remediation timed out for " + user + " after " + timeoutMs + " ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            metrics.incRemediationFailures(1L);
            LOG.log(Level.WARNING, cloudName + " remediation failed user=" + user, cause);
            return cloudName + " remediation failed for " + user + ": " + describe(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            metrics.incRemediationFailures(1L);
            return cloudName + " remediation interrupted for " + user;
        }
    }

    private void recordRemediation(String user,
                                   String resource,
                                   Decision decision,
                                   String reason,
                                   String cloud,
                                   List<String> actions,
                                   Map<String, String> details) {
        EventLogEntry entry = EventLogEntry.of(
            clock.instant(), MODULE, EventType.REMEDIATION,
            user, resource, cloud, decision, reason, actions, details);
        try {
            monitor.recordEvent(entry);
        } catch (AuditWriteException e) {
            metrics.incAuditWriteFailures(1L);
            LOG.log(Level.SEVERE, "Remediation event not recorded user=" + user + " actions=" + actions, e);
        } catch (RuntimeException e) {
            metrics.incAuditWriteFailures(1L);
            LOG.log(Level.SEVERE, "Remediation event recording failed user=" + user + " actions=" + actions, e);
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank()
            ? t.getClass().getSimpleName()
            : t.getClass().getSimpleName() + ": " + message;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
