package com.acme.ztmc.access;

import com.acme.ztmc.access.audit.AuditWriteException;
import com.acme.ztmc.access.audit.EventLogEntry;
import com.acme.ztmc.access.audit.EventType;
import com.acme.ztmc.access.audit.LoggingAuditAlarm;
import com.acme.ztmc.access.enforcement.PolicyEnforcementPoint;
import com.acme.ztmc.access.policy.ContextEvaluator;
import com.acme.ztmc.access.policy.FilePolicyStore;
import com.acme.ztmc.access.policy.PolicyConfigException;
import com.acme.ztmc.access.policy.PolicyDecisionPoint;
import com.acme.ztmc.access.policy.PolicyReloader;
import com.acme.ztmc.access.policy.PolicySet;
import com.acme.ztmc.access.policy.TrustConfig;
import com.acme.ztmc.access.remediation.AutoRemediationDispatcher;
import com.acme.ztmc.access.telemetry.AtomicPipelineMetrics;
import com.acme.ztmc.access.telemetry.CentralMonitor;
import com.acme.ztmc.access.telemetry.MetricsHttpEndpoint;
import com.acme.ztmc.access.telemetry.PeriodicMetricsReporter;
import com.acme.ztmc.access.transport.http.NettyAccessHttpAdapter;
import com.acme.ztmc.access.util.AccessDefaults;
import com.acme.ztmc.access.util.AccessEnvKeys;
import com.acme.ztmc.access.util.EnvVars;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process entry point. All settings come from {@code ZTMC_*} environment variables;
 * an optional first argument overrides the ingress port.
 */
public final class AccessGatewayMain {
    private static final Logger LOG = Logger.getLogger(AccessGatewayMain.class.getName());

    private AccessGatewayMain() {}

    public static void main(String[] args) throws Exception {
        Map<String, String> env = System.getenv();
        int httpPort = args.length > 0
            ? Integer.parseInt(args[0])
            : EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_HTTP_PORT, AccessDefaults.DEFAULT_HTTP_PORT, 0, 65535);

        Path policyPath = Path.of(EnvVars.getOrDefault(env, AccessEnvKeys.ZTMC_POLICY_FILE, AccessDefaults.DEFAULT_POLICY_FILE));
        FilePolicyStore policyStore = loadPoliciesOrExit(policyPath);
        TrustConfig trust = TrustConfig.fromEnvironment(env);
        LOG.info(() -> "Trust configuration networks=" + trust.trustedNetworkPrefixes()
            + " devices=" + trust.trustedDevices().size()
            + " hours=[" + trust.businessHoursStart() + "," + trust.businessHoursEnd() + ")"
            + " zone=" + trust.zone());

        Clock clock = Clock.systemUTC();
        AtomicPipelineMetrics pipelineMetrics = new AtomicPipelineMetrics();
        LoggingAuditAlarm alarm = new LoggingAuditAlarm();
        CentralMonitor monitor = CentralMonitor.open(CentralMonitor.Settings.fromEnvironment(env), alarm);
        policyStore.onChange(policyChangeRecorder(monitor, policyPath, clock));

        long remediationTimeoutMs = EnvVars.getLongClamped(env, AccessEnvKeys.ZTMC_REMEDIATION_TIMEOUT_MS,
            AccessDefaults.DEFAULT_REMEDIATION_TIMEOUT_MS, 1L, 300_000L);
        int remediationThreads = EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_REMEDIATION_THREADS,
            AccessDefaults.DEFAULT_REMEDIATION_THREADS, 1, 256);
        AutoRemediationDispatcher remediation = new AutoRemediationDispatcher(
            AutoRemediationDispatcher.defaultAdapters(),
            monitor,
            remediationTimeoutMs,
            remediationThreads,
            pipelineMetrics,
            clock
        );

        PolicyEnforcementPoint pep = new PolicyEnforcementPoint(
            new PolicyDecisionPoint(new ContextEvaluator(trust), policyStore),
            remediation,
            monitor,
            pipelineMetrics,
            clock
        );
        NettyAccessHttpAdapter httpAdapter = new NettyAccessHttpAdapter(
            httpPort, Runtime.getRuntime().availableProcessors(), pipelineMetrics);
        httpAdapter.setInboundHandler(pep);

        PolicyReloader reloader = null;
        int reloadIntervalSec = EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_POLICY_RELOAD_INTERVAL_SEC,
            AccessDefaults.DEFAULT_POLICY_RELOAD_INTERVAL_SEC, 0, 86_400);
        if (reloadIntervalSec > 0) {
            reloader = new PolicyReloader(policyStore, reloadIntervalSec);
        }

        Supplier<Map<String, Long>> additionalCounters = () -> {
            Map<String, Long> counters = new LinkedHashMap<>(monitor.operationalCounters());
            counters.put("auditAlarms", alarm.raisedCount());
            counters.put("policyReloadFailures", policyStore.reloadFailureCount());
            return counters;
        };
        int reportIntervalSec = EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_METRICS_LOG_INTERVAL_SEC,
            AccessDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1, 3600);
        PeriodicMetricsReporter metricsReporter = new PeriodicMetricsReporter(monitor::snapshot, pipelineMetrics, reportIntervalSec);
        MetricsHttpEndpoint metricsEndpoint = null;
        if (EnvVars.getBoolean(env, AccessEnvKeys.ZTMC_METRICS_HTTP_ENABLED, true)) {
            int metricsPort = EnvVars.getIntClamped(env, AccessEnvKeys.ZTMC_METRICS_HTTP_PORT,
                AccessDefaults.DEFAULT_METRICS_HTTP_PORT, 1, 65535);
            String metricsPath = EnvVars.getOrDefault(env, AccessEnvKeys.ZTMC_METRICS_HTTP_PATH,
                AccessDefaults.DEFAULT_METRICS_HTTP_PATH);
            try {
                metricsEndpoint = new MetricsHttpEndpoint(monitor::snapshot, pipelineMetrics, metricsPort,
                    metricsPath, additionalCounters);
            } catch (Exception e) {
                LOG.warning("Metrics endpoint init failed: " + e.getClass().getSimpleName());
            }
        }

        AtomicBoolean stopped = new AtomicBoolean(false);
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        List<AutoCloseable> shutdownOrder = new ArrayList<>();
        shutdownOrder.add(httpAdapter);
        if (reloader != null) {
            shutdownOrder.add(reloader);
        }
        shutdownOrder.add(metricsReporter);
        if (metricsEndpoint != null) {
            shutdownOrder.add(metricsEndpoint);
        }
        shutdownOrder.add(remediation);
        shutdownOrder.add(monitor);
        Runnable stopAndSignal = () -> {
            try {
                stopAll(shutdownOrder, stopped);
            } finally {
                shutdownLatch.countDown();
            }
        };
        Thread shutdownHook = new Thread(stopAndSignal, "access-gateway-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            metricsReporter.start();
            if (metricsEndpoint != null) {
                metricsEndpoint.start();
            }
            if (reloader != null) {
                reloader.start();
            }
            httpAdapter.start();
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // JVM is shutting down and hook is already in-flight.
            }
            stopAndSignal.run();
        }
    }

    private static FilePolicyStore loadPoliciesOrExit(Path policyPath) {
        try {
            return FilePolicyStore.load(policyPath);
        } catch (PolicyConfigException e) {
            LOG.log(Level.SEVERE, "Policy configuration invalid, refusing to start: " + e.getMessage(), e);
            System.exit(2);
            throw e;
        }
    }

    static BiConsumer<PolicySet, PolicySet> policyChangeRecorder(CentralMonitor monitor, Path policyPath, Clock clock) {
        return (previous, next) -> {
            Map<String, String> details = new LinkedHashMap<>();
            details.put("previousVersion", previous == null ? "" : previous.version());
            details.put("version", next.version());
            details.put("policies", Integer.toString(next.policies().size()));
            details.put("defaultDecision", next.defaultDecision().name());
            EventLogEntry entry = EventLogEntry.of(
                clock.instant(), "PDP", EventType.POLICY_CHANGE,
                "", policyPath.toString(), "", null, "policy set reloaded", List.of(), details);
            try {
                monitor.recordEvent(entry);
            } catch (AuditWriteException e) {
                LOG.log(Level.SEVERE, "Policy change not recorded version=" + next.version(), e);
            }
        };
    }

    private static void stopAll(List<AutoCloseable> components, AtomicBoolean stopped) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (AutoCloseable component : components) {
            try {
                component.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: " + component.getClass().getSimpleName() + " stop failed: "
                    + e.getClass().getSimpleName());
            }
        }
    }
}
