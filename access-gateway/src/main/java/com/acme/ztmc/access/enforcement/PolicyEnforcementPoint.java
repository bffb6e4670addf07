package com.acme.ztmc.access.enforcement;

import com.acme.ztmc.access.audit.AuditWriteException;
import com.acme.ztmc.access.audit.EventLogEntry;
import com.acme.ztmc.access.audit.EventType;
import com.acme.ztmc.access.policy.AccessRequest;
import com.acme.ztmc.access.policy.Decision;
import com.acme.ztmc.access.policy.PolicyDecision;
import com.acme.ztmc.access.policy.PolicyDecisionPoint;
import com.acme.ztmc.access.remediation.AutoRemediationDispatcher;
import com.acme.ztmc.access.remediation.CloudProvider;
import com.acme.ztmc.access.telemetry.CentralMonitor;
import com.acme.ztmc.access.telemetry.NoopPipelineMetrics;
import com.acme.ztmc.access.telemetry.PipelineMetrics;
import com.acme.ztmc.access.transport.api.InboundAccessRequest;
import com.acme.ztmc.access.transport.api.TransportAck;
import com.acme.ztmc.access.transport.api.TransportAdapter;
import com.acme.ztmc.access.transport.api.TransportNack;
import com.acme.ztmc.access.transport.api.TransportResponse;
import com.acme.ztmc.access.util.AccessStatusCodes;
import com.acme.ztmc.access.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request orchestrator: validate, decide, enforce, remediate, audit.
 *
 * <p>Every well-formed request produces exactly one ACCESS_REQUEST event, written after any
 * REMEDIATION event of the same request. Failures of remediation or of the audit log are
 * logged and counted but never change the decision or fail the call. Safe for concurrent use.</p>
 */
public final class PolicyEnforcementPoint implements TransportAdapter.InboundHandler {
    private static final Logger LOG = Logger.getLogger(PolicyEnforcementPoint.class.getName());
    public static final String MODULE = "PEP";

    private final PolicyDecisionPoint pdp;
    private final AutoRemediationDispatcher remediation;
    private final CentralMonitor monitor;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public PolicyEnforcementPoint(PolicyDecisionPoint pdp,
                                  AutoRemediationDispatcher remediation,
                                  CentralMonitor monitor) {
        this(pdp, remediation, monitor, NoopPipelineMetrics.INSTANCE, Clock.systemUTC());
    }

    public PolicyEnforcementPoint(PolicyDecisionPoint pdp,
                                  AutoRemediationDispatcher remediation,
                                  CentralMonitor monitor,
                                  PipelineMetrics metrics,
                                  Clock clock) {
        this.pdp = Objects.requireNonNull(pdp, "pdp");
        this.remediation = Objects.requireNonNull(remediation, "remediation");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.metrics = metrics == null ? NoopPipelineMetrics.INSTANCE : metrics;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Enforces one request.
     *
     * @throws MalformedRequestException if a required field is blank; nothing is audited
     */
    public EnforcementOutcome enforce(AccessRequest request) {
        metrics.incRequests(1L);
        AccessRequest valid;
        try {
            valid = AccessRequestDecoder.validate(request);
        } catch (MalformedRequestException e) {
            metrics.incRejected(1L, AccessStatusCodes.BAD_REQUEST);
            throw e;
        }
        return enforceValidated(valid);
    }

    @Override
    public TransportResponse onRequest(InboundAccessRequest inbound) {
        metrics.incRequests(1L);
        AccessRequest request;
        try {
            request = AccessRequestDecoder.decode(inbound.body(), clock.instant());
        } catch (MalformedRequestException e) {
            metrics.incRejected(1L, AccessStatusCodes.BAD_REQUEST);
            LOG.fine(() -> "Malformed access request requestId=" + inbound.requestId() + ": " + e.getMessage());
            return new TransportNack(AccessStatusCodes.BAD_REQUEST, e.getMessage());
        }
        try {
            EnforcementOutcome outcome = enforceValidated(request);
            return new TransportAck(AccessStatusCodes.OK, toResponseJson(outcome));
        } catch (RuntimeException | JsonProcessingException e) {
            LOG.log(Level.WARNING, "Access request failed requestId=" + inbound.requestId(), e);
            return new TransportNack(AccessStatusCodes.INTERNAL_ERROR, "internal error");
        }
    }

    private EnforcementOutcome enforceValidated(AccessRequest request) {
        long start = System.nanoTime();
        PolicyDecision decision = pdp.decide(request);
        metrics.observeDecisionNanos(System.nanoTime() - start);

        EnforcementAction enforcement = EnforcementAction.forDecision(decision.decision());
        CloudProvider cloud = CloudProvider.classify(request.resource());

        List<String> actions = List.of();
        if (decision.decision() != Decision.ALLOW) {
            actions = remediate(request, decision, cloud);
        }

        EnforcementOutcome outcome = new EnforcementOutcome(
            request, decision.decision(), decision.reason(), cloud, enforcement, actions);
        recordAccess(outcome, decision);
        LOG.fine(() -> "Enforced user=" + request.user() + " action=" + request.action()
            + " decision=" + outcome.decision() + " enforcement=" + enforcement + " cloud=" + cloud.displayName());
        return outcome;
    }

    private List<String> remediate(AccessRequest request, PolicyDecision decision, CloudProvider cloud) {
        try {
            return remediation.remediate(request.user(), request.resource(), decision.decision(),
                decision.reason(), cloud.displayName());
        } catch (RuntimeException e) {
            metrics.incRemediationFailures(1L);
            LOG.log(Level.WARNING, "Remediation failed user=" + request.user() + " resource=" + request.resource(), e);
            return List.of();
        }
    }

    private void recordAccess(EnforcementOutcome outcome, PolicyDecision decision) {
        AccessRequest request = outcome.request();
        Map<String, String> details = new LinkedHashMap<>();
        details.put("action", request.action());
        details.put("sourceIp", request.sourceIp());
        details.put("deviceId", request.deviceId());
        details.put("enforcement", outcome.enforcement().name());
        details.put("policyVersion", decision.policyVersion());
        details.put("contextDecision", decision.contextVerdict().decision().name());
        details.put("actionDecision", decision.actionVerdict().decision().name());

        EventLogEntry entry = EventLogEntry.of(
            clock.instant(), MODULE, EventType.ACCESS_REQUEST,
            request.user(), request.resource(), outcome.cloud().displayName(),
            outcome.decision(), outcome.reason(), outcome.remediationActions(), details);
        try {
            monitor.recordEvent(entry);
        } catch (AuditWriteException e) {
            metrics.incAuditWriteFailures(1L);
            LOG.log(Level.SEVERE, "Access event not recorded user=" + request.user()
                + " decision=" + outcome.decision(), e);
        } catch (RuntimeException e) {
            metrics.incAuditWriteFailures(1L);
            LOG.log(Level.SEVERE, "Access event recording failed user=" + request.user()
                + " decision=" + outcome.decision(), e);
        }
    }

    static String toResponseJson(EnforcementOutcome outcome) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("decision", outcome.decision().name());
        body.put("reason", outcome.reason());
        body.put("cloud", outcome.cloud().displayName());
        body.put("enforcement", outcome.enforcement().name());
        body.put("remediationActions", outcome.remediationActions());
        return JsonCodec.writeString(body);
    }
}
