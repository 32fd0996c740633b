package madn.core.service;

import madn.core.api.model.DecisionBundle;
import madn.core.api.model.DiagnosisRequest;
import madn.core.audit.AuditEntry;
import madn.core.audit.AuditLedger;
import madn.core.audit.AuditLedgerException;
import madn.core.audit.ChainVerification;
import madn.core.audit.DiagnosisEventLogger;
import madn.core.consensus.ConsensusResult;
import madn.core.consensus.DifferentialDiagnosis;
import madn.core.consensus.WeightedConsensusEngine;
import madn.core.ingest.AnalyzerReportParser;
import madn.core.model.AnalyzerReport;
import madn.core.orchestrator.CaseContext;
import madn.core.orchestrator.CaseContextBuilder;
import madn.core.orchestrator.DecisionOrchestrator;
import madn.core.orchestrator.OrchestrationResult;
import madn.core.safety.Contradiction;
import madn.core.safety.CriticalAlert;
import madn.core.safety.SafetyAssessment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Service
public class DiagnosisService {
    private static final Logger log = LoggerFactory.getLogger(DiagnosisService.class);

    private final AnalyzerReportParser parser;
    private final WeightedConsensusEngine consensusEngine;
    private final CaseContextBuilder contextBuilder;
    private final DecisionOrchestrator orchestrator;
    private final AuditLedger ledger;
    private final DiagnosisEventLogger eventLogger;
    private final MeterRegistry meterRegistry;

    public DiagnosisService(
            AnalyzerReportParser parser,
            WeightedConsensusEngine consensusEngine,
            CaseContextBuilder contextBuilder,
            DecisionOrchestrator orchestrator,
            AuditLedger ledger,
            DiagnosisEventLogger eventLogger,
            MeterRegistry meterRegistry
    ) {
        this.parser = parser;
        this.consensusEngine = consensusEngine;
        this.contextBuilder = contextBuilder;
        this.orchestrator = orchestrator;
        this.ledger = ledger;
        this.eventLogger = eventLogger;
        this.meterRegistry = meterRegistry;
    }

    public DecisionBundle diagnose(DiagnosisRequest request) {
        long startNs = System.nanoTime();
        CaseContext context = contextBuilder.build(request.caseId(), request.safeReports());
        Map<String, AnalyzerReport> reports = parser.parseAll(request.safeReports());

        ConsensusResult consensus = consensusEngine.merge(reports);
        OrchestrationResult orchestration = orchestrator.evaluate(context, reports, consensus);
        SafetyAssessment safety = orchestration.safety();

        List<String> warnings = new ArrayList<>(orchestration.warnings());
        reports.values().stream()
                .filter(AnalyzerReport::malformed)
                .forEach(report -> recordError(context, "REPORT_PARSE_FAILED", report.parseError().message(),
                        Map.of("analyzer", report.analyzer(), "kind", report.parseError().kind().name()), warnings));
        orchestration.failures().forEach((stage, message) ->
                recordError(context, "STAGE_FAILED", message, Map.of("stage", stage), warnings));

        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        String auditId = null;
        try {
            AuditEntry entry = ledger.appendDiagnosis(
                    context.caseId(),
                    context.inputHash(),
                    auditPayload(context, consensus, safety, warnings, processingMs)
            );
            auditId = entry.auditId();
        } catch (AuditLedgerException e) {
            log.error("event=audit_append_failed case_id={} reason={}", context.caseId(), e.getMessage(), e);
            auditFailure("diagnosis");
            warnings.add("Audit entry could not be persisted: " + e.getMessage());
        }

        recordMetrics(consensus, safety, orchestration, processingMs);
        eventLogger.logDiagnosis(context.caseId(), auditId, consensus, safety, warnings, processingMs);

        return new DecisionBundle(
                context.caseId(),
                consensus,
                safety,
                orchestration.explanation(),
                auditId,
                warnings,
                processingMs
        );
    }

    public List<ChainVerification> verifyAudit() {
        return ledger.verifyAll();
    }

    public List<AuditEntry> auditTrail(String caseId) {
        return ledger.entriesForCase(caseId);
    }

    private void recordError(
            CaseContext context,
            String errorType,
            String message,
            Map<String, ?> details,
            List<String> warnings
    ) {
        try {
            ledger.appendError(context.caseId(), errorType, message, details);
        } catch (AuditLedgerException e) {
            log.error("event=audit_append_failed case_id={} error_type={} reason={}",
                    context.caseId(), errorType, e.getMessage(), e);
            auditFailure("error");
            warnings.add("Audit error entry could not be persisted: " + errorType);
        }
    }

    private static Map<String, Object> auditPayload(
            CaseContext context,
            ConsensusResult consensus,
            SafetyAssessment safety,
            List<String> warnings,
            long processingMs
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("diagnosis", consensus.label());
        payload.put("probability", consensus.probability());
        payload.put("confidence", consensus.confidence());
        payload.put("certainty", consensus.certainty().name());
        payload.put("agreement_score", consensus.agreementScore());
        payload.put("urgency", consensus.urgency().name());
        payload.put("supporting_analyzers", consensus.supportingAnalyzers());
        payload.put("differentials", consensus.differentials().stream()
                .map(DifferentialDiagnosis::diagnosis)
                .toList());
        payload.put("confirmed_by", consensus.confirmedBy());
        payload.put("analyzers_used", consensus.analyzersUsed());
        payload.put("risk_tier", safety.riskTier().name());
        payload.put("human_review_required", safety.humanReviewRequired());
        payload.put("critical_alerts", safety.criticalAlerts().stream().map(CriticalAlert::condition).toList());
        payload.put("contradictions", safety.contradictions().stream().map(Contradiction::diagnosis).toList());
        payload.put("input_previews", context.inputPreviews());
        payload.put("warnings", warnings);
        payload.put("processing_ms", processingMs);
        return payload;
    }

    private void recordMetrics(
            ConsensusResult consensus,
            SafetyAssessment safety,
            OrchestrationResult orchestration,
            long processingMs
    ) {
        Counter.builder("madn_diagnosis_total")
                .tag("certainty", consensus.certainty().name())
                .tag("risk", safety.riskTier().name())
                .register(meterRegistry)
                .increment();

        orchestration.failures().keySet().forEach(stage -> Counter.builder("madn_stage_failure_total")
                .tag("stage", stage)
                .register(meterRegistry)
                .increment());

        Timer.builder("madn_diagnosis_latency")
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
    }

    private void auditFailure(String eventType) {
        Counter.builder("madn_audit_failure_total")
                .tag("event_type", eventType)
                .register(meterRegistry)
                .increment();
    }
}
