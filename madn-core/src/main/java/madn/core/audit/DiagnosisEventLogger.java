package madn.core.audit;

import madn.core.consensus.ConsensusResult;
import madn.core.safety.SafetyAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DiagnosisEventLogger {
    private static final Logger log = LoggerFactory.getLogger(DiagnosisEventLogger.class);

    public void logDiagnosis(
            String caseId,
            String auditId,
            ConsensusResult consensus,
            SafetyAssessment safety,
            List<String> warnings,
            long processingMs
    ) {
        log.info(
                "event=diagnosis case_id={} audit_id={} label={} certainty={} probability={} confidence={} risk={} human_review={} alerts={} contradictions={} analyzers={} warnings={} processing_ms={}",
                caseId,
                auditId,
                consensus.label(),
                consensus.certainty(),
                consensus.probability(),
                consensus.confidence(),
                safety.riskTier(),
                safety.humanReviewRequired(),
                safety.criticalAlerts().size(),
                safety.contradictions().size(),
                consensus.analyzersUsed(),
                warnings,
                processingMs
        );
    }
}
