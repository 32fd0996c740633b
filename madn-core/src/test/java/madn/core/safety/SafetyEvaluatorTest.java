package madn.core.safety;

import madn.core.model.AnalyzerReport;
import madn.core.model.Finding;
import madn.core.model.ParseError;
import madn.core.model.Severity;
import madn.core.tables.ClinicalTables;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SafetyEvaluatorTest {
    private final ClinicalTables tables = ClinicalTables.defaults();
    private final SafetyEvaluator evaluator = new SafetyEvaluator(
            tables, new CriticalConditionScanner(tables, new NegationDetector(NegationDetector.DEFAULT_WINDOW)));

    @Test
    void shouldFlagStrongDisagreementAsContradiction() {
        Map<String, AnalyzerReport> reports = Map.of(
                "radiologist", AnalyzerReport.of("radiologist", Map.of("Pneumonia", 0.9), 0.8),
                "pulmonologist", AnalyzerReport.of("pulmonologist", Map.of("Pneumonia", 0.1), 0.8)
        );

        SafetyAssessment assessment = evaluator.evaluate(reports);

        assertEquals(1, assessment.contradictions().size());
        Contradiction contradiction = assessment.contradictions().get(0);
        assertEquals("Community-Acquired Pneumonia", contradiction.diagnosis());
        assertEquals(0.8, contradiction.spread(), 1e-9);
        assertEquals(Map.of("pulmonologist", 0.1, "radiologist", 0.9), contradiction.analyzerProbabilities());
        assertEquals(RiskTier.LOW, assessment.riskTier());
    }

    @Test
    void shouldIgnoreDisagreementOnInsignificantDiagnoses() {
        Map<String, AnalyzerReport> reports = Map.of(
                "radiologist", AnalyzerReport.of("radiologist", Map.of("Atelectasis", 0.25), 0.8),
                "pulmonologist", AnalyzerReport.of("pulmonologist", Map.of("Atelectasis", 0.0), 0.8)
        );

        assertTrue(evaluator.evaluate(reports).contradictions().isEmpty());
    }

    @Test
    void shouldEscalateTimeCriticalConditionToCritical() {
        AnalyzerReport cardiologist = new AnalyzerReport("cardiologist", Map.of("STEMI", 0.8), 0.85,
                List.of(Finding.present("ST elevation in leads V1-V4", Severity.CRITICAL, "Anterior injury")),
                List.of(), List.of(), false, null, null);

        SafetyAssessment assessment = evaluator.evaluate(Map.of("cardiologist", cardiologist));

        assertEquals(RiskTier.CRITICAL, assessment.riskTier());
        assertTrue(assessment.humanReviewRequired());
        CriticalAlert alert = assessment.criticalAlerts().get(0);
        assertEquals("STEMI", alert.condition());
        assertEquals("st elevation", alert.matchedKeyword());
        assertEquals(List.of("cardiologist"), alert.sourceAnalyzers());
        assertFalse(alert.negatedContext());
        assertTrue(assessment.flags().contains("CRITICAL: Immediate clinical attention required"));
        assertTrue(assessment.contraindications()
                .contains("thrombolytics contraindicated if aortic dissection suspected"));
    }

    @Test
    void shouldNotMatchKeywordsInsideOtherWords() {
        Map<String, AnalyzerReport> reports = Map.of(
                "pathologist", AnalyzerReport.of("pathologist", Map.of("Type 2 diabetes", 0.6), 0.8)
        );

        SafetyAssessment assessment = evaluator.evaluate(reports);

        assertTrue(assessment.criticalAlerts().isEmpty());
        assertEquals(RiskTier.LOW, assessment.riskTier());
        assertFalse(assessment.humanReviewRequired());
    }

    @Test
    void shouldMarkAlertWhenEveryMentionIsNegated() {
        AnalyzerReport radiologist = new AnalyzerReport("radiologist", Map.of("Atelectasis", 0.4), 0.7,
                List.of(Finding.present("No evidence of pulmonary embolism", Severity.NORMAL, "")),
                List.of(), List.of(), false, null, null);

        SafetyAssessment assessment = evaluator.evaluate(Map.of("radiologist", radiologist));

        assertEquals(1, assessment.criticalAlerts().size());
        assertTrue(assessment.criticalAlerts().get(0).negatedContext());
    }

    @Test
    void shouldRequireReviewWhenSeveralAnalyzersLackData() {
        Map<String, AnalyzerReport> reports = Map.of(
                "radiologist", new AnalyzerReport("radiologist", Map.of("Asthma", 0.5), 0.7,
                        List.of(), List.of(), List.of("INCOMPLETE_DATA: no imaging"), false, null, null),
                "pathologist", AnalyzerReport.defaultFor("pathologist",
                        new ParseError(ParseError.Kind.INVALID_JSON, "unexpected end of input"))
        );

        SafetyAssessment assessment = evaluator.evaluate(reports);

        assertEquals(List.of("pathologist", "radiologist"), assessment.missingDataAnalyzers());
        assertTrue(assessment.humanReviewRequired());
        assertTrue(assessment.flags().contains("WARNING: report from pathologist was unreadable (INVALID_JSON)"));
    }

    @Test
    void shouldRaiseRiskForPoorlyCalibratedInputs() {
        Map<String, AnalyzerReport> reports = Map.of(
                "radiologist", AnalyzerReport.of("radiologist", Map.of("Asthma", 0.5), 0.2),
                "pulmonologist", AnalyzerReport.of("pulmonologist", Map.of("Asthma", 0.45), 0.3)
        );

        SafetyAssessment assessment = evaluator.evaluate(reports);

        assertEquals(CalibrationSummary.Reliability.LOW, assessment.calibration().reliability());
        assertEquals(List.of("pulmonologist", "radiologist"), assessment.calibration().lowConfidenceAnalyzers());
        assertEquals(RiskTier.MODERATE, assessment.riskTier());
    }

    @Test
    void shouldTreatEmptyInputAsHighRisk() {
        SafetyAssessment assessment = evaluator.evaluate(Map.of());

        assertEquals(RiskTier.HIGH, assessment.riskTier());
        assertTrue(assessment.humanReviewRequired());
        assertEquals(List.of("NO_DATA_PROVIDED"), assessment.flags());
        assertEquals(SafetyAssessment.DISCLAIMER, assessment.disclaimer());
    }

    @Test
    void shouldListContraindicationsOnce() {
        Map<String, AnalyzerReport> reports = Map.of(
                "radiologist", AnalyzerReport.of("radiologist", Map.of("Pulmonary Embolism", 0.6), 0.8),
                "cardiologist", AnalyzerReport.of("cardiologist", Map.of("PE", 0.5), 0.8)
        );

        SafetyAssessment assessment = evaluator.evaluate(reports);

        assertEquals(List.of("anticoagulation contraindicated if active bleeding"), assessment.contraindications());
    }
}
