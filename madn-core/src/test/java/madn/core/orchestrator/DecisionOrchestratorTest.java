package madn.core.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import madn.core.consensus.ConsensusResult;
import madn.core.consensus.WeightedConsensusEngine;
import madn.core.explain.ExplainabilityCompiler;
import madn.core.explain.ExplanationBundle;
import madn.core.model.AnalyzerReport;
import madn.core.policy.ClinicalDisclaimerPolicy;
import madn.core.safety.CriticalConditionScanner;
import madn.core.safety.NegationDetector;
import madn.core.safety.RiskTier;
import madn.core.safety.SafetyAssessment;
import madn.core.safety.SafetyEvaluator;
import madn.core.tables.ClinicalTables;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DecisionOrchestratorTest {
    private static final List<String> ORDER = List.of("pulmonologist", "radiologist", "cardiologist", "pathologist");

    private final ClinicalTables tables = ClinicalTables.defaults();
    private final Map<String, AnalyzerReport> reports = Map.of(
            "radiologist", AnalyzerReport.of("radiologist", Map.of("Pneumonia", 0.6), 0.8),
            "pulmonologist", AnalyzerReport.of("pulmonologist", Map.of("Pneumonia", 0.5), 0.7)
    );
    private final ConsensusResult consensus = new WeightedConsensusEngine(tables).merge(reports);
    private final CaseContext context = new CaseContextBuilder(new ObjectMapper()).build("CASE-T1", Map.of());
    private DecisionOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    @Test
    void shouldRunBothStages() {
        orchestrator = new DecisionOrchestrator(safetyEvaluator(), compiler(), 2, 5000);

        OrchestrationResult result = orchestrator.evaluate(context, reports, consensus);

        assertEquals(RiskTier.LOW, result.safety().riskTier());
        assertNotNull(result.explanation());
        assertEquals(consensus.label(), result.explanation().diagnosis());
        assertTrue(result.warnings().isEmpty());
        assertTrue(result.failures().isEmpty());
    }

    @Test
    void shouldFailSafeWhenSafetyEvaluationThrows() {
        SafetyEvaluator broken = new SafetyEvaluator(tables, scanner()) {
            @Override
            public SafetyAssessment evaluate(Map<String, AnalyzerReport> input) {
                throw new IllegalStateException("scanner offline");
            }
        };
        orchestrator = new DecisionOrchestrator(broken, compiler(), 2, 5000);

        OrchestrationResult result = orchestrator.evaluate(context, reports, consensus);

        assertEquals(RiskTier.HIGH, result.safety().riskTier());
        assertTrue(result.safety().humanReviewRequired());
        assertTrue(result.failures().containsKey(DecisionOrchestrator.SAFETY_STAGE));
        assertTrue(result.failures().get(DecisionOrchestrator.SAFETY_STAGE).contains("scanner offline"));
        assertNotNull(result.explanation());
    }

    @Test
    void shouldWarnWhenExplanationFails() {
        ExplainabilityCompiler broken = new ExplainabilityCompiler(tables, new ClinicalDisclaimerPolicy(), ORDER) {
            @Override
            public ExplanationBundle compile(Map<String, AnalyzerReport> input, ConsensusResult result) {
                throw new IllegalArgumentException("template missing");
            }
        };
        orchestrator = new DecisionOrchestrator(safetyEvaluator(), broken, 2, 5000);

        OrchestrationResult result = orchestrator.evaluate(context, reports, consensus);

        assertNull(result.explanation());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("Explanation unavailable"));
        assertEquals(RiskTier.LOW, result.safety().riskTier());
    }

    @Test
    void shouldTimeOutSlowStage() {
        ExplainabilityCompiler slow = new ExplainabilityCompiler(tables, new ClinicalDisclaimerPolicy(), ORDER) {
            @Override
            public ExplanationBundle compile(Map<String, AnalyzerReport> input, ConsensusResult result) {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.compile(input, result);
            }
        };
        orchestrator = new DecisionOrchestrator(safetyEvaluator(), slow, 2, 100);

        OrchestrationResult result = orchestrator.evaluate(context, reports, consensus);

        assertNull(result.explanation());
        assertTrue(result.failures().get(DecisionOrchestrator.EXPLANATION_STAGE).startsWith("TIMEOUT"));
    }

    @Test
    void shouldShareOneDeadlineAcrossBothStages() {
        SafetyEvaluator slowSafety = new SafetyEvaluator(tables, scanner()) {
            @Override
            public SafetyAssessment evaluate(Map<String, AnalyzerReport> input) {
                pause(2000);
                return super.evaluate(input);
            }
        };
        ExplainabilityCompiler slowCompiler = new ExplainabilityCompiler(tables, new ClinicalDisclaimerPolicy(), ORDER) {
            @Override
            public ExplanationBundle compile(Map<String, AnalyzerReport> input, ConsensusResult result) {
                pause(2000);
                return super.compile(input, result);
            }
        };
        orchestrator = new DecisionOrchestrator(slowSafety, slowCompiler, 2, 500);

        long startNs = System.nanoTime();
        OrchestrationResult result = orchestrator.evaluate(context, reports, consensus);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        assertTrue(elapsedMs < 900, "evaluation took " + elapsedMs + "ms");
        assertTrue(result.failures().get(DecisionOrchestrator.SAFETY_STAGE).startsWith("TIMEOUT"));
        assertTrue(result.failures().get(DecisionOrchestrator.EXPLANATION_STAGE).startsWith("TIMEOUT"));
        assertTrue(result.safety().humanReviewRequired());
        assertNull(result.explanation());
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private CriticalConditionScanner scanner() {
        return new CriticalConditionScanner(tables, new NegationDetector(NegationDetector.DEFAULT_WINDOW));
    }

    private SafetyEvaluator safetyEvaluator() {
        return new SafetyEvaluator(tables, scanner());
    }

    private ExplainabilityCompiler compiler() {
        return new ExplainabilityCompiler(tables, new ClinicalDisclaimerPolicy(), ORDER);
    }
}
