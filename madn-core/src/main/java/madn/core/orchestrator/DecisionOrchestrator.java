package madn.core.orchestrator;

import jakarta.annotation.PreDestroy;
import madn.core.consensus.ConsensusResult;
import madn.core.explain.ExplainabilityCompiler;
import madn.core.explain.ExplanationBundle;
import madn.core.model.AnalyzerReport;
import madn.core.safety.SafetyAssessment;
import madn.core.safety.SafetyEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class DecisionOrchestrator {
    public static final String SAFETY_STAGE = "safety_evaluation";
    public static final String EXPLANATION_STAGE = "explanation";

    private static final Logger log = LoggerFactory.getLogger(DecisionOrchestrator.class);

    private final SafetyEvaluator safetyEvaluator;
    private final ExplainabilityCompiler explainabilityCompiler;
    private final long timeoutMs;
    private final ExecutorService executor;

    public DecisionOrchestrator(
            SafetyEvaluator safetyEvaluator,
            ExplainabilityCompiler explainabilityCompiler,
            @Value("${madn.pipeline.workers:4}") int workers,
            @Value("${madn.pipeline.timeout-ms:5000}") long timeoutMs
    ) {
        this.safetyEvaluator = safetyEvaluator;
        this.explainabilityCompiler = explainabilityCompiler;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers));
    }

    public OrchestrationResult evaluate(
            CaseContext context,
            Map<String, AnalyzerReport> reports,
            ConsensusResult consensus
    ) {
        // one deadline for both stages
        long deadlineNs = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        CompletableFuture<SafetyAssessment> safetyFuture =
                CompletableFuture.supplyAsync(() -> safetyEvaluator.evaluate(reports), executor);
        CompletableFuture<ExplanationBundle> explanationFuture =
                CompletableFuture.supplyAsync(() -> explainabilityCompiler.compile(reports, consensus), executor);

        List<String> warnings = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        SafetyAssessment safety;
        try {
            safety = await(safetyFuture, deadlineNs);
        } catch (StageFailure e) {
            log.error("event=stage_failed case_id={} stage={} reason={}", context.caseId(), SAFETY_STAGE, e.getMessage(), e.getCause());
            failures.put(SAFETY_STAGE, e.getMessage());
            warnings.add("Safety evaluation failed; human review required");
            safety = SafetyAssessment.failSafe(e.getMessage());
        }

        ExplanationBundle explanation;
        try {
            explanation = await(explanationFuture, deadlineNs);
        } catch (StageFailure e) {
            log.error("event=stage_failed case_id={} stage={} reason={}", context.caseId(), EXPLANATION_STAGE, e.getMessage(), e.getCause());
            failures.put(EXPLANATION_STAGE, e.getMessage());
            warnings.add("Explanation unavailable: " + e.getMessage());
            explanation = null;
        }
        return new OrchestrationResult(safety, explanation, warnings, failures);
    }

    private <T> T await(CompletableFuture<T> future, long deadlineNs) throws StageFailure {
        try {
            long remainingNs = Math.max(0L, deadlineNs - System.nanoTime());
            return future.get(remainingNs, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StageFailure("TIMEOUT after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageFailure("INTERRUPTED", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new StageFailure(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static final class StageFailure extends Exception {
        private StageFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
