package madn.core.orchestrator;

import java.time.Instant;
import java.util.Map;

public record CaseContext(
        String caseId,
        Instant receivedAt,
        String inputHash,
        Map<String, String> inputPreviews,
        int analyzerCount
) {
    public CaseContext {
        inputPreviews = Map.copyOf(inputPreviews);
    }
}
