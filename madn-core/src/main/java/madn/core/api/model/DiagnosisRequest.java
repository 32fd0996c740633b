package madn.core.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record DiagnosisRequest(
        String caseId,
        Map<String, JsonNode> reports
) {
    public Map<String, JsonNode> safeReports() {
        return reports == null ? Map.of() : reports;
    }
}
