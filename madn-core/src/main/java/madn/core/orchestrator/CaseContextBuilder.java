package madn.core.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import madn.core.audit.AuditLedger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

@Component
public class CaseContextBuilder {
    static final int PREVIEW_LENGTH = 100;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public CaseContextBuilder(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    CaseContextBuilder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.clock = clock;
    }

    public CaseContext build(String caseId, Map<String, JsonNode> rawReports) {
        SortedMap<String, JsonNode> ordered = new TreeMap<>();
        if (rawReports != null) {
            rawReports.forEach((analyzer, node) -> ordered.put(analyzer, node));
        }
        SortedMap<String, String> previews = new TreeMap<>();
        ordered.forEach((analyzer, node) -> previews.put(analyzer, preview(node)));

        return new CaseContext(
                caseId == null || caseId.isBlank() ? newCaseId() : caseId,
                clock.instant(),
                AuditLedger.inputHash(canonical(ordered)),
                previews,
                ordered.size()
        );
    }

    static String newCaseId() {
        return "CASE-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }

    private String canonical(SortedMap<String, JsonNode> reports) {
        ObjectNode root = objectMapper.createObjectNode();
        reports.forEach(root::set);
        try {
            // ORDER_MAP_ENTRIES_BY_KEYS sorts maps only, not ObjectNode
            Object tree = objectMapper.treeToValue(root, Object.class);
            return objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("input reports not serializable", e);
        }
    }

    private String preview(JsonNode node) {
        String text = node == null || node.isNull() ? "" : node.isTextual() ? node.asText() : node.toString();
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
