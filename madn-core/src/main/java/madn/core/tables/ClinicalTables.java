package madn.core.tables;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ClinicalTables {
    private static final Logger log = LoggerFactory.getLogger(ClinicalTables.class);

    public static final String DEFAULT_LOCATION = "classpath:tables/";

    private final ConditionWeights weights;
    private final DiagnosisNormalizer normalizer;
    private final List<CriticalCondition> criticalConditions;
    private final Map<String, List<String>> contraindications;
    private final Map<String, CounterfactualEvidence> counterfactuals;
    private final UrgencyKeywords urgencyKeywords;

    public ClinicalTables(
            ConditionWeights weights,
            DiagnosisNormalizer normalizer,
            List<CriticalCondition> criticalConditions,
            Map<String, List<String>> contraindications,
            Map<String, CounterfactualEvidence> counterfactuals,
            UrgencyKeywords urgencyKeywords
    ) {
        this.weights = weights;
        this.normalizer = normalizer;
        this.criticalConditions = List.copyOf(criticalConditions);
        this.contraindications = Map.copyOf(contraindications);
        this.counterfactuals = Map.copyOf(counterfactuals);
        this.urgencyKeywords = urgencyKeywords;
    }

    public static ClinicalTables defaults() {
        return load(new ObjectMapper(), DEFAULT_LOCATION);
    }

    public static ClinicalTables load(ObjectMapper objectMapper, String location) {
        TableReader reader = new TableReader(objectMapper, new DefaultResourceLoader(), location);
        ClinicalTables tables = new ClinicalTables(
                reader.weights(reader.read("consensus-weights.json")),
                new DiagnosisNormalizer(reader.aliasRules(reader.read("diagnosis-aliases.json"))),
                reader.criticalConditions(reader.read("critical-conditions.json")),
                reader.stringLists(reader.read("contraindications.json")),
                reader.counterfactuals(reader.read("counterfactual-evidence.json")),
                reader.urgency(reader.read("urgency-keywords.json"))
        );
        log.info("event=clinical_tables_loaded location={} conditions={} critical_conditions={} counterfactuals={}",
                location,
                tables.weights.conditionWeights().size(),
                tables.criticalConditions.size(),
                tables.counterfactuals.size());
        return tables;
    }

    public ConditionWeights weights() {
        return weights;
    }

    public DiagnosisNormalizer normalizer() {
        return normalizer;
    }

    public List<CriticalCondition> criticalConditions() {
        return criticalConditions;
    }

    public List<String> contraindicationsFor(String condition) {
        return contraindications.getOrDefault(condition, List.of());
    }

    public CounterfactualEvidence counterfactualFor(String diagnosis) {
        CounterfactualEvidence evidence = counterfactuals.get(diagnosis);
        if (evidence == null) {
            evidence = counterfactuals.get(normalizer.canonicalName(diagnosis));
        }
        return evidence == null ? CounterfactualEvidence.GENERIC : evidence;
    }

    public UrgencyKeywords urgencyKeywords() {
        return urgencyKeywords;
    }

    private static final class TableReader {
        private final ObjectMapper objectMapper;
        private final ResourceLoader resourceLoader;
        private final String location;

        TableReader(ObjectMapper objectMapper, ResourceLoader resourceLoader, String location) {
            this.objectMapper = objectMapper;
            this.resourceLoader = resourceLoader;
            this.location = location.endsWith("/") ? location : location + "/";
        }

        JsonNode read(String name) {
            Resource resource = resourceLoader.getResource(location + name);
            if (!resource.exists()) {
                throw new IllegalStateException("clinical table not found: " + location + name);
            }
            try (InputStream in = resource.getInputStream()) {
                return objectMapper.readTree(in);
            } catch (IOException e) {
                throw new IllegalStateException("clinical table unreadable: " + location + name, e);
            }
        }

        ConditionWeights weights(JsonNode root) {
            Map<String, Map<String, Double>> perCondition = new LinkedHashMap<>();
            fields(root.path("condition_weights")).forEach((condition, node) ->
                    perCondition.put(condition, doubles(node)));
            return new ConditionWeights(
                    root.path("fallback_weight").asDouble(1.0),
                    doubles(root.path("analyzer_weights")),
                    perCondition
            );
        }

        List<DiagnosisNormalizer.AliasRule> aliasRules(JsonNode root) {
            List<DiagnosisNormalizer.AliasRule> rules = new ArrayList<>();
            for (JsonNode rule : root) {
                List<List<String>> contains = new ArrayList<>();
                for (JsonNode group : rule.path("contains")) {
                    contains.add(strings(group));
                }
                rules.add(new DiagnosisNormalizer.AliasRule(
                        required(rule, "canonical"),
                        contains,
                        strings(rule.path("exact"))
                ));
            }
            return rules;
        }

        List<CriticalCondition> criticalConditions(JsonNode root) {
            List<CriticalCondition> conditions = new ArrayList<>();
            for (JsonNode node : root) {
                conditions.add(new CriticalCondition(
                        required(node, "condition"),
                        strings(node.path("keywords")),
                        required(node, "action"),
                        node.path("time_critical").asBoolean(false)
                ));
            }
            return conditions;
        }

        Map<String, List<String>> stringLists(JsonNode root) {
            Map<String, List<String>> values = new LinkedHashMap<>();
            fields(root).forEach((key, node) -> values.put(key, strings(node)));
            return values;
        }

        Map<String, CounterfactualEvidence> counterfactuals(JsonNode root) {
            Map<String, CounterfactualEvidence> values = new LinkedHashMap<>();
            fields(root).forEach((diagnosis, node) -> values.put(diagnosis, new CounterfactualEvidence(
                    strings(node.path("required")),
                    strings(node.path("contradicts"))
            )));
            return values;
        }

        UrgencyKeywords urgency(JsonNode root) {
            return new UrgencyKeywords(strings(root.path("critical")), strings(root.path("high")));
        }

        private String required(JsonNode node, String field) {
            JsonNode value = node.path(field);
            if (!value.isTextual() || value.asText().isBlank()) {
                throw new IllegalStateException("clinical table entry missing '" + field + "': " + node);
            }
            return value.asText();
        }

        private static Map<String, JsonNode> fields(JsonNode node) {
            Map<String, JsonNode> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                fields.put(entry.getKey(), entry.getValue());
            }
            return fields;
        }

        private static Map<String, Double> doubles(JsonNode node) {
            Map<String, Double> values = new LinkedHashMap<>();
            fields(node).forEach((key, value) -> values.put(key, value.asDouble()));
            return values;
        }

        private static List<String> strings(JsonNode node) {
            List<String> values = new ArrayList<>();
            for (JsonNode value : node) {
                values.add(value.asText());
            }
            return values;
        }
    }
}
