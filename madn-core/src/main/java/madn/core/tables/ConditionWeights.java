package madn.core.tables;

import java.util.Map;

// lookup order: condition table, analyzer base weight, fallbackWeight
public record ConditionWeights(
        double fallbackWeight,
        Map<String, Double> analyzerWeights,
        Map<String, Map<String, Double>> conditionWeights
) {
    public ConditionWeights {
        analyzerWeights = Map.copyOf(analyzerWeights);
        conditionWeights = Map.copyOf(conditionWeights);
    }

    public static ConditionWeights uniform() {
        return new ConditionWeights(1.0, Map.of(), Map.of());
    }

    public double weight(String condition, String analyzer) {
        Map<String, Double> perCondition = conditionWeights.get(condition);
        if (perCondition != null && perCondition.containsKey(analyzer)) {
            return perCondition.get(analyzer);
        }
        return analyzerWeights.getOrDefault(analyzer, fallbackWeight);
    }
}
