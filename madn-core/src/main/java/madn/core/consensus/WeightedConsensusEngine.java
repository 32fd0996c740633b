package madn.core.consensus;

import madn.core.model.AnalyzerReport;
import madn.core.model.Probabilities;
import madn.core.model.Severity;
import madn.core.tables.ClinicalTables;
import madn.core.tables.DiagnosisNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

@Component
public class WeightedConsensusEngine {
    static final double PROBABILITY_CAP = 0.95;
    static final double DEFINITIVE_FLOOR = 0.95;
    static final double SUPPORT_THRESHOLD = 0.3;
    static final double DIFFERENTIAL_FLOOR = 0.15;
    static final int MAX_DIFFERENTIALS = 3;
    static final double AGREEMENT_BOOST = 0.2;
    static final double SINGLE_ANALYZER_AGREEMENT = 0.5;
    static final double MIN_CONFIDENCE = 0.1;

    private final ClinicalTables tables;

    public WeightedConsensusEngine(ClinicalTables tables) {
        this.tables = tables;
    }

    public ConsensusResult merge(Map<String, AnalyzerReport> reports) {
        if (reports == null || reports.isEmpty()) {
            return ConsensusResult.insufficientData();
        }
        SortedMap<String, AnalyzerReport> ordered = new TreeMap<>(reports);
        return confirmed(ordered).orElseGet(() -> fuse(ordered));
    }

    private Optional<ConsensusResult> confirmed(SortedMap<String, AnalyzerReport> reports) {
        Optional<AnalyzerReport> source = reports.values().stream()
                .filter(r -> r.definitive() && !r.diagnoses().isEmpty())
                .min(Comparator.comparingDouble(AnalyzerReport::confidence).reversed()
                        .thenComparing(AnalyzerReport::analyzer));
        if (source.isEmpty()) {
            return Optional.empty();
        }
        AnalyzerReport report = source.get();
        Map.Entry<String, Double> top = report.topEntry().orElseThrow();
        String label = top.getKey();
        double probability = Math.max(top.getValue(), DEFINITIVE_FLOOR);
        double confidence = Math.max(report.confidence(), DEFINITIVE_FLOOR);

        List<String> flags = new ArrayList<>();
        flags.add("CONFIRMED: " + label + " by " + report.analyzer());
        flags.addAll(analyzerFlags(reports));

        Severity urgency = tables.urgencyKeywords().classify(label);
        if (!urgency.atLeast(Severity.HIGH)) {
            urgency = Severity.HIGH;
        }

        return Optional.of(new ConsensusResult(
                label,
                probability,
                confidence,
                1.0,
                List.of(report.analyzer()),
                List.of(),
                DiagnosticCertainty.CONFIRMED,
                urgency,
                Map.of(label, probability),
                List.copyOf(reports.keySet()),
                analyzerConfidences(reports),
                report.analyzer(),
                flags
        ));
    }

    private ConsensusResult fuse(SortedMap<String, AnalyzerReport> reports) {
        Map<String, Bucket> buckets = collect(reports);

        List<Scored> scored = new ArrayList<>();
        for (Bucket bucket : buckets.values()) {
            scored.add(score(bucket));
        }
        scored.sort(Comparator.comparingDouble(Scored::probability).reversed()
                .thenComparing(Scored::diagnosis));

        List<String> flags = analyzerFlags(reports);
        double meanConfidence = reports.values().stream()
                .mapToDouble(AnalyzerReport::confidence)
                .average()
                .orElse(0.0);

        if (scored.isEmpty()) {
            return new ConsensusResult(
                    ConsensusResult.NO_SIGNIFICANT_DIAGNOSIS,
                    0.0,
                    blendConfidence(meanConfidence, 0.0),
                    0.0,
                    List.of(),
                    List.of(),
                    DiagnosticCertainty.fromConfidence(blendConfidence(meanConfidence, 0.0)),
                    tables.urgencyKeywords().classify(String.join(" ", flags)),
                    Map.of(),
                    List.copyOf(reports.keySet()),
                    analyzerConfidences(reports),
                    null,
                    flags
            );
        }

        Scored top = scored.get(0);
        List<DifferentialDiagnosis> differentials = scored.stream()
                .skip(1)
                .filter(s -> s.probability() > DIFFERENTIAL_FLOOR)
                .limit(MAX_DIFFERENTIALS)
                .map(s -> new DifferentialDiagnosis(s.diagnosis(), s.probability()))
                .toList();

        Map<String, Double> merged = new LinkedHashMap<>();
        scored.forEach(s -> merged.put(s.diagnosis(), s.probability()));

        double confidence = blendConfidence(meanConfidence, top.agreement());
        return new ConsensusResult(
                top.diagnosis(),
                top.probability(),
                confidence,
                top.agreement(),
                top.supporting(),
                differentials,
                DiagnosticCertainty.fromConfidence(confidence),
                tables.urgencyKeywords().classify(top.diagnosis() + " " + String.join(" ", flags)),
                merged,
                List.copyOf(reports.keySet()),
                analyzerConfidences(reports),
                null,
                flags
        );
    }

    private Map<String, Bucket> collect(SortedMap<String, AnalyzerReport> reports) {
        DiagnosisNormalizer normalizer = tables.normalizer();
        Map<String, Bucket> buckets = new TreeMap<>();
        reports.forEach((analyzer, report) -> new TreeMap<>(report.diagnoses()).forEach((name, probability) -> {
            String canonical = normalizer.canonicalName(name);
            if (canonical.isEmpty()) {
                return;
            }
            Bucket bucket = buckets.computeIfAbsent(normalizer.key(name), k -> new Bucket(canonical));
            double weight = tables.weights().weight(bucket.diagnosis, analyzer);
            bucket.votes.merge(analyzer, new Vote(probability, weight),
                    (a, b) -> a.probability() >= b.probability() ? a : b);
        }));
        return buckets;
    }

    private Scored score(Bucket bucket) {
        double totalWeight = 0.0;
        double weightedSum = 0.0;
        List<String> supporting = new ArrayList<>();
        for (Map.Entry<String, Vote> entry : bucket.votes.entrySet()) {
            Vote vote = entry.getValue();
            totalWeight += vote.weight();
            weightedSum += vote.probability() * vote.weight();
            if (vote.probability() >= SUPPORT_THRESHOLD) {
                supporting.add(entry.getKey());
            }
        }
        double weightedMean = totalWeight > 0 ? weightedSum / totalWeight : 0.0;
        double agreement = agreement(bucket.votes.values().stream().mapToDouble(Vote::probability).toArray());

        double boosted = supporting.size() >= 2
                ? weightedMean * (1.0 + AGREEMENT_BOOST * agreement)
                : weightedMean;
        double probability = Probabilities.round(Math.min(PROBABILITY_CAP, boosted), 4);
        return new Scored(bucket.diagnosis, probability, agreement, supporting);
    }

    // a lone analyzer has nothing to agree with and scores 0.5
    static double agreement(double[] probabilities) {
        if (probabilities.length < 2) {
            return SINGLE_ANALYZER_AGREEMENT;
        }
        double mean = 0.0;
        for (double p : probabilities) {
            mean += p;
        }
        mean /= probabilities.length;
        double variance = 0.0;
        for (double p : probabilities) {
            variance += (p - mean) * (p - mean);
        }
        variance /= probabilities.length;
        return Probabilities.round(Math.max(0.0, 1.0 - 2.0 * Math.sqrt(variance)), 3);
    }

    private static double blendConfidence(double meanConfidence, double agreement) {
        double blended = Probabilities.round(meanConfidence * 0.7 + agreement * 0.3, 3);
        return Probabilities.clamp(blended, MIN_CONFIDENCE, PROBABILITY_CAP);
    }

    private static List<String> analyzerFlags(SortedMap<String, AnalyzerReport> reports) {
        List<String> flags = new ArrayList<>();
        reports.forEach((analyzer, report) -> report.alerts()
                .forEach(alert -> flags.add("[" + analyzer + "] " + alert)));
        return flags;
    }

    private static Map<String, Double> analyzerConfidences(SortedMap<String, AnalyzerReport> reports) {
        Map<String, Double> confidences = new LinkedHashMap<>();
        reports.forEach((analyzer, report) -> confidences.put(analyzer, Probabilities.round(report.confidence(), 3)));
        return confidences;
    }

    private static final class Bucket {
        private final String diagnosis;
        private final SortedMap<String, Vote> votes = new TreeMap<>();

        private Bucket(String diagnosis) {
            this.diagnosis = diagnosis;
        }
    }

    private record Vote(double probability, double weight) {}

    private record Scored(String diagnosis, double probability, double agreement, List<String> supporting) {}
}
