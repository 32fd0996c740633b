package madn.core.explain;

import madn.core.consensus.ConsensusResult;
import madn.core.consensus.DiagnosticCertainty;
import madn.core.consensus.DifferentialDiagnosis;
import madn.core.model.AnalyzerReport;
import madn.core.model.Finding;
import madn.core.model.Probabilities;
import madn.core.policy.ClinicalDisclaimerPolicy;
import madn.core.tables.ClinicalTables;
import madn.core.tables.CounterfactualEvidence;
import madn.core.tables.DiagnosisNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

@Component
public class ExplainabilityCompiler {
    static final double RUNNING_CAP = 0.98;
    static final double DEFINITIVE_BASE = 0.95;
    static final double SUPPORT_THRESHOLD = 0.3;
    static final int MAX_COUNTERFACTUALS = 3;

    private final ClinicalTables tables;
    private final ClinicalDisclaimerPolicy disclaimerPolicy;
    private final List<String> clinicalOrder;

    public ExplainabilityCompiler(
            ClinicalTables tables,
            ClinicalDisclaimerPolicy disclaimerPolicy,
            @Value("${madn.explain.clinical-order:pulmonologist,radiologist,cardiologist,pathologist}")
            List<String> clinicalOrder
    ) {
        this.tables = tables;
        this.disclaimerPolicy = disclaimerPolicy;
        this.clinicalOrder = List.copyOf(clinicalOrder);
    }

    public ExplanationBundle compile(Map<String, AnalyzerReport> reports, ConsensusResult consensus) {
        return compile(reports, consensus.label(), consensus.confidence(), consensus.definitive(),
                consensus.differentials());
    }

    public ExplanationBundle compile(
            Map<String, AnalyzerReport> reports,
            String finalDiagnosis,
            double finalConfidence,
            boolean definitive,
            List<DifferentialDiagnosis> differentials
    ) {
        SortedMap<String, AnalyzerReport> ordered = new TreeMap<>(reports == null ? Map.of() : reports);
        DiagnosticCertainty certainty = definitive
                ? DiagnosticCertainty.CONFIRMED
                : DiagnosticCertainty.fromConfidence(finalConfidence);

        List<EvidenceAttribution> attributions = attributions(ordered, finalDiagnosis);
        List<ReasoningStep> chain = reasoningChain(ordered, finalDiagnosis);
        ConfidenceDecomposition decomposition = decompose(ordered, finalDiagnosis, finalConfidence);
        List<Counterfactual> counterfactuals = counterfactuals(finalDiagnosis, differentials);

        return new ExplanationBundle(
                finalDiagnosis,
                finalConfidence,
                certainty,
                attributions,
                chain,
                decomposition,
                counterfactuals,
                oneLine(finalDiagnosis, attributions, ordered.isEmpty()),
                disclaimerPolicy.apply(detailed(finalDiagnosis, finalConfidence, certainty, attributions, counterfactuals))
        );
    }

    List<EvidenceAttribution> attributions(SortedMap<String, AnalyzerReport> reports, String finalDiagnosis) {
        List<EvidenceAttribution> attributions = new ArrayList<>();
        reports.forEach((analyzer, report) -> {
            boolean decisive = report.definitive() && supports(report, finalDiagnosis);
            for (Finding finding : report.findings()) {
                attributions.add(attribute(analyzer, finding, decisive));
            }
        });
        attributions.sort(Comparator.comparingDouble(EvidenceAttribution::weight).reversed());
        return attributions;
    }

    private static EvidenceAttribution attribute(String analyzer, Finding finding, boolean decisive) {
        ContributionTier tier;
        double weight;
        if (decisive) {
            tier = ContributionTier.DECISIVE;
            weight = 1.0;
        } else {
            switch (finding.severity()) {
                case CRITICAL:
                    tier = ContributionTier.STRONG;
                    weight = 0.8;
                    break;
                case HIGH:
                    tier = ContributionTier.STRONG;
                    weight = 0.6;
                    break;
                case MODERATE:
                    tier = ContributionTier.MODERATE;
                    weight = 0.4;
                    break;
                case LOW:
                    tier = ContributionTier.WEAK;
                    weight = 0.2;
                    break;
                case NORMAL:
                    tier = ContributionTier.NEUTRAL;
                    weight = 0.2;
                    break;
                default:
                    throw new IllegalStateException("Unhandled severity: " + finding.severity());
            }
            // an absent finding is labelled as opposing evidence but keeps its severity weight
            if (!finding.present()) {
                tier = ContributionTier.OPPOSING;
            }
        }
        return new EvidenceAttribution(analyzer, finding.name(), finding.severity(), tier, weight,
                finding.clinicalSignificance());
    }

    List<ReasoningStep> reasoningChain(SortedMap<String, AnalyzerReport> reports, String finalDiagnosis) {
        List<AnalyzerReport> sequence = new ArrayList<>(reports.values());
        sequence.sort(Comparator.comparingInt((AnalyzerReport r) -> clinicalRank(r.analyzer()))
                .thenComparing(AnalyzerReport::analyzer));

        List<ReasoningStep> steps = new ArrayList<>();
        double running = 0.0;
        for (AnalyzerReport report : sequence) {
            if (report.findings().isEmpty()) {
                continue;
            }
            List<String> evidence = report.findings().stream().limit(3).map(Finding::name).toList();

            ReasoningStep.Action action;
            String conclusion;
            double delta;
            if (report.definitive()) {
                action = ReasoningStep.Action.CONFIRMED;
                conclusion = "DEFINITIVE: " + finalDiagnosis + " confirmed by gold-standard test";
                delta = RUNNING_CAP - running;
            } else if (impressionSupports(report, finalDiagnosis)) {
                action = ReasoningStep.Action.SUPPORTED;
                conclusion = "Evidence supports " + finalDiagnosis;
                delta = Math.min(0.15, report.confidence() * 0.3);
            } else {
                action = ReasoningStep.Action.EVALUATED;
                conclusion = "Findings noted: " + String.join(", ", evidence);
                delta = 0.05;
            }
            running = Math.min(RUNNING_CAP, running + delta);

            steps.add(new ReasoningStep(
                    steps.size() + 1,
                    report.analyzer(),
                    action,
                    report.analyzer() + " analyzed " + report.findings().size() + " finding(s)",
                    evidence,
                    conclusion,
                    Probabilities.round(delta, 3),
                    Probabilities.round(running, 3)
            ));
        }
        return steps;
    }

    ConfidenceDecomposition decompose(
            SortedMap<String, AnalyzerReport> reports,
            String finalDiagnosis,
            double finalConfidence
    ) {
        if (reports.values().stream().anyMatch(AnalyzerReport::definitive)) {
            return new ConfidenceDecomposition(
                    DEFINITIVE_BASE,
                    Probabilities.round(Math.max(0.0, finalConfidence - DEFINITIVE_BASE), 3),
                    0.0,
                    List.of(),
                    finalConfidence,
                    "Confidence based on definitive diagnostic finding (gold-standard test)"
            );
        }
        if (reports.isEmpty()) {
            return new ConfidenceDecomposition(0.0, 0.0, 0.0,
                    List.of("No analyzer reports available"), finalConfidence,
                    "No analyzer evidence to calibrate against");
        }

        double base = reports.values().stream().mapToDouble(AnalyzerReport::confidence).average().orElse(0.0);
        double max = reports.values().stream().mapToDouble(AnalyzerReport::confidence).max().orElse(0.0);
        double min = reports.values().stream().mapToDouble(AnalyzerReport::confidence).min().orElse(0.0);
        long supporting = reports.values().stream()
                .filter(r -> supportProbability(r, finalDiagnosis) >= SUPPORT_THRESHOLD)
                .count();
        double agreementBoost = 0.05 * Math.max(0, supporting - 1);

        List<String> penalties = new ArrayList<>();
        if (reports.size() < 3) {
            penalties.add("Incomplete data (fewer than 3 analyzers provided input)");
        }
        if (max - min > 0.4) {
            penalties.add("Analyzer disagreement detected (confidence spread above 0.4)");
        }

        return new ConfidenceDecomposition(
                Probabilities.round(base, 3),
                Probabilities.round(finalConfidence - base - agreementBoost, 3),
                Probabilities.round(agreementBoost, 3),
                penalties,
                finalConfidence,
                "Confidence based on weighted analyzer consensus"
        );
    }

    List<Counterfactual> counterfactuals(String finalDiagnosis, List<DifferentialDiagnosis> differentials) {
        List<Counterfactual> counterfactuals = new ArrayList<>();
        if (differentials == null) {
            return counterfactuals;
        }
        DiagnosisNormalizer normalizer = tables.normalizer();
        for (DifferentialDiagnosis alternative : differentials.stream().limit(MAX_COUNTERFACTUALS).toList()) {
            if (normalizer.sameDiagnosis(alternative.diagnosis(), finalDiagnosis)) {
                continue;
            }
            CounterfactualEvidence evidence = tables.counterfactualFor(alternative.diagnosis());
            counterfactuals.add(new Counterfactual(
                    finalDiagnosis,
                    alternative.diagnosis(),
                    alternative.probability(),
                    evidence.required(),
                    evidence.contradicts()
            ));
        }
        return counterfactuals;
    }

    private static String oneLine(String diagnosis, List<EvidenceAttribution> attributions, boolean noReports) {
        if (noReports) {
            return diagnosis;
        }
        for (EvidenceAttribution attribution : attributions) {
            if (attribution.contribution() == ContributionTier.DECISIVE) {
                return diagnosis + " CONFIRMED by " + attribution.finding();
            }
        }
        long strong = attributions.stream().filter(a -> a.contribution() == ContributionTier.STRONG).count();
        if (strong > 0) {
            return diagnosis + " supported by " + strong + " strong finding(s)";
        }
        return diagnosis + " suggested based on clinical presentation";
    }

    private static String detailed(
            String diagnosis,
            double confidence,
            DiagnosticCertainty certainty,
            List<EvidenceAttribution> attributions,
            List<Counterfactual> counterfactuals
    ) {
        StringBuilder text = new StringBuilder();
        text.append("Diagnosis: ").append(diagnosis).append(" (").append(certainty).append(")\n");
        text.append("Confidence: ").append(Math.round(confidence * 100)).append("%\n");
        text.append("Key Evidence:\n");
        attributions.stream().limit(5).forEach(a -> text.append("  - [").append(a.contribution()).append("] ")
                .append(a.finding()).append(" (").append(a.sourceAnalyzer()).append(")\n"));
        if (!counterfactuals.isEmpty()) {
            text.append("Differential Considerations:\n");
            counterfactuals.stream().limit(2).forEach(c -> text.append("  - ").append(c.alternativeDiagnosis())
                    .append(": would require ")
                    .append(c.missingEvidence().isEmpty() ? "additional evidence" : c.missingEvidence().get(0))
                    .append('\n'));
        }
        return text.toString();
    }

    private int clinicalRank(String analyzer) {
        int rank = clinicalOrder.indexOf(analyzer.toLowerCase(Locale.ROOT));
        return rank == -1 ? clinicalOrder.size() : rank;
    }

    private boolean supports(AnalyzerReport report, String finalDiagnosis) {
        String lowerFinal = finalDiagnosis.toLowerCase(Locale.ROOT);
        return report.diagnoses().keySet().stream().anyMatch(name ->
                tables.normalizer().sameDiagnosis(name, finalDiagnosis)
                        || name.toLowerCase(Locale.ROOT).contains(lowerFinal));
    }

    private boolean impressionSupports(AnalyzerReport report, String finalDiagnosis) {
        return report.primaryImpression()
                .map(impression -> tables.normalizer().sameDiagnosis(impression, finalDiagnosis)
                        || impression.toLowerCase(Locale.ROOT).contains(finalDiagnosis.toLowerCase(Locale.ROOT)))
                .orElse(false);
    }

    private double supportProbability(AnalyzerReport report, String finalDiagnosis) {
        return report.diagnoses().entrySet().stream()
                .filter(e -> tables.normalizer().sameDiagnosis(e.getKey(), finalDiagnosis))
                .mapToDouble(Map.Entry::getValue)
                .max()
                .orElse(0.0);
    }
}
