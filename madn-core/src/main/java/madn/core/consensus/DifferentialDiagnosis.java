package madn.core.consensus;

public record DifferentialDiagnosis(String diagnosis, double probability) {}
