package uk.gegc.adaptivetest.features.report.domain.model;

public record ConfidenceInterval(double lower, double upper, double z) {
}
