package uk.gegc.adaptivetest.features.report.domain.model;

public enum Trend {
    INCREASING,
    DECREASING,
    STABLE
}
