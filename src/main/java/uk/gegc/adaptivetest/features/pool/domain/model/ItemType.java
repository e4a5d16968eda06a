package uk.gegc.adaptivetest.features.pool.domain.model;

public enum ItemType {
    MULTIPLE_CHOICE,
    TRUE_FALSE
}
