package uk.gegc.adaptivetest.features.session.domain.model;

/**
 * Criterion used to rank candidate items before constraints are applied.
 */
public enum SelectionMethod {

    /**
     * Fisher information at the current ability estimate.
     */
    MAXIMUM_INFORMATION,

    /**
     * Closeness of item difficulty to the current ability estimate.
     */
    CLOSEST_DIFFICULTY
}
