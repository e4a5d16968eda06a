package uk.gegc.adaptivetest.features.session.domain.model;

public enum StopReason {

    MAX_QUESTIONS_REACHED("max_questions_reached"),

    TIME_LIMIT_REACHED("time_limit_reached"),

    PRECISION_REACHED("precision_reached"),

    POOL_EXHAUSTED("pool_exhausted"),

    COMPLETED_BY_CALLER("completed_by_caller");

    private final String code;

    StopReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
