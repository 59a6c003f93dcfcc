package com.dbbaskette.codeguardian.model;

public enum ReviewStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * PENDING -> IN_PROGRESS -> COMPLETED, and FAILED from any non-terminal state.
     */
    public boolean canTransitionTo(ReviewStatus target) {
        if (isTerminal()) {
            return false;
        }
        return switch (target) {
            case IN_PROGRESS -> this == PENDING;
            case COMPLETED -> this == IN_PROGRESS;
            case FAILED -> true;
            case PENDING -> false;
        };
    }
}
