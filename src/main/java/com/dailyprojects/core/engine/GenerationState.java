package com.dailyprojects.core.engine;

/**
 * Lifecycle of one daily request for a {@code (date, count)} key.
 */
public enum GenerationState {
    /** Looking at the cached batch. */
    IDLE,
    /** Producing a batch, or waiting on the request that holds the lock. */
    GENERATING,
    /** A batch has been chosen for the caller. */
    SERVED;

    public boolean canTransitionTo(GenerationState next) {
        return switch (this) {
            case IDLE -> next == GENERATING || next == SERVED;
            case GENERATING -> next == SERVED;
            case SERVED -> false;
        };
    }
}
