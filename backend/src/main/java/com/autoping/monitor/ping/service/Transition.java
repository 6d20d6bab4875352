package com.autoping.monitor.ping.service;

import com.autoping.monitor.ping.model.JobUpdate;

/**
 * Outcome of feeding one event into the {@link FailureStateMachine}: the fields to persist and
 * whether the scheduler has to be reprogrammed afterwards.
 */
public record Transition(
    JobUpdate update,
    boolean reschedule
) {
    public static Transition stay(JobUpdate update) {
        return new Transition(update, false);
    }

    public static Transition reprogram(JobUpdate update) {
        return new Transition(update, true);
    }
}
