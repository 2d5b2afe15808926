package com.z254.mender.dispatch;

import com.z254.mender.domain.model.Incident;

import java.util.Map;
import java.util.Optional;

/**
 * Per-repository admission control with a FIFO backlog.
 * <p>
 * For every repository the number of running jobs never exceeds the ceiling passed to
 * {@link #admit}, and never drops below zero.
 */
public interface DispatchQueueManager {

    /**
     * Take a slot if one is free, otherwise park the incident at the tail of the backlog.
     * An incident already waiting is not queued a second time, and an incident whose dispatch
     * is still in flight gets {@link AdmissionDecision#IN_FLIGHT} without taking another slot.
     * A ceiling below 1 counts as 1.
     */
    AdmissionDecision admit(String repository, Incident incident, int maxConcurrency);

    /**
     * Whether the incident was admitted and its dispatch has not yet succeeded or failed.
     */
    boolean isDispatching(String incidentId);

    /**
     * Clear the in-flight mark once the dispatch outcome is recorded. The slot is kept.
     *
     * @return whether the incident was marked in flight
     */
    boolean dispatchFinished(String incidentId);

    /**
     * Give back a slot and pop the head of the backlog, if any. The popped incident does not
     * hold a slot; the caller must {@link #admit} it again.
     */
    Optional<Incident> release(String repository);

    /**
     * Pop the head of the backlog without giving back a slot.
     */
    Optional<Incident> dequeue(String repository);

    int activeCount(String repository);

    int queuedCount(String repository);

    Map<String, RepositoryDispatchState> snapshot();

    /**
     * Overwrite the running-job count, used when rebuilding state at startup.
     */
    void restoreActive(String repository, int count);
}
