package com.z254.mender.dispatch;

import java.util.List;

/**
 * Point-in-time view of one repository's dispatch slots.
 *
 * @param repository         {@code owner/name}
 * @param active             running jobs
 * @param queuedIncidentIds  waiting incidents, head first
 */
public record RepositoryDispatchState(String repository, int active, List<String> queuedIncidentIds) {

    public int queued() {
        return queuedIncidentIds.size();
    }
}
