package com.z254.mender.dispatch;

/**
 * Result of asking for a dispatch slot.
 */
public enum AdmissionDecision {
    /** A slot was taken; the caller dispatches now */
    DISPATCH_NOW,
    /** The repository is at its ceiling; the incident waits in the backlog */
    QUEUED,
    /** The incident already holds a slot and its dispatch has not finished; nothing was taken */
    IN_FLIGHT
}
