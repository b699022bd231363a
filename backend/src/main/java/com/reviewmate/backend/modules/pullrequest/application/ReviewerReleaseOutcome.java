package com.reviewmate.backend.modules.pullrequest.application;

/**
 * What happened to one (pull request, departing reviewer) pair during a deactivation cascade.
 */
public enum ReviewerReleaseOutcome {
    /** A replacement took the reviewer's place. */
    REPLACED,
    /** No eligible replacement existed anywhere; the reviewer was dropped. */
    REMOVED,
    /** The pull request was merged or the reviewer was already gone by the time it was processed. */
    SKIPPED;

    public boolean countsAsReassigned() {
        return this != SKIPPED;
    }
}
