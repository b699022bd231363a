package com.reviewmate.backend.modules.pullrequest.domain;

public enum PullRequestStatus {
    OPEN,
    MERGED;

    public boolean isTerminal() {
        return this == MERGED;
    }
}
