package com.eventalerts.alerter.domain.dedup;

public enum DedupDecision {
    SKIP,
    NOTIFY_NEW,
    NOTIFY_REMINDER;

    public boolean shouldNotify() {
        return this != SKIP;
    }
}
