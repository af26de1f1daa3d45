package com.eventalerts.alerter.application.job;

public enum SchedulerState {
    IDLE,
    RUNNING,
    STOPPED
}
