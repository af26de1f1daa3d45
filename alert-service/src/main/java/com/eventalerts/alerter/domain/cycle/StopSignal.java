package com.eventalerts.alerter.domain.cycle;

@FunctionalInterface
public interface StopSignal {

    StopSignal NEVER = () -> false;

    boolean isStopRequested();
}
