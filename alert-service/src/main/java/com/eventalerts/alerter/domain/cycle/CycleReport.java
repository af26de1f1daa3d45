package com.eventalerts.alerter.domain.cycle;

import java.util.List;

/**
 * Per-cycle outcome by event id. Events left unprocessed after a stop request appear in
 * none of the lists.
 *
 * @param persisted false when the tracking store had changes that could not be written
 */
public record CycleReport(
        int fetched,
        List<String> notified,
        List<String> skipped,
        List<String> failed,
        boolean interrupted,
        boolean persisted) {

    public CycleReport {
        notified = List.copyOf(notified);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }
}
