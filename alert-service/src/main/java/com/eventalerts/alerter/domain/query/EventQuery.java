package com.eventalerts.alerter.domain.query;

import com.eventalerts.common.event.EventRecord;
import java.util.List;

/**
 * Source of candidate events. Implementations are read-only and idempotent.
 */
public interface EventQuery {

    /**
     * @return matching events in source order
     * @throws com.eventalerts.alerter.domain.exceptions.FetchException if the source is
     *     unreachable or returns an unusable result
     */
    List<EventRecord> fetch(EventFilter filter);
}
