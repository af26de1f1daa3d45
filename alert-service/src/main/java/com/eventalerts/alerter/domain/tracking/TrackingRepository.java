package com.eventalerts.alerter.domain.tracking;

/**
 * Durable storage for the whole tracking store.
 */
public interface TrackingRepository {

    /**
     * Reads the persisted history. Never fails: a missing or unreadable artifact yields an
     * empty store, because losing history only means events are notified again.
     */
    TrackingStore load();

    /**
     * Replaces the persisted history with the given store, atomically.
     *
     * @throws com.eventalerts.alerter.domain.exceptions.PersistException if the write failed;
     *     the previously persisted state is then left untouched
     */
    void save(TrackingStore store);
}
