package com.eventalerts.alerter.domain.notification;

import java.util.List;

/**
 * Outbound transport for rendered messages. One attempt per call; retrying is left to
 * the next poll cycle.
 */
public interface Notifier {

    String channel();

    /**
     * @throws com.eventalerts.alerter.domain.exceptions.NotificationException if the
     *     transport did not accept the message
     */
    void send(RenderedMessage message, List<String> recipients);
}
