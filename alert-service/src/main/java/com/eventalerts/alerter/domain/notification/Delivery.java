package com.eventalerts.alerter.domain.notification;

import java.util.List;

/**
 * One send of a message through a channel to a group of recipients.
 * Webhook channels carry no recipients. A compact delivery gets the body without the logo.
 */
public record Delivery(String channel, String label, List<String> recipients, boolean compact) {

    public static final String EMAIL = "email";
    public static final String TEAMS = "teams";

    public Delivery {
        recipients = List.copyOf(recipients);
    }

    public Delivery(String channel, String label, List<String> recipients) {
        this(channel, label, recipients, false);
    }
}
