package com.eventalerts.alerter.domain.exceptions;

public class NotificationException extends AlertingException {

    private final String channel;

    private NotificationException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public static NotificationException deliveryFailed(String channel, Throwable cause) {
        return new NotificationException(channel, channel + " delivery failed: " + cause.getMessage(), cause);
    }

    public static NotificationException rejected(String channel, int statusCode, String body) {
        return new NotificationException(
                channel, channel + " endpoint rejected the message with HTTP " + statusCode + ": " + body, null);
    }

    public String channel() {
        return channel;
    }
}
