package com.eventalerts.alerter.infrastructure.notification;

import com.eventalerts.alerter.application.config.AlertsProperties;
import com.eventalerts.alerter.domain.exceptions.ConfigException;
import com.eventalerts.alerter.domain.exceptions.NotificationException;
import com.eventalerts.alerter.domain.notification.Delivery;
import com.eventalerts.alerter.domain.notification.Notifier;
import com.eventalerts.alerter.domain.notification.RenderedMessage;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Posts a MessageCard to an incoming Teams webhook. The webhook decides the audience,
 * so recipients are ignored.
 */
@Component
@ConditionalOnProperty(prefix = "alerts.notification.teams", name = "enabled", havingValue = "true")
public class TeamsWebhookNotifier implements Notifier {

    static final String THEME_COLOR = "2EA9DE";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI webhook;
    private final Duration timeout;

    @Autowired
    public TeamsWebhookNotifier(AlertsProperties properties, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(properties.notification().teams().timeout()).build(),
                objectMapper,
                properties.notification().teams());
    }

    TeamsWebhookNotifier(HttpClient httpClient, ObjectMapper objectMapper, AlertsProperties.Teams teams) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        if (teams.webhookUrl() == null || teams.webhookUrl().isBlank()) {
            throw ConfigException.invalid("alerts.notification.teams.webhook-url", "required when Teams is enabled");
        }
        try {
            this.webhook = URI.create(teams.webhookUrl().trim());
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalid("alerts.notification.teams.webhook-url", e.getMessage());
        }
        this.timeout = teams.timeout();
    }

    @Override
    public String channel() {
        return Delivery.TEAMS;
    }

    @Override
    public void send(RenderedMessage message, List<String> recipients) {
        var request = HttpRequest.newBuilder(webhook)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(card(message)),
                        StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw NotificationException.deliveryFailed(channel(), e);
        } catch (IOException e) {
            throw NotificationException.deliveryFailed(channel(), e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw NotificationException.rejected(channel(), response.statusCode(), response.body());
        }
    }

    static Map<String, Object> card(RenderedMessage message) {
        var card = new LinkedHashMap<String, Object>();
        card.put("@type", "MessageCard");
        card.put("@context", "https://schema.org/extensions");
        card.put("themeColor", THEME_COLOR);
        card.put("summary", message.subject());
        card.put("title", message.subject());
        // Teams markdown needs two trailing spaces for a line break
        card.put("text", message.plainText().replace("\n", "  \n"));
        return card;
    }
}
