package com.eventalerts.alerter.application.config;

import com.eventalerts.alerter.domain.cycle.DeadlineExecutor;
import com.eventalerts.alerter.domain.exceptions.ConfigException;
import com.eventalerts.alerter.domain.notification.NotificationDispatcher;
import com.eventalerts.alerter.domain.notification.Notifier;
import com.eventalerts.alerter.domain.notification.RecipientRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class NotificationConfig {

    @Bean
    public RecipientRouter recipientRouter(AlertsProperties properties) {
        validate(properties.notification());
        var email = properties.notification().email();
        var router = RecipientRouter.builder()
                .emailEnabled(email.enabled())
                .internalRecipients(email.internalRecipients())
                .teamsChannelAddress(email.teamsChannelAddress())
                .teamsEnabled(properties.notification().teams().enabled());
        email.routes().forEach(route ->
                router.route(new RecipientRouter.Route(route.name(), route.match(), route.recipients())));
        log.info("Notification channels: email={} (internal={}, routes={}), teams={}, dry-run={}",
                email.enabled(), email.internalRecipients().size(), email.routes().size(),
                properties.notification().teams().enabled(), properties.notification().dryRun());
        return router.build();
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(
            ObjectProvider<Notifier> notifiers, RecipientRouter recipientRouter, DeadlineExecutor deadlineExecutor) {
        return new NotificationDispatcher(notifiers.orderedStream().toList(), recipientRouter, deadlineExecutor);
    }

    static void validate(AlertsProperties.Notification notification) {
        var email = notification.email();
        if (email.enabled()) {
            var hasRecipients = !email.internalRecipients().isEmpty()
                    || email.routes().stream().anyMatch(route -> !route.recipients().isEmpty())
                    || (email.teamsChannelAddress() != null && !email.teamsChannelAddress().isBlank());
            if (!hasRecipients) {
                throw ConfigException.invalid("alerts.notification.email.internal-recipients",
                        "email is enabled but no recipient is configured");
            }
        }
        if (!notification.dryRun() && !email.enabled() && !notification.teams().enabled()) {
            throw ConfigException.invalid("alerts.notification",
                    "no channel is enabled; enable email or teams, or run with dry-run");
        }
    }
}
