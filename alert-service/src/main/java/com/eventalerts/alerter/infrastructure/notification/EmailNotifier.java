package com.eventalerts.alerter.infrastructure.notification;

import com.eventalerts.alerter.application.config.AlertsProperties;
import com.eventalerts.alerter.domain.exceptions.ConfigException;
import com.eventalerts.alerter.domain.exceptions.NotificationException;
import com.eventalerts.alerter.domain.notification.Delivery;
import com.eventalerts.alerter.domain.notification.MessageRenderer;
import com.eventalerts.alerter.domain.notification.Notifier;
import com.eventalerts.alerter.domain.notification.RenderedMessage;
import jakarta.mail.MessagingException;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Sends the rendered message as a multipart (plain text + HTML) email, with the company
 * logo attached inline when one is configured and the HTML body shows it.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "alerts.notification.email", name = "enabled", havingValue = "true")
public class EmailNotifier implements Notifier {

    private final JavaMailSender mailSender;
    private final String from;
    private final Resource logo;

    public EmailNotifier(
            ObjectProvider<JavaMailSender> mailSender, AlertsProperties properties, ResourceLoader resourceLoader) {
        // Boot only creates the sender when spring.mail.host is set
        this.mailSender = mailSender.getIfAvailable();
        if (this.mailSender == null) {
            throw ConfigException.invalid("spring.mail.host", "required when email is enabled");
        }
        this.from = properties.notification().email().from();
        if (from == null || from.isBlank()) {
            throw ConfigException.invalid("alerts.notification.email.from", "required when email is enabled");
        }
        this.logo = resolveLogo(properties.notification().email().logo(), resourceLoader).orElse(null);
    }

    @Override
    public String channel() {
        return Delivery.EMAIL;
    }

    public boolean hasLogo() {
        return logo != null;
    }

    @Override
    public void send(RenderedMessage message, List<String> recipients) {
        try {
            var mimeMessage = mailSender.createMimeMessage();
            var helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
            helper.setFrom(from);
            helper.setTo(recipients.toArray(String[]::new));
            helper.setSubject(message.subject());
            helper.setText(message.plainText(), message.html());
            if (logo != null && message.html().contains("cid:" + MessageRenderer.LOGO_CONTENT_ID)) {
                helper.addInline(MessageRenderer.LOGO_CONTENT_ID, logo);
            }
            mailSender.send(mimeMessage);
        } catch (MessagingException | MailException e) {
            throw NotificationException.deliveryFailed(channel(), e);
        }
    }

    private static Optional<Resource> resolveLogo(String location, ResourceLoader resourceLoader) {
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        var resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Email logo {} not found, sending emails without it", location);
            return Optional.empty();
        }
        return Optional.of(resource);
    }
}
