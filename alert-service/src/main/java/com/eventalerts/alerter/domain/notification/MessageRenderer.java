package com.eventalerts.alerter.domain.notification;

import com.eventalerts.alerter.domain.dedup.DedupDecision;
import com.eventalerts.common.event.EventRecord;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

/**
 * Turns one event into a subject, a plain-text body and an HTML body.
 */
@Builder
public class MessageRenderer {

    public static final String LOGO_CONTENT_ID = "company_logo";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z");

    private final String companyName;
    private final String eventsBaseUrl;
    private final ZoneId zone;
    private final boolean includeLogo;

    public RenderedMessage render(EventRecord event, DedupDecision decision, Instant runTime) {
        var fields = fields(event);
        return RenderedMessage.builder()
                .subject(subject(event, decision))
                .plainText(plainText(event, decision, fields, runTime))
                .html(html(event, decision, fields, runTime, includeLogo))
                .compactHtml(html(event, decision, fields, runTime, false))
                .build();
    }

    public String eventLink(EventRecord event) {
        var base = eventsBaseUrl.endsWith("/") ? eventsBaseUrl.substring(0, eventsBaseUrl.length() - 1) : eventsBaseUrl;
        return base + "/" + event.id();
    }

    private String subject(EventRecord event, DedupDecision decision) {
        var kind = decision == DedupDecision.NOTIFY_REMINDER ? "Reminder" : "New";
        var type = event.type() == null || event.type().isBlank() ? "Event" : event.type();
        return companyName + " | " + kind + " " + type + ": " + displayName(event);
    }

    private String plainText(EventRecord event, DedupDecision decision, Map<String, String> fields, Instant runTime) {
        var text = new StringBuilder()
                .append(companyName).append(" alert | ").append(format(runTime)).append("\n\n")
                .append(headline(decision)).append("\n\n")
                .append("Link: ").append(eventLink(event)).append('\n');
        fields.forEach((label, value) -> text.append(label).append(": ").append(value).append('\n'));
        return text.append("\n---\nThis is an automated message from ").append(companyName).append('.')
                .toString();
    }

    private String html(
            EventRecord event, DedupDecision decision, Map<String, String> fields, Instant runTime, boolean withLogo) {
        var html = new StringBuilder()
                .append("<!DOCTYPE html>\n<html lang=\"en\">\n<head><meta charset=\"UTF-8\"></head>\n")
                .append("<body style=\"font-family:Arial,sans-serif;color:#333;\">\n")
                .append("<div style=\"background-color:#0B4877;color:#fff;padding:15px 25px;\">");
        if (withLogo) {
            html.append("<img src=\"cid:").append(LOGO_CONTENT_ID).append("\" alt=\"")
                    .append(escape(companyName)).append(" logo\" style=\"max-height:50px;\">");
        }
        html.append("<h1 style=\"margin:0;font-size:22px;\">").append(escape(headline(decision))).append("</h1>")
                .append("<p style=\"margin:0;font-size:14px;\">").append(escape(format(runTime))).append("</p>")
                .append("</div>\n")
                .append("<p><a href=\"").append(escape(eventLink(event))).append("\" target=\"_blank\"><strong>")
                .append(escape(displayName(event))).append("</strong></a></p>\n")
                .append("<table style=\"border-collapse:collapse;font-size:14px;\">\n");
        fields.forEach((label, value) -> html.append("<tr><th style=\"text-align:left;padding:6px 10px;\">")
                .append(escape(label)).append("</th><td style=\"padding:6px 10px;\">")
                .append(escape(value)).append("</td></tr>\n"));
        return html.append("</table>\n")
                .append("<p style=\"font-size:12px;color:#888;\">This is an automated report generated by ")
                .append(escape(companyName)).append(".</p>\n</body>\n</html>\n")
                .toString();
    }

    private Map<String, String> fields(EventRecord event) {
        var fields = new LinkedHashMap<String, String>();
        fields.put("Id", event.id());
        putIfPresent(fields, "Name", event.name());
        putIfPresent(fields, "Type", event.type());
        putIfPresent(fields, "Status", event.status());
        if (event.createdAt() != null) {
            fields.put("Created", format(event.createdAt()));
        }
        event.attributes().forEach((column, value) -> fields.put(label(column), value(value)));
        return fields;
    }

    private static String headline(DedupDecision decision) {
        return decision == DedupDecision.NOTIFY_REMINDER
                ? "Reminder: this event is still open"
                : "New event matching the alert criteria";
    }

    private static String displayName(EventRecord event) {
        return event.name() == null || event.name().isBlank() ? "Event " + event.id() : event.name();
    }

    private static void putIfPresent(Map<String, String> fields, String label, String value) {
        if (value != null && !value.isBlank()) {
            fields.put(label, value);
        }
    }

    private String value(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Instant instant) {
            return format(instant);
        }
        return value.toString();
    }

    private String format(Instant instant) {
        return TIMESTAMP.format(instant.atZone(zone));
    }

    // vessel_name -> Vessel Name
    private static String label(String column) {
        var label = new StringBuilder();
        for (var word : column.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }

    private static String escape(String text) {
        var escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
