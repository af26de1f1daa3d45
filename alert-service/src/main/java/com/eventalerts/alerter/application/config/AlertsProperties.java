package com.eventalerts.alerter.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "alerts")
public record AlertsProperties(
        @NotNull @Valid Scheduler scheduler,
        @NotNull @DurationUnit(ChronoUnit.DAYS) Duration reminderFrequency,
        @NotNull ZoneId timezone,
        @NotNull @Valid Tracking tracking,
        @NotNull @Valid Query query,
        @NotNull @Valid Notification notification) {

    public record Scheduler(
            @NotNull @DurationUnit(ChronoUnit.HOURS) Duration interval,
            @NotNull Duration cycleTimeout,
            boolean runOnce) {}

    public record Tracking(@NotBlank String file, @NotBlank String livenessFile) {}

    public record Query(
            @NotBlank String file,
            int typeId,
            int statusId,
            String nameFilter,
            String nameExclude,
            @Min(1) int lookbackDays) {}

    public record Notification(
            boolean dryRun,
            @NotBlank String companyName,
            @NotBlank String eventsBaseUrl,
            @NotNull @Valid Email email,
            @NotNull @Valid Teams teams) {}

    public record Email(
            boolean enabled,
            String from,
            List<String> internalRecipients,
            List<@Valid Route> routes,
            String teamsChannelAddress,
            String logo) {

        public Email {
            internalRecipients = addresses(internalRecipients);
            routes = routes == null ? List.of() : List.copyOf(routes);
        }
    }

    public record Route(@NotBlank String name, @NotBlank String match, List<String> recipients) {

        public Route {
            recipients = addresses(recipients);
        }
    }

    public record Teams(boolean enabled, String webhookUrl, @NotNull Duration timeout) {}

    // Comma-separated env values may leave blanks behind
    private static List<String> addresses(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(address -> address != null && !address.isBlank())
                .map(String::trim)
                .toList();
    }
}
