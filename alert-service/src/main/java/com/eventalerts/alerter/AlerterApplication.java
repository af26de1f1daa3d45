package com.eventalerts.alerter;

import java.util.Arrays;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlerterApplication {

    // Short flags kept for existing cron entries and container commands
    private static final Map<String, String> FLAGS = Map.of(
            "--run-once", "--alerts.scheduler.run-once=true",
            "--dry-run", "--alerts.notification.dry-run=true");

    public static void main(String[] args) {
        var context = SpringApplication.run(AlerterApplication.class, expandFlags(args));
        if (context.getEnvironment().getProperty("alerts.scheduler.run-once", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }

    static String[] expandFlags(String[] args) {
        return Arrays.stream(args)
                .map(arg -> FLAGS.getOrDefault(arg, arg))
                .toArray(String[]::new);
    }
}
