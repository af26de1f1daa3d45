package com.eventalerts.alerter.application.config;

import com.eventalerts.alerter.application.job.ShutdownSignal;
import com.eventalerts.alerter.domain.cycle.DeadlineExecutor;
import com.eventalerts.alerter.domain.cycle.PollCycle;
import com.eventalerts.alerter.domain.dedup.DedupPolicy;
import com.eventalerts.alerter.domain.notification.MessageRenderer;
import com.eventalerts.alerter.domain.notification.NotificationDispatcher;
import com.eventalerts.alerter.domain.query.EventFilter;
import com.eventalerts.alerter.domain.query.EventQuery;
import com.eventalerts.alerter.domain.tracking.TrackingRepository;
import com.eventalerts.alerter.infrastructure.file.JsonFileTrackingRepository;
import com.eventalerts.alerter.infrastructure.file.LivenessFile;
import com.eventalerts.alerter.infrastructure.notification.EmailNotifier;
import com.eventalerts.common.json.JacksonConfig;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties(AlertsProperties.class)
public class AlerterConfig {

    @Bean
    public Clock clock(AlertsProperties properties) {
        return Clock.system(properties.timezone());
    }

    @Bean
    @Primary
    public JsonMapper objectMapper() {
        return JacksonConfig.createObjectMapper();
    }

    /**
     * Runs the blocking query and sends so the cycle can stop waiting at its deadline.
     * Threads of abandoned calls are interrupted on cancel and on shutdown.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService cycleIoExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("cycle-io-"));
    }

    @Bean
    public DeadlineExecutor deadlineExecutor(ExecutorService cycleIoExecutor, Clock clock) {
        return new DeadlineExecutor(cycleIoExecutor, clock);
    }

    @Bean
    public DedupPolicy dedupPolicy(AlertsProperties properties) {
        return new DedupPolicy(properties.reminderFrequency());
    }

    @Bean
    public EventFilter eventFilter(AlertsProperties properties) {
        var query = properties.query();
        return EventFilter.builder()
                .typeId(query.typeId())
                .statusId(query.statusId())
                .nameFilter(query.nameFilter())
                .nameExclude(query.nameExclude())
                .lookbackDays(query.lookbackDays())
                .build();
    }

    @Bean
    public MessageRenderer messageRenderer(AlertsProperties properties, ObjectProvider<EmailNotifier> emailNotifier) {
        var notification = properties.notification();
        var emailWithLogo = emailNotifier.getIfAvailable();
        return MessageRenderer.builder()
                .companyName(notification.companyName())
                .eventsBaseUrl(notification.eventsBaseUrl())
                .zone(properties.timezone())
                .includeLogo(emailWithLogo != null && emailWithLogo.hasLogo())
                .build();
    }

    @Bean
    public TrackingRepository trackingRepository(AlertsProperties properties, JsonMapper objectMapper, Clock clock) {
        return new JsonFileTrackingRepository(Path.of(properties.tracking().file()), objectMapper, clock);
    }

    @Bean
    public LivenessFile livenessFile(AlertsProperties properties, Clock clock) {
        return new LivenessFile(Path.of(properties.tracking().livenessFile()), clock);
    }

    @Bean
    public PollCycle pollCycle(
            AlertsProperties properties,
            EventQuery eventQuery,
            EventFilter eventFilter,
            DedupPolicy dedupPolicy,
            MessageRenderer messageRenderer,
            NotificationDispatcher notificationDispatcher,
            TrackingRepository trackingRepository,
            DeadlineExecutor deadlineExecutor,
            ShutdownSignal shutdownSignal) {
        return PollCycle.builder()
                .eventQuery(eventQuery)
                .eventFilter(eventFilter)
                .dedupPolicy(dedupPolicy)
                .messageRenderer(messageRenderer)
                .dispatcher(notificationDispatcher)
                .trackingRepository(trackingRepository)
                .deadlineExecutor(deadlineExecutor)
                .stopSignal(shutdownSignal)
                .cycleTimeout(properties.scheduler().cycleTimeout())
                .dryRun(properties.notification().dryRun())
                .build();
    }
}
