package com.eventalerts.alerter.domain.notification;

import com.eventalerts.common.event.EventRecord;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Singular;

/**
 * Works out who hears about an event. Internal recipients get every event; a route adds
 * its own recipients when the event's recipient metadata contains the route's match text.
 */
@Builder
public class RecipientRouter {

    private final boolean emailEnabled;
    @Singular
    private final List<String> internalRecipients;
    @Singular
    private final List<Route> routes;
    private final String teamsChannelAddress;
    private final boolean teamsEnabled;

    public record Route(String name, String match, List<String> recipients) {

        public Route {
            recipients = recipients == null ? List.of() : List.copyOf(recipients);
        }
    }

    public List<Delivery> route(EventRecord event) {
        var deliveries = new ArrayList<Delivery>();
        if (emailEnabled) {
            if (!internalRecipients.isEmpty()) {
                deliveries.add(new Delivery(Delivery.EMAIL, "internal", internalRecipients));
            }
            for (var route : routes) {
                if (!route.recipients().isEmpty() && event.hasRecipientMatching(route.match())) {
                    deliveries.add(new Delivery(Delivery.EMAIL, route.name(), route.recipients()));
                }
            }
            if (teamsChannelAddress != null && !teamsChannelAddress.isBlank()) {
                deliveries.add(new Delivery(Delivery.EMAIL, "teams-channel", List.of(teamsChannelAddress), true));
            }
        }
        if (teamsEnabled) {
            deliveries.add(new Delivery(Delivery.TEAMS, "teams-webhook", List.of()));
        }
        return deliveries;
    }
}
