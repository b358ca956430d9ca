package com.outbreaksentinel.service.store;

import com.outbreaksentinel.core.events.AlertResolved;
import com.outbreaksentinel.core.events.Event;
import com.outbreaksentinel.core.events.OutbreakAlertRaised;
import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.SeriesKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read side of the alert audit trail kept in the event log.
 */
public class AlertTrail {
    private static final String RAISED = "OutbreakAlertRaised";

    private final EventStore eventStore;

    public AlertTrail(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    public List<Alert> raised(Instant since, int limit) {
        List<Alert> alerts = new ArrayList<>();
        for (Event event : eventStore.query(since, Optional.of(RAISED), limit)) {
            alerts.add(((OutbreakAlertRaised) event).alert());
        }
        return alerts;
    }

    /**
     * Latest alert per series that no later {@code AlertResolved} closed, replayed from the whole log.
     */
    public List<Alert> stillOpen() {
        Map<SeriesKey, Alert> latest = new LinkedHashMap<>();
        Set<String> resolved = new HashSet<>();
        eventStore.replay(event -> {
            if (event instanceof OutbreakAlertRaised raised) {
                latest.merge(raised.alert().seriesKey(), raised.alert(), (current, candidate) ->
                        candidate.detectedAt().isBefore(current.detectedAt()) ? current : candidate);
            } else if (event instanceof AlertResolved closed) {
                resolved.add(closed.alert().id());
            }
        });
        return latest.values().stream().filter(alert -> !resolved.contains(alert.id())).toList();
    }
}
