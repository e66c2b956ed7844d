package com.twinkle.agent.event;

import com.twinkle.agent.commitment.CommitmentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered, append-only record of one run's lifecycle events, fanned out to at most one
 * listener. Safe for concurrent emitters; the listener sees events in append order.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final Clock clock;
    private final List<AgentEvent> events = new ArrayList<>();
    private volatile EventListener listener;

    public EventLog() {
        this(Clock.systemUTC());
    }

    public EventLog(Clock clock) {
        this.clock = clock;
    }

    public void onEvent(EventListener listener) {
        this.listener = listener;
    }

    public AgentEvent emit(EventType type, String phase, Map<String, Object> data) {
        return emit(type, phase, data, null);
    }

    public AgentEvent emit(EventType type, String phase, Map<String, Object> data, CommitmentResult commitment) {
        AgentEvent event = new AgentEvent(type, clock.instant(), phase, data, commitment);
        synchronized (events) {
            events.add(event);
            EventListener current = listener;
            if (current != null) {
                try {
                    current.onEvent(event);
                } catch (RuntimeException e) {
                    // observers never steer the run
                    log.warn("Event listener failed on {}: {}", type.wireName(), e.toString());
                }
            }
        }
        return event;
    }

    public List<AgentEvent> all() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public List<AgentEvent> ofType(EventType type) {
        return all().stream().filter(e -> e.type == type).collect(Collectors.toList());
    }

    public int count() {
        synchronized (events) {
            return events.size();
        }
    }

    /** Ordered event payload from alternating keys and values; values may be null. */
    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("fields() needs key/value pairs");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return data;
    }
}
