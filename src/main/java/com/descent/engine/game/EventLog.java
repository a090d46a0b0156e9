package com.descent.engine.game;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ordered record of every event of a combat, plus the queue of events
 * the relic pass has not consumed yet.
 */
public class EventLog {
    private final List<CombatEvent> events = new ArrayList<>();
    private final Deque<CombatEvent> pending = new ArrayDeque<>();

    public void emit(CombatEvent event) {
        events.add(event);
        pending.addLast(event);
    }

    /**
     * Next event the relic pass has not seen, or null.
     */
    public CombatEvent pollPending() {
        return pending.pollFirst();
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public List<CombatEvent> getEvents() {
        return List.copyOf(events);
    }

    /**
     * Events emitted at or after the given position.
     */
    public List<CombatEvent> eventsSince(int index) {
        return List.copyOf(events.subList(Math.min(index, events.size()), events.size()));
    }

    public int size() {
        return events.size();
    }

    public long count(LifecycleEvent type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    public void clear() {
        events.clear();
        pending.clear();
    }
}
