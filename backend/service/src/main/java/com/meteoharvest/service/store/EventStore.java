package com.meteoharvest.service.store;

import com.meteoharvest.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only run ledger.
 */
public interface EventStore {
    void append(Event event);

    /**
     * Events at or after {@code since}, optionally of one type, keeping the most recent {@code limit}.
     */
    List<Event> query(Instant since, Optional<String> type, int limit);
}
