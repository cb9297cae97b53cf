package com.meteoharvest.core.events;

import java.time.Instant;

public interface Event {
    Instant timestamp();

    String type();

    /**
     * Name of the pipeline whose run emitted the event.
     */
    String pipeline();
}
