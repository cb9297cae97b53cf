package com.meteoharvest.core.bus;

import com.meteoharvest.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Run lifecycle events, delivered synchronously on the publishing thread in subscription order.
 * Pipelines publish from worker threads, so subscribe and publish may interleave freely.
 * A handler failure goes to {@code onHandlerError}; the run and the other handlers carry on.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<Event>>> handlersByType = new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING,
                "event.handler.failed type=" + event.type() + " pipeline=" + event.pipeline(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        handlersByType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    public void publish(Event event) {
        for (Consumer<Event> handler : handlersByType.getOrDefault(event.getClass(), List.of())) {
            try {
                handler.accept(event);
            } catch (Exception ex) {
                onHandlerError.accept(event, ex);
            }
        }
    }
}
