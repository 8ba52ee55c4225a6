package com.migranet.communication;

import java.util.List;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class EventListenerRegistrar {

    private final EventBus eventBus;
    private final List<MigrationEventListener> listeners;

    public EventListenerRegistrar(
            EventBus eventBus,
            List<MigrationEventListener> listeners) {
        this.eventBus = eventBus;
        this.listeners = listeners;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerListeners() {
        for (MigrationEventListener listener : listeners) {
            eventBus.subscribe(listener);
        }
    }
}
