package com.migranet.communication;

import com.migranet.core.event.MigrationEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<MigrationEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(MigrationEvent event) {
        for (MigrationEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                // listener failures are logged, never rethrown to the publisher
                log.warn("[EventBus] Listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.getType(), e.getMessage());
            }
        }
    }

    @Override
    public void subscribe(MigrationEventListener listener) {
        listeners.add(listener);
    }
}
