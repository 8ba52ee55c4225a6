package com.migranet.core.event;

import java.time.Instant;
import java.util.UUID;

public class MigrationEvent {

    private final String             eventId;
    private final MigrationEventType type;
    private final String             source;

    // Object name, status, summary ... depending on the event type
    private final Object payload;

    private final Instant timestamp;

    public MigrationEvent(MigrationEventType type, String source, Object payload) {
        this.eventId   = UUID.randomUUID().toString();
        this.type      = type;
        this.source    = source;
        this.payload   = payload;
        this.timestamp = Instant.now();
    }

    public String getEventId() {
        return eventId;
    }

    public MigrationEventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public Object getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return type + " from " + source + ": " + payload;
    }
}
