package com.migranet.core.event;

public enum MigrationEventType {
    BATCH_STARTED,
    OBJECT_STARTED,
    STATUS_CHANGED,
    OBJECT_DEPLOYED,
    OBJECT_UNRESOLVED,
    BATCH_COMPLETED,
    BATCH_CANCELLED
}
