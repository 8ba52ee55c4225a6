package com.migranet.communication;

import com.migranet.core.event.MigrationEvent;

public interface EventBus {

    void publish(MigrationEvent event);

    void subscribe(MigrationEventListener listener);
}
