package com.migranet.communication;

import com.migranet.core.event.MigrationEvent;

public interface MigrationEventListener {

    void onEvent(MigrationEvent event);
}
