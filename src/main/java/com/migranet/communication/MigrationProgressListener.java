package com.migranet.communication;

import com.migranet.core.event.MigrationEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every migration event to the log: failures at WARN/ERROR, the rest at INFO.
 */
@Component
public class MigrationProgressListener implements MigrationEventListener {

    private static final Logger log = LoggerFactory.getLogger(MigrationProgressListener.class);

    @Override
    public void onEvent(MigrationEvent event) {
        switch (event.getType()) {
            case OBJECT_UNRESOLVED:
                log.error("[Progress] UNRESOLVED {}", event.getPayload());
                break;
            case BATCH_CANCELLED:
                log.warn("[Progress] Batch cancelled: {}", event.getPayload());
                break;
            case STATUS_CHANGED:
                log.debug("[Progress] {}", event.getPayload());
                break;
            default:
                log.info("[Progress] {} {}", event.getType(), event.getPayload());
        }
    }
}
