package com.migranet.config;

import com.migranet.core.memory.MemoryStore;
import com.migranet.core.memory.SharedMemoryStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Map;

/**
 * Wires the pieces that are built from configuration rather than discovered:
 * both endpoints' credentials and the run-wide memory store.
 */
@Configuration
public class AdapterConfig {

    private static final Logger log = LoggerFactory.getLogger(AdapterConfig.class);

    public static final String SOURCE_CREDENTIALS = "sourceCredentials";
    public static final String TARGET_CREDENTIALS = "targetCredentials";

    @Bean(SOURCE_CREDENTIALS)
    public ConnectionCredentials sourceCredentials(Environment environment) {
        return bind(environment, "source");
    }

    @Bean(TARGET_CREDENTIALS)
    public ConnectionCredentials targetCredentials(Environment environment) {
        return bind(environment, "target");
    }

    /** Loaded once at startup; flushed by the orchestrator. */
    @Bean
    public MemoryStore memoryStore(SharedMemoryStore sharedMemoryStore) {
        return sharedMemoryStore.load();
    }

    private ConnectionCredentials bind(Environment environment, String side) {
        Map<String, String> raw = Binder.get(environment)
                .bind("migranet." + side, Bindable.mapOf(String.class, String.class))
                .orElse(Map.of());
        ConnectionCredentials credentials = CredentialNormalizer.normalize(side, raw);
        log.info("[Config] {} endpoint {}", side, credentials);
        return credentials;
    }
}
