package com.streamfirst.canvas.sync.boot;

import com.streamfirst.canvas.sync.application.SyncSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized configuration under {@code canvas.sync}.
 */
@Data
@ConfigurationProperties(prefix = "canvas.sync")
public class SyncProperties {

    /** Base URL of the hosted backend, e.g. https://abc.example.co */
    private String backendUrl;

    /** Public access key sent with every backend request */
    private String accessKey;

    /** Suppresses configuration warnings */
    private boolean production;

    /** Runs sync against the in-process store instead of a hosted backend */
    private boolean localOnly;

    private Duration debounceDelay = Duration.ofMillis(1000);
    private Duration reconnectBaseDelay = Duration.ofMillis(2000);
    private int maxReconnectAttempts = 5;
    private String legacyStateKey = "tv25-storage";

    /** File holding device-local storage: device id and migration flags */
    private String localStorageFile = System.getProperty("user.home") + "/.canvas-sync/local-storage.properties";

    /** How often the REST backend is polled for remote changes */
    private Duration pollInterval = Duration.ofSeconds(5);

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration requestTimeout = Duration.ofSeconds(10);

    private final Demo demo = new Demo();

    public SyncSettings toSettings() {
        return SyncSettings.builder()
            .backendUrl(backendUrl)
            .accessKey(accessKey)
            .production(production)
            .localOnly(localOnly)
            .debounceDelay(debounceDelay)
            .reconnectBaseDelay(reconnectBaseDelay)
            .maxReconnectAttempts(maxReconnectAttempts)
            .legacyStateKey(legacyStateKey)
            .build();
    }

    @Data
    public static class Demo {
        /** Runs the demo session on startup */
        private boolean enabled;
        private String ownerId = "demo-user";
    }
}
