package com.streamfirst.canvas.sync.application;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Process-level configuration of the sync engine. Sync is optional infrastructure: when the backend
 * endpoint or access key is missing, or still a template placeholder, the engine runs with sync
 * disabled instead of failing, unless it is explicitly put in local-only mode.
 */
@Value
@Builder(toBuilder = true)
public class SyncSettings {

    public static final String ENV_BACKEND_URL = "CANVAS_SYNC_BACKEND_URL";
    public static final String ENV_ACCESS_KEY = "CANVAS_SYNC_ACCESS_KEY";
    public static final String ENV_PRODUCTION = "CANVAS_SYNC_PRODUCTION";

    private static final List<String> PLACEHOLDER_MARKERS =
        List.of("your-project", "your-anon-key", "your_supabase", "placeholder", "changeme");

    String backendUrl;
    String accessKey;

    /** Production builds stay quiet about missing configuration */
    boolean production;

    /** Syncs against a backend living in this process; no endpoint or key is needed */
    boolean localOnly;

    @NonNull @Builder.Default Duration debounceDelay = Duration.ofMillis(1000);
    @NonNull @Builder.Default Duration reconnectBaseDelay = Duration.ofMillis(2000);
    @Builder.Default int maxReconnectAttempts = 5;

    /** Local storage key of the pre-sync persisted workspace blob */
    @NonNull @Builder.Default String legacyStateKey = "tv25-storage";

    /**
     * True when sync runs, either against a configured backend or in local-only mode.
     */
    public boolean isEnabled() {
        return localOnly || hasRemoteBackend();
    }

    /**
     * True when both the endpoint and the access key are present and not placeholders.
     */
    public boolean hasRemoteBackend() {
        return isConfigured(backendUrl) && isConfigured(accessKey);
    }

    public static SyncSettings disabled() {
        return SyncSettings.builder().build();
    }

    /**
     * Reads the endpoint, key and production flag from environment-style variables, keeping the
     * defaults for everything else.
     */
    public static SyncSettings fromEnvironment(Map<String, String> environment) {
        return SyncSettings.builder()
            .backendUrl(environment.get(ENV_BACKEND_URL))
            .accessKey(environment.get(ENV_ACCESS_KEY))
            .production(Boolean.parseBoolean(environment.getOrDefault(ENV_PRODUCTION, "false")))
            .build();
    }

    static boolean isConfigured(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return PLACEHOLDER_MARKERS.stream().noneMatch(normalized::contains);
    }

    @Override
    public String toString() {
        return "SyncSettings{" +
               "backendUrl=" + backendUrl +
               ", accessKey=" + (accessKey == null ? "null" : "****") +
               ", production=" + production +
               ", localOnly=" + localOnly +
               ", debounceDelay=" + debounceDelay +
               ", reconnectBaseDelay=" + reconnectBaseDelay +
               ", maxReconnectAttempts=" + maxReconnectAttempts +
               '}';
    }
}
