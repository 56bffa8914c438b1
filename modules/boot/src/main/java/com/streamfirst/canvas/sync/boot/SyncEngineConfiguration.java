package com.streamfirst.canvas.sync.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.canvas.sync.adapters.ExecutorTaskScheduler;
import com.streamfirst.canvas.sync.adapters.InMemoryChangeFeedAdapter;
import com.streamfirst.canvas.sync.adapters.InMemoryRemoteStoreAdapter;
import com.streamfirst.canvas.sync.adapters.InMemoryWorkspaceStateAdapter;
import com.streamfirst.canvas.sync.adapters.backend.rest.PollingChangeFeedAdapter;
import com.streamfirst.canvas.sync.adapters.backend.rest.RestRemoteStoreAdapter;
import com.streamfirst.canvas.sync.adapters.storage.file.FileLocalStorageAdapter;
import com.streamfirst.canvas.sync.application.StartReport;
import com.streamfirst.canvas.sync.application.SyncEngine;
import com.streamfirst.canvas.sync.application.SyncSettings;
import com.streamfirst.canvas.sync.application.SyncTables;
import com.streamfirst.canvas.sync.domain.DataType;
import com.streamfirst.canvas.sync.domain.LayoutMode;
import com.streamfirst.canvas.sync.domain.OwnerId;
import com.streamfirst.canvas.sync.domain.PreferencesUpdate;
import com.streamfirst.canvas.sync.domain.Tab;
import com.streamfirst.canvas.sync.domain.TabsPayload;
import com.streamfirst.canvas.sync.domain.UiSettings;
import com.streamfirst.canvas.sync.ports.ChangeFeedPort;
import com.streamfirst.canvas.sync.ports.LocalStoragePort;
import com.streamfirst.canvas.sync.ports.RemoteStorePort;
import com.streamfirst.canvas.sync.ports.TaskScheduler;
import com.streamfirst.canvas.sync.ports.WorkspaceStatePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Wires a sync engine for this process. With a configured backend the engine talks to the REST
 * store and polls it for remote changes. In local-only mode it syncs against an in-process store
 * and change feed, which lets several engines in one JVM share state. With neither, sync is
 * disabled: local edits still apply and every cloud call reports the missing configuration.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncEngineConfiguration {

    @Bean
    public SyncSettings syncSettings(SyncProperties properties) {
        SyncSettings settings = properties.toSettings();
        log.info("Sync settings: {} (enabled={})", settings, settings.isEnabled());
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // --- Adapter beans ---

    @Bean
    public ExecutorTaskScheduler syncTaskScheduler() {
        return new ExecutorTaskScheduler("canvas-sync-timer");
    }

    @Bean
    public InMemoryChangeFeedAdapter localChangeFeed() {
        return new InMemoryChangeFeedAdapter();
    }

    @Bean
    public RemoteStorePort remoteStore(
            SyncSettings settings, SyncProperties properties, ObjectMapper mapper, InMemoryChangeFeedAdapter localChangeFeed) {
        if (usesRestBackend(settings)) {
            log.info("Using REST backend at {}", settings.getBackendUrl());
            return new RestRemoteStoreAdapter(settings.getBackendUrl(), settings.getAccessKey(),
                properties.getConnectTimeout(), properties.getRequestTimeout(), mapper);
        }
        if (settings.isLocalOnly()) {
            log.info("Local-only mode, syncing through the in-process store");
        } else {
            log.info("No backend configured, sync is disabled");
        }
        return new InMemoryRemoteStoreAdapter(localChangeFeed);
    }

    @Bean
    @Primary
    public ChangeFeedPort changeFeed(
            SyncSettings settings,
            SyncProperties properties,
            RemoteStorePort remoteStore,
            TaskScheduler syncTaskScheduler,
            InMemoryChangeFeedAdapter localChangeFeed) {
        if (usesRestBackend(settings)) {
            return new PollingChangeFeedAdapter(remoteStore, syncTaskScheduler, properties.getPollInterval(), Map.of(
                SyncTables.CANVAS_DATA, SyncTables.CANVAS_DATA_KEY,
                SyncTables.PREFERENCES, SyncTables.PREFERENCES_KEY));
        }
        return localChangeFeed;
    }

    @Bean
    public LocalStoragePort localStorage(SyncProperties properties) {
        return new FileLocalStorageAdapter(Path.of(properties.getLocalStorageFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkspaceStatePort workspaceState() {
        return new InMemoryWorkspaceStateAdapter();
    }

    // --- Engine ---

    @Bean
    public SyncEngine syncEngine(
            SyncSettings settings,
            RemoteStorePort remoteStore,
            ChangeFeedPort changeFeed,
            LocalStoragePort localStorage,
            WorkspaceStatePort workspaceState,
            TaskScheduler syncTaskScheduler,
            Clock clock,
            ObjectMapper mapper) {
        return new SyncEngine(settings, remoteStore, changeFeed, localStorage, workspaceState,
            syncTaskScheduler, clock, mapper);
    }

    // --- Demo runner ---

    @Bean
    @ConditionalOnProperty(prefix = "canvas.sync.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(SyncEngine engine, WorkspaceStatePort workspaceState, SyncProperties properties) {
        return args -> {
            OwnerId owner = new OwnerId(properties.getDemo().getOwnerId());
            log.info("--- Starting canvas sync demo for {} on {} ---", owner, engine.deviceId());

            StartReport report = engine.start(owner);
            log.info("STEP 1: session started: {}", report);

            engine.updateLocal(owner, TabsPayload.of(Tab.of("t1", "Welcome"), Tab.of("t2", "Notes")));
            engine.updatePreferences(owner, PreferencesUpdate.builder()
                .layoutMode(LayoutMode.CANVAS)
                .uiSettings(UiSettings.builder().pointerFrameEnabled(true).build())
                .build());
            log.info("STEP 2: local edits applied, pending writes {}", engine.pendingWrites());

            int flushed = engine.flushPendingWrites();
            log.info("STEP 3: flushed {} writes", flushed);

            log.info("STEP 4: remote tabs now {}", engine.load(owner, DataType.TABS));
            log.info("Local tabs {}, preferences {}", workspaceState.tabs().orElse(null),
                workspaceState.preferences().orElse(null));
            log.info("--- Demo finished ---");
        };
    }

    private static boolean usesRestBackend(SyncSettings settings) {
        return settings.hasRemoteBackend() && !settings.isLocalOnly();
    }
}
