package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.DataType;

import java.util.List;
import java.util.Set;

/**
 * What {@link SyncEngine#start} did for one owner.
 *
 * @param migration outcome of the one-time legacy migration
 * @param hydratedTypes data types loaded from the remote store into local state
 * @param preferencesHydrated whether remote preferences were merged into local state
 * @param channels keys of the channels now subscribed
 */
public record StartReport(
        MigrationOutcome migration,
        Set<DataType> hydratedTypes,
        boolean preferencesHydrated,
        List<String> channels) {

    public StartReport {
        hydratedTypes = Set.copyOf(hydratedTypes);
        channels = List.copyOf(channels);
    }

    static StartReport disabled() {
        return new StartReport(MigrationOutcome.SYNC_DISABLED, Set.of(), false, List.of());
    }
}
