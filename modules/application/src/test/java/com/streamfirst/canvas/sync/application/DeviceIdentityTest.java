package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.adapters.InMemoryLocalStorageAdapter;
import com.streamfirst.canvas.sync.domain.DeviceId;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceIdentityTest {

    private final InMemoryLocalStorageAdapter storage = new InMemoryLocalStorageAdapter();
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    void generatesTimestampedIdAndPersistsIt() {
        DeviceId id = new DeviceIdentity(storage, clock, new Random(7)).getDeviceId();

        assertThat(id.value()).matches("device_1700000000000_[0-9a-z]{13}");
        assertThat(storage.get(DeviceIdentity.STORAGE_KEY)).contains(id.value());
    }

    @Test
    void sameProfileKeepsItsIdAcrossRestarts() {
        DeviceId first = new DeviceIdentity(storage, clock, new Random(1)).getDeviceId();
        DeviceId afterRestart = new DeviceIdentity(storage, clock, new Random(2)).getDeviceId();

        assertThat(afterRestart).isEqualTo(first);
        assertThat(storage.size()).isEqualTo(1);
    }

    @Test
    void repeatedCallsReturnTheCachedId() {
        DeviceIdentity identity = new DeviceIdentity(storage, clock, new Random(3));
        DeviceId first = identity.getDeviceId();
        storage.remove(DeviceIdentity.STORAGE_KEY);

        assertThat(identity.getDeviceId()).isEqualTo(first);
        assertThat(identity.isLocal(first.value())).isTrue();
        assertThat(identity.isLocal("device_1_other")).isFalse();
        assertThat(identity.isLocal(null)).isFalse();
    }

    @Test
    void existingStoredIdIsReused() {
        storage.put(DeviceIdentity.STORAGE_KEY, "device_42_legacyprofile1");

        assertThat(new DeviceIdentity(storage).getDeviceId().value()).isEqualTo("device_42_legacyprofile1");
    }

    @Test
    void unwritableStorageStillYieldsOneStableId() {
        storage.setWritable(false);
        DeviceIdentity identity = new DeviceIdentity(storage, clock, new Random(5));

        DeviceId id = identity.getDeviceId();

        assertThat(id.value()).matches("device_1700000000000_[0-9a-z]{13}");
        assertThat(identity.getDeviceId()).isEqualTo(id);
        assertThat(storage.get(DeviceIdentity.STORAGE_KEY)).isEmpty();
    }
}
