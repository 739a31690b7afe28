package com.aiverse.fabric.units.feature;

import com.aiverse.fabric.contracts.StoreType;
import com.aiverse.fabric.contracts.feature.FeatureStoreWriteInput;
import com.aiverse.fabric.contracts.feature.FeatureStoreWriteResult;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static org.junit.jupiter.api.Assertions.*;

class FeatureStoreWriterTest {

    private final TestPorts.Staging staging = new TestPorts.Staging().put("features", "12345");
    private final TestPorts.FeatureStore store = new TestPorts.FeatureStore();

    private FeatureStoreWriter.Input input(long ttl) {
        return new FeatureStoreWriter.Input(new FeatureStoreWriteInput("features", "fs/users", StoreType.ONLINE, ttl));
    }

    @Test
    void run_writesToStore() throws Exception {
        UnitOutput<FeatureStoreWriteResult> out = new FeatureStoreWriter(staging, store).run(input(3600), TENANT);

        assertTrue(out.isSuccess());
        assertEquals(5, out.result().entitiesWritten());
        assertEquals("online://fs/users", out.result().storeLocation());
        assertEquals(3600, store.lastTtl);
    }

    @Test
    void run_ttlBoundsAreInclusive() throws Exception {
        FeatureStoreWriter unit = new FeatureStoreWriter(staging, store);

        assertTrue(unit.run(input(FeatureStoreWriter.MIN_TTL_SECONDS), TENANT).isSuccess());
        assertTrue(unit.run(input(FeatureStoreWriter.MAX_TTL_SECONDS), TENANT).isSuccess());
        assertEquals("TTL_INVALID", unit.run(input(59), TENANT).errorCode());
        assertEquals("TTL_INVALID", unit.run(input(FeatureStoreWriter.MAX_TTL_SECONDS + 1), TENANT).errorCode());
    }

    @Test
    void run_ttlIsCheckedBeforeStaging() throws Exception {
        staging.readFailure = PortFailure.READ_FAILURE;

        assertEquals("TTL_INVALID", new FeatureStoreWriter(staging, store).run(input(1), TENANT).errorCode());
    }

    @Test
    void run_mapsStoreFailures() throws Exception {
        store.failure = PortFailure.WRITE_FAILURE;
        assertEquals("STORE_WRITE_FAILURE", new FeatureStoreWriter(staging, store).run(input(600), TENANT).errorCode());

        store.failure = PortFailure.UNAVAILABLE;
        assertEquals("STORE_UNAVAILABLE", new FeatureStoreWriter(staging, store).run(input(600), TENANT).errorCode());
    }
}
