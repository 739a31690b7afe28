package com.aiverse.fabric.units.ingestion;

import com.aiverse.fabric.contracts.DataFormat;
import com.aiverse.fabric.contracts.ingestion.DataExtractionInput;
import com.aiverse.fabric.contracts.ingestion.DataExtractionResult;
import com.aiverse.fabric.unit.PortException;
import com.aiverse.fabric.unit.PortFailure;
import com.aiverse.fabric.unit.UnitOutput;
import com.aiverse.fabric.unit.port.DataReader;
import com.aiverse.fabric.unit.port.DataReader.SourceBatch;
import com.aiverse.fabric.units.TestPorts;
import org.junit.jupiter.api.Test;

import static com.aiverse.fabric.units.TestPorts.TENANT;
import static com.aiverse.fabric.units.TestPorts.bytes;
import static org.junit.jupiter.api.Assertions.*;

class DataExtractorTest {

    private final TestPorts.Staging staging = new TestPorts.Staging();
    private final DataReader reader = (conn, query, offset, limit, tenant) ->
            new SourceBatch(bytes("a,b\n1,2\n"), 1, "2024-05-01T00:00:00Z");
    private final DataExtractor.Input input = new DataExtractor.Input(new DataExtractionInput(
            "conn", "select * from t", 0, 100, DataFormat.PARQUET, "stage/t"));

    @Test
    void run_stagesBatchAndReportsWatermark() throws Exception {
        UnitOutput<DataExtractionResult> out = new DataExtractor(reader, staging).run(input, TENANT);

        assertTrue(out.isSuccess());
        assertEquals(8, out.result().bytesExtracted());
        assertEquals(1, out.result().rowsExtracted());
        assertEquals("stage/t", out.result().stagingRef());
        assertEquals("2024-05-01T00:00:00Z", out.result().watermarkValue());
        assertArrayEquals(bytes("a,b\n1,2\n"), staging.data.get("stage/t"));
    }

    @Test
    void run_mapsSourceFailures() throws Exception {
        assertEquals("SOURCE_READ_FAILURE", readFailing(PortFailure.READ_FAILURE).errorCode());
        assertEquals("FORMAT_ERROR", readFailing(PortFailure.FORMAT).errorCode());
    }

    @Test
    void run_mapsStagingFailures() throws Exception {
        staging.writeFailure = PortFailure.WRITE_FAILURE;
        assertEquals("TARGET_WRITE_FAILURE", new DataExtractor(reader, staging).run(input, TENANT).errorCode());

        staging.writeFailure = PortFailure.QUOTA_EXCEEDED;
        UnitOutput<DataExtractionResult> quota = new DataExtractor(reader, staging).run(input, TENANT);
        assertEquals("QUOTA_EXCEEDED", quota.errorCode());
        assertEquals("Storage quota exceeded", quota.errorMessage());
    }

    private UnitOutput<DataExtractionResult> readFailing(PortFailure failure) throws PortException {
        DataReader failing = (conn, query, offset, limit, tenant) -> {
            throw new PortException(failure, "bad");
        };
        return new DataExtractor(failing, staging).run(input, TENANT);
    }
}
