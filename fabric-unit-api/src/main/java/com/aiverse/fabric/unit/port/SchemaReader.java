package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

/** Reads the schema and a sample of an external source. */
public interface SchemaReader {

    /**
     * @throws PortException {@code NETWORK} (cannot connect), {@code ACCESS_DENIED} or {@code NOT_FOUND}
     */
    SchemaSnapshot readSchema(String connectionRef, String sourcePath, int sampleSize, TenantContext tenant)
            throws PortException;

    record SchemaSnapshot(List<SourceField> fields, List<String> primaryKeys, long rowCountEstimate,
                          Map<String, List<Object>> sampleValues) {
        public SchemaSnapshot {
            fields = Copies.list(fields);
            primaryKeys = Copies.list(primaryKeys);
            sampleValues = Copies.map(sampleValues);
        }
    }

    /** A null {@code nullable} means the source did not say. */
    record SourceField(String name, String type, Boolean nullable) {
    }
}
