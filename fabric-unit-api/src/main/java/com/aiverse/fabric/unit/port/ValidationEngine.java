package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.Copies;
import com.aiverse.fabric.contracts.ValidationMode;
import com.aiverse.fabric.contracts.schema.SchemaDiscrepancy;
import com.aiverse.fabric.unit.PortException;

import java.util.List;
import java.util.Map;

public interface ValidationEngine {

    /**
     * @throws PortException {@code FORMAT} when column types cannot be inferred from the data
     */
    ValidationOutcome validateSchema(byte[] dataset, Map<String, Object> expectedSchema, ValidationMode mode)
            throws PortException;

    record ValidationOutcome(boolean valid, List<SchemaDiscrepancy> discrepancies) {
        public ValidationOutcome {
            discrepancies = Copies.list(discrepancies);
        }
    }
}
