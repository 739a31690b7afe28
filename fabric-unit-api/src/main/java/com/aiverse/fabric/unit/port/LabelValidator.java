package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

public interface LabelValidator {

    SchemaCheck validateLabel(Object labelValue, String schemaRef, TenantContext tenant) throws PortException;
}
