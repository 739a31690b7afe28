package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

public interface LabelSchemaValidator {

    SchemaCheck validate(String labelSchemaRef, TenantContext tenant) throws PortException;
}
