package com.aiverse.fabric.unit.port;

import com.aiverse.fabric.contracts.TenantContext;
import com.aiverse.fabric.unit.PortException;

public interface AnnotationStore {

    /**
     * @return annotation id
     * @throws PortException {@code WRITE_FAILURE}
     */
    String storeAnnotation(String taskRef, String sampleId, Object labelValue, String annotatorRef,
                           TenantContext tenant) throws PortException;
}
