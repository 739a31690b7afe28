/**
 * Execution unit API: the {@link com.aiverse.fabric.unit.ExecutionUnit} contract, unit outputs and port
 * failures, the tenant-scoped {@link com.aiverse.fabric.unit.UnitRegistry}, and port adapter loading.
 * Port interfaces live in {@code com.aiverse.fabric.unit.port}.
 */
package com.aiverse.fabric.unit;
