/**
 * Ports through which execution units reach registries, storage and compute engines. Implementations are
 * bound by {@link com.aiverse.fabric.unit.PortProvider}s; failures are reported as
 * {@link com.aiverse.fabric.unit.PortException} with a {@link com.aiverse.fabric.unit.PortFailure} kind.
 */
package com.aiverse.fabric.unit.port;
