/**
 * Integration with the MCOP control plane: intent decomposition ({@link com.aiverse.fabric.mcop.IntentHandler}),
 * capability profiles ({@link com.aiverse.fabric.mcop.CapabilityProvider}) and registry cards
 * ({@link com.aiverse.fabric.mcop.RegistryCardLoader}). MCOP itself is reached only through the
 * {@link com.aiverse.fabric.mcop.IntentEngine}, {@link com.aiverse.fabric.mcop.CapabilityScheduler} and
 * {@link com.aiverse.fabric.mcop.AssetRegistryClient} ports.
 */
package com.aiverse.fabric.mcop;
