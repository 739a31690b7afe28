/**
 * Data Fabric annotations.
 * <ul>
 *   <li>{@link com.aiverse.fabric.annotations.FabricUnit} – execution unit id, capability type and scheduling hints</li>
 *   <li>{@link com.aiverse.fabric.annotations.FabricFeature} – feature name, phase and applicable units</li>
 *   <li>{@link com.aiverse.fabric.annotations.ResourceCleanup} – shutdown hook contract</li>
 * </ul>
 */
package com.aiverse.fabric.annotations;
