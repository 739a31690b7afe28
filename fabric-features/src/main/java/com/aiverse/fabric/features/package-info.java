/**
 * Feature hooks around execution unit invocations.
 * <ul>
 *   <li>{@link com.aiverse.fabric.annotations.FabricFeature} marks a feature class (name, phase, applicable units)</li>
 *   <li>Phase contracts: {@link com.aiverse.fabric.features.PreUnitCall}, {@link com.aiverse.fabric.features.PostSuccessCall},
 *   {@link com.aiverse.fabric.features.PostErrorCall}, {@link com.aiverse.fabric.features.FinallyCall},
 *   {@link com.aiverse.fabric.features.PreFinallyCall}</li>
 *   <li>{@link com.aiverse.fabric.features.FeatureRegistry} holds the registered features</li>
 *   <li>{@link com.aiverse.fabric.features.UnitFeatureRunner} runs them for one invocation</li>
 * </ul>
 */
package com.aiverse.fabric.features;
