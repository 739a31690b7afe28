package com.aiverse.fabric.mcop;

/**
 * MCOP intent engine port. Receives intent decompositions and owns sequencing, placement and retries.
 */
public interface IntentEngine {

    /**
     * Submits a decomposition.
     *
     * @return false if the engine declined it
     * @throws McopException if the engine could not be reached or failed while accepting it
     */
    boolean decomposeIntent(IntentDecomposition decomposition) throws McopException;
}
