package org.sparkworld.runtime.spi;

import java.util.List;

/**
 * Decides how the finite benefactor pool answers the grant requests of the previous tick.
 */
public interface IBenefactorOracle extends IWorldCollaborator {

    /**
     * @param balance The pool balance before any grant of this tick.
     * @param tick The current tick.
     * @param requests The frozen requests, in submission order.
     * @return One proposal per request the oracle chose to answer.
     */
    List<GrantDecision> decideGrants(int balance, long tick, List<GrantRequest> requests);
}
