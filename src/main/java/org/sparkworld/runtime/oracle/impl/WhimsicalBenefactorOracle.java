package org.sparkworld.runtime.oracle.impl;

import java.util.ArrayList;
import java.util.List;

import org.sparkworld.runtime.spi.GrantDecision;
import org.sparkworld.runtime.spi.GrantRequest;
import org.sparkworld.runtime.spi.IBenefactorOracle;
import org.sparkworld.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Offline benefactor that grants a random amount to every request while it has sparks left.
 * <p>
 * Options: {@code min-grant} (default 1), {@code max-grant} (default 5).
 */
public class WhimsicalBenefactorOracle implements IBenefactorOracle {

    private final IRandomProvider random;
    private final int minGrant;
    private final int maxGrant;

    public WhimsicalBenefactorOracle(IRandomProvider random, Config options) {
        this.random = random;
        this.minGrant = options.hasPath("min-grant") ? options.getInt("min-grant") : 1;
        this.maxGrant = options.hasPath("max-grant") ? options.getInt("max-grant") : 5;
        if (minGrant < 0 || maxGrant < minGrant) {
            throw new IllegalArgumentException("Invalid grant range [" + minGrant + ", " + maxGrant + "]");
        }
    }

    @Override
    public List<GrantDecision> decideGrants(int balance, long tick, List<GrantRequest> requests) {
        List<GrantDecision> decisions = new ArrayList<>();
        int remaining = balance;
        for (GrantRequest request : requests) {
            if (remaining <= 0) {
                decisions.add(new GrantDecision(request.agentId(), 0, "The well is dry"));
                continue;
            }
            int amount = minGrant + random.nextInt(maxGrant - minGrant + 1);
            remaining -= Math.min(amount, remaining);
            decisions.add(new GrantDecision(request.agentId(), amount, "A whim of generosity"));
        }
        return decisions;
    }
}
