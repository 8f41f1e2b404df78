package org.sparkworld.runtime.oracle.impl;

import java.util.ArrayList;
import java.util.List;

import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.spi.Decision;
import org.sparkworld.runtime.spi.IDecisionOracle;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.visibility.Observation;

import com.typesafe.config.Config;

/**
 * Offline decision oracle with simple survival instincts.
 * <p>
 * Accepts the first bond offer, spawns when rich and bonded, begs or raids when poor,
 * seeks a partner when alone and otherwise talks to its bond-mates.
 * <p>
 * Options: {@code low-sparks} (default 3), {@code spawn-threshold} (default 10),
 * {@code raid-chance} (default 0.15).
 */
public class HeuristicDecisionOracle implements IDecisionOracle {

    private final IRandomProvider random;
    private final int lowSparks;
    private final int spawnThreshold;
    private final double raidChance;

    public HeuristicDecisionOracle(IRandomProvider random, Config options) {
        this.random = random;
        this.lowSparks = options.hasPath("low-sparks") ? options.getInt("low-sparks") : 3;
        this.spawnThreshold = options.hasPath("spawn-threshold") ? options.getInt("spawn-threshold") : 10;
        this.raidChance = options.hasPath("raid-chance") ? options.getDouble("raid-chance") : 0.15;
    }

    @Override
    public Decision decide(String agentId, Observation observation) {
        Observation.SelfView self = observation.self();
        List<ActionIntent> allowed = observation.availableIntents();

        if (allowed.contains(ActionIntent.BOND_ACCEPT) && !observation.bondOffers().isEmpty()) {
            PendingAction offer = observation.bondOffers().get(0);
            return new Decision(ActionIntent.BOND_ACCEPT, offer.agentId(), "", "Someone wants me, I accept");
        }
        if (allowed.contains(ActionIntent.SPAWN) && self.sparks() >= spawnThreshold) {
            return new Decision(ActionIntent.SPAWN, null, "", "I can afford a child");
        }

        List<String> others = others(agentId, observation);
        if (self.sparks() <= lowSparks) {
            if (!others.isEmpty() && random.nextDouble() < raidChance) {
                return new Decision(ActionIntent.RAID, pick(others), "", "Desperate times");
            }
            return new Decision(ActionIntent.REQUEST_GRANT, null, "Please, I am fading", "Running low");
        }
        if (allowed.contains(ActionIntent.BOND_REQUEST) && !others.isEmpty()) {
            String target = pick(others);
            return new Decision(ActionIntent.BOND_REQUEST, target, "Shall we bond?", "Alone is expensive");
        }
        if (!others.isEmpty() && random.nextDouble() < raidChance) {
            return new Decision(ActionIntent.RAID, pick(others), "", "Feeling strong");
        }
        if (!self.bondMates().isEmpty()) {
            List<String> mates = new ArrayList<>(self.bondMates());
            mates.sort(null);
            return new Decision(ActionIntent.MESSAGE, pick(mates), "How goes the mission?", "Keeping in touch");
        }
        return Decision.idle("Nothing worth doing");
    }

    private static List<String> others(String agentId, Observation observation) {
        List<String> others = new ArrayList<>();
        for (String id : observation.news().directory().keySet()) {
            if (!id.equals(agentId) && !observation.self().bondMates().contains(id)) {
                others.add(id);
            }
        }
        others.sort(null);
        return others;
    }

    private String pick(List<String> ids) {
        return ids.get(random.nextInt(ids.size()));
    }
}
