package org.sparkworld.runtime.raid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.ledger.LedgerReason;
import org.sparkworld.runtime.ledger.SparkLedger;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.visibility.PersonalEvent;
import org.sparkworld.runtime.visibility.TickGeneration;

/**
 * Resolves raids one at a time, in the order the engine hands them in.
 * <p>
 * Strength is {@code age + sparks} of both parties at the moment of resolution, so earlier
 * raids of the same tick change the odds of later ones. The attacker wins with probability
 * {@code a / (a + d)}, or one half when both strengths are zero.
 */
public class RaidResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RaidResolver.class);

    private final WorldRules rules;
    private final SparkLedger ledger;

    public RaidResolver(WorldRules rules, SparkLedger ledger) {
        this.rules = rules;
        this.ledger = ledger;
    }

    /**
     * The attacker's chance of winning.
     *
     * @param attackerStrength Attacker age plus sparks.
     * @param defenderStrength Defender age plus sparks.
     * @return A probability in {@code [0, 1]}.
     */
    public static double successProbability(int attackerStrength, int defenderStrength) {
        int total = attackerStrength + defenderStrength;
        if (total <= 0) {
            return 0.5;
        }
        return (double) attackerStrength / total;
    }

    /**
     * Resolves one raid.
     *
     * @param world The world.
     * @param raid A raid action.
     * @param random The tick's random stream.
     * @param journal The tick journal.
     * @return The result, or {@code null} if the raid was invalid and dropped.
     */
    public RaidResult resolve(WorldState world, PendingAction raid, IRandomProvider random, TickJournal journal) {
        Agent attacker = world.getAgent(raid.agentId());
        Agent defender = world.getAgent(raid.targetId());
        String problem = null;
        if (!raid.hasTarget()) {
            problem = "no target";
        } else if (raid.targetId().equals(raid.agentId())) {
            problem = "cannot raid oneself";
        } else if (defender == null) {
            problem = "unknown target";
        } else if (!defender.isAlive()) {
            problem = "target has vanished";
        } else if (attacker == null || !attacker.isAlive()) {
            problem = "attacker has vanished";
        }
        if (problem != null) {
            journal.dropped(raid, problem);
            return null;
        }

        world.getTotals().raidsAttempted++;
        int attackerStrength = attacker.getStrength();
        int defenderStrength = defender.getStrength();
        double probability = successProbability(attackerStrength, defenderStrength);
        long tick = journal.getTick();

        RaidResult result;
        if (attacker.getSparks() < rules.raidStake()) {
            result = new RaidResult(attacker.getId(), defender.getId(), RaidOutcome.INSUFFICIENT_STAKE,
                attackerStrength, defenderStrength, probability, 0, tick);
        } else if (random.nextDouble() < probability) {
            int loot = rules.minSteal() + random.nextInt(rules.maxSteal() - rules.minSteal() + 1);
            int stolen = Math.min(loot, defender.getSparks());
            if (stolen > 0) {
                ledger.transfer(defender, attacker, stolen, LedgerReason.RAID_THEFT, journal);
            }
            result = new RaidResult(attacker.getId(), defender.getId(), RaidOutcome.SUCCESS,
                attackerStrength, defenderStrength, probability, stolen, tick);
        } else {
            int stake = rules.raidStake();
            if (stake > 0) {
                ledger.transfer(attacker, defender, stake, LedgerReason.RAID_STAKE_LOSS, journal);
            }
            result = new RaidResult(attacker.getId(), defender.getId(), RaidOutcome.FAILURE,
                attackerStrength, defenderStrength, probability, -stake, tick);
        }

        journal.recordRaid(result);
        journal.event(WorldEventType.RAID, attacker.getId(), defender.getId(), String.format(
            "%s raided %s: %s (p=%.2f, transfer %d)", attacker.getName(), defender.getName(),
            result.outcome(), probability, result.sparksTransferred()));
        if (result.outcome() != RaidOutcome.INSUFFICIENT_STAKE) {
            TickGeneration current = world.getRequestTables().current();
            current.addEvent(attacker.getId(), new PersonalEvent(PersonalEvent.Type.RAID_ATTACK,
                "Raided " + defender.getName() + ": " + result.outcome(), result.sparksTransferred(),
                defender.getId(), tick));
            current.addEvent(defender.getId(), new PersonalEvent(PersonalEvent.Type.RAID_DEFENSE,
                "Raided by " + attacker.getName() + ": " + result.outcome(), -result.sparksTransferred(),
                attacker.getId(), tick));
        }
        LOG.debug("Tick {}: raid {} -> {} {} (a={}, d={}, p={})", tick, attacker.getId(), defender.getId(),
            result.outcome(), attackerStrength, defenderStrength, probability);
        return result;
    }
}
