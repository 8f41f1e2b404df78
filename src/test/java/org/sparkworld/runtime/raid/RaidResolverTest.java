package org.sparkworld.runtime.raid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.sparkworld.runtime.TestWorlds.action;
import static org.sparkworld.runtime.TestWorlds.world;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.sparkworld.runtime.FixedRandomProvider;
import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.internal.services.SeededRandomProvider;
import org.sparkworld.runtime.ledger.LedgerReason;
import org.sparkworld.runtime.ledger.SparkLedger;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.visibility.PersonalEvent;

@Tag("unit")
class RaidResolverTest {

    private WorldState world;
    private RaidResolver resolver;
    private TickJournal journal;
    private Agent attacker;
    private Agent defender;

    @BeforeEach
    void setUp() {
        world = world(2, 5);
        world.advanceTick();
        WorldRules rules = WorldRules.defaults();
        resolver = new RaidResolver(rules, new SparkLedger(rules));
        journal = new TickJournal(1L);
        attacker = world.getAgent("agent_001");
        defender = world.getAgent("agent_002");
    }

    @Test
    void successProbabilityIsShareOfStrength() {
        assertThat(RaidResolver.successProbability(10, 5)).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(RaidResolver.successProbability(0, 7)).isZero();
        assertThat(RaidResolver.successProbability(0, 0)).isEqualTo(0.5);
    }

    @Test
    void successfulRaidMovesLootToAttacker() {
        // nextDouble 0.0 always wins, nextInt 2 means loot 1 + 2 = 3
        RaidResult result = resolver.resolve(world, action("agent_001", ActionIntent.RAID, "agent_002", 1L),
            new FixedRandomProvider(0.0, 2), journal);

        assertThat(result.outcome()).isEqualTo(RaidOutcome.SUCCESS);
        assertThat(result.sparksTransferred()).isEqualTo(3);
        assertThat(attacker.getSparks()).isEqualTo(8);
        assertThat(defender.getSparks()).isEqualTo(2);
        assertThat(journal.getLedger()).singleElement()
            .satisfies(entry -> assertThat(entry.reason()).isEqualTo(LedgerReason.RAID_THEFT));
        assertThat(world.getRequestTables().current().eventsFor("agent_002"))
            .extracting(PersonalEvent::type).containsExactly(PersonalEvent.Type.RAID_DEFENSE);
        assertThat(world.getTotals().raidsAttempted).isEqualTo(1);
    }

    @Test
    void lootIsCappedAtDefenderBalance() {
        defender.takeSparks(4);

        RaidResult result = resolver.resolve(world, action("agent_001", ActionIntent.RAID, "agent_002", 1L),
            new FixedRandomProvider(0.0, 4), journal);

        assertThat(result.sparksTransferred()).isEqualTo(1);
        assertThat(defender.getSparks()).isZero();
        assertThat(attacker.getSparks()).isEqualTo(6);
    }

    @Test
    void failedRaidCostsTheStake() {
        RaidResult result = resolver.resolve(world, action("agent_001", ActionIntent.RAID, "agent_002", 1L),
            new FixedRandomProvider(0.99, 0), journal);

        assertThat(result.outcome()).isEqualTo(RaidOutcome.FAILURE);
        assertThat(result.sparksTransferred()).isEqualTo(-1);
        assertThat(attacker.getSparks()).isEqualTo(4);
        assertThat(defender.getSparks()).isEqualTo(6);
    }

    @Test
    void attackerWithoutStakeChangesNothing() {
        attacker.takeSparks(5);

        RaidResult result = resolver.resolve(world, action("agent_001", ActionIntent.RAID, "agent_002", 1L),
            new FixedRandomProvider(0.0, 0), journal);

        assertThat(result.outcome()).isEqualTo(RaidOutcome.INSUFFICIENT_STAKE);
        assertThat(journal.getLedger()).isEmpty();
        assertThat(journal.getRaids()).containsExactly(result);
    }

    @Test
    void raidOnVanishedTargetIsDropped() {
        defender.vanish(1L);

        RaidResult result = resolver.resolve(world, action("agent_001", ActionIntent.RAID, "agent_002", 1L),
            new FixedRandomProvider(0.0, 0), journal);

        assertThat(result).isNull();
        assertThat(journal.getEvents()).extracting(e -> e.type()).containsExactly(WorldEventType.DROPPED_ACTION);
        assertThat(world.getTotals().raidsAttempted).isZero();
    }

    @Test
    void selfRaidIsDropped() {
        assertThat(resolver.resolve(world, action("agent_001", ActionIntent.RAID, "agent_001", 1L),
            new FixedRandomProvider(0.0, 0), journal)).isNull();
    }

    @Test
    void empiricalSuccessRateMatchesStrengthRatio() {
        SeededRandomProvider random = new SeededRandomProvider(2024L);
        int successes = 0;
        int trials = 10_000;
        for (int i = 0; i < trials; i++) {
            WorldState fresh = world(2, 0);
            fresh.getAgent("agent_001").addSparks(10);
            fresh.getAgent("agent_002").addSparks(5);
            fresh.advanceTick();
            RaidResult result = resolver.resolve(fresh, action("agent_001", ActionIntent.RAID, "agent_002", 1L),
                random, new TickJournal(1L));
            if (result.outcome() == RaidOutcome.SUCCESS) {
                successes++;
            }
        }
        assertThat((double) successes / trials).isCloseTo(2.0 / 3.0, within(0.02));
    }
}
