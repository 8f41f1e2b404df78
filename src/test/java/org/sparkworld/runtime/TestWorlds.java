package org.sparkworld.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Benefactor;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.BondStatus;
import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.oracle.WorldCollaborators;
import org.sparkworld.runtime.spi.IBenefactorOracle;
import org.sparkworld.runtime.spi.ICharacterGenerator;
import org.sparkworld.runtime.spi.IDecisionOracle;
import org.sparkworld.runtime.spi.ITickReportListener;
import org.sparkworld.runtime.spi.MeetingOutcome;
import org.sparkworld.runtime.spi.MissionContent;
import org.sparkworld.runtime.spi.ProgressEvaluation;

/**
 * Builders for small hand-made worlds used across the runtime tests.
 */
public final class TestWorlds {

    private TestWorlds() {}

    public static CharacterBlueprint persona(String name) {
        return new CharacterBlueprint(name, "Lantern Moth", "Glowmarsh", List.of("curious", "gentle", "stubborn"),
            "hums when nervous", "lights dark corners", "Born from a forgotten candle.", "See the sea", "whispers");
    }

    /**
     * A world at tick 0 with {@code agents} unbonded agents {@code agent_001..} holding
     * {@code sparks} each, and a benefactor with balance 10, regeneration 1 and grants up to 5.
     */
    public static WorldState world(int agents, int sparks) {
        WorldState world = new WorldState("sim-test", "Test World", 42L, new Benefactor("Bob", 10, 1, 5));
        for (int i = 0; i < agents; i++) {
            String id = world.nextAgentId();
            world.addAgent(new Agent(id, persona("Agent " + (i + 1)), sparks, 0L, null));
        }
        return world;
    }

    /**
     * Forms a bond with an open mission directly, bypassing the request protocol. The first
     * member leads.
     */
    public static Bond bond(WorldState world, String... memberIds) {
        List<String> members = Arrays.asList(memberIds);
        Bond bond = new Bond(world.nextBondId(), members, members.get(0), world.getTick());
        world.addBond(bond);
        for (String id : members) {
            world.getAgent(id).joinBond(id.equals(bond.getLeaderId()) ? BondStatus.LEADER : BondStatus.BONDED,
                bond.getMembers());
        }
        Mission mission = new Mission(world.nextMissionId(), bond.getId(), "Light the marsh", "Together.",
            "Every lantern lit", bond.getLeaderId(), world.getTick());
        world.addMission(mission);
        bond.setMissionId(mission.getId());
        return bond;
    }

    public static PendingAction action(String agentId, ActionIntent intent, String targetId, long tick) {
        return new PendingAction(agentId, intent, targetId, "", "test", tick);
    }

    public static ICharacterGenerator numberedGenerator() {
        AtomicInteger counter = new AtomicInteger();
        return () -> persona("Persona " + counter.incrementAndGet());
    }

    /**
     * Collaborators with the given decision and benefactor oracles, a numbered character
     * generator, missions that never complete and silent meetings.
     */
    public static WorldCollaborators collaborators(IDecisionOracle decisions, IBenefactorOracle benefactor,
                                                   ITickReportListener... listeners) {
        return new WorldCollaborators(
            decisions,
            benefactor,
            numberedGenerator(),
            members -> new MissionContent("Find the lost bell", "A bell rings somewhere.", "Ring the bell"),
            (mission, actions) -> new ProgressEvaluation(false, "Still searching"),
            (mission, members, tick, previous) -> new MeetingOutcome(List.of("Leader: keep looking"), Map.of()),
            new ArrayList<>(Arrays.asList(listeners)));
    }

    public static IBenefactorOracle silentBenefactor() {
        return (balance, tick, requests) -> List.of();
    }
}
