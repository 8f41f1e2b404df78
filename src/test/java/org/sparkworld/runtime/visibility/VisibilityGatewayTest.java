package org.sparkworld.runtime.visibility;

import static org.assertj.core.api.Assertions.assertThat;
import static org.sparkworld.runtime.TestWorlds.action;
import static org.sparkworld.runtime.TestWorlds.bond;
import static org.sparkworld.runtime.TestWorlds.world;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.report.TickJournal;

@Tag("unit")
class VisibilityGatewayTest {

    private WorldState world;
    private VisibilityGateway gateway;

    @BeforeEach
    void setUp() {
        world = world(3, 5);
        gateway = new VisibilityGateway(WorldRules.defaults());
        world.advanceTick();
    }

    @Test
    void observationShowsOnlyPreviousTickTraffic() {
        TickGeneration current = world.getRequestTables().current();
        current.addMessage(action("agent_001", ActionIntent.MESSAGE, "agent_002", 1L));
        current.addBondRequest(action("agent_003", ActionIntent.BOND_REQUEST, "agent_002", 1L));

        Observation sameTick = gateway.observe(world, world.getAgent("agent_002"), null, Map.of());
        assertThat(sameTick.inbox()).isEmpty();
        assertThat(sameTick.bondOffers()).isEmpty();
        assertThat(sameTick.availableIntents()).doesNotContain(ActionIntent.BOND_ACCEPT);

        world.getRequestTables().rotate(2L);
        world.advanceTick();

        Observation nextTick = gateway.observe(world, world.getAgent("agent_002"), null, Map.of());
        assertThat(nextTick.tick()).isEqualTo(2L);
        assertThat(nextTick.inbox()).extracting(m -> m.agentId()).containsExactly("agent_001");
        assertThat(nextTick.bondOffers()).extracting(r -> r.agentId()).containsExactly("agent_003");
        assertThat(nextTick.availableIntents()).contains(ActionIntent.BOND_ACCEPT);
    }

    @Test
    void unbondedAgentHasNoMissionAndCannotSpawn() {
        Observation observation = gateway.observe(world, world.getAgent("agent_001"), null, Map.of());

        assertThat(observation.mission()).isNull();
        assertThat(observation.self().sparks()).isEqualTo(5);
        assertThat(observation.availableIntents())
            .contains(ActionIntent.BOND_REQUEST, ActionIntent.RAID, ActionIntent.IDLE)
            .doesNotContain(ActionIntent.SPAWN);
    }

    @Test
    void bondedAgentSeesMissionAndMeetingNotes() {
        Bond bond = bond(world, "agent_001", "agent_002");
        world.getAgent("agent_002").addSparks(5);

        Observation observation = gateway.observe(world, world.getAgent("agent_002"), null,
            Map.of(bond.getMissionId(), List.of("Leader: onward")));

        assertThat(observation.self().bondMates()).containsExactly("agent_001");
        assertThat(observation.mission().teamMembers()).containsExactly("agent_001", "agent_002");
        assertThat(observation.mission().meetingNotes()).containsExactly("Leader: onward");
        assertThat(observation.mission().leaderId()).isEqualTo("agent_001");
        assertThat(observation.availableIntents()).contains(ActionIntent.SPAWN)
            .doesNotContain(ActionIntent.BOND_REQUEST);
    }

    @Test
    void newsListsLivingAgentsAndTickChanges() {
        world.getAgent("agent_003").vanish(1L);
        TickJournal journal = new TickJournal(1L);
        journal.agentVanished("agent_003");

        WorldNews news = VisibilityGateway.compileNews(world, journal);

        assertThat(news.aliveAgents()).isEqualTo(2);
        assertThat(news.directory()).containsOnlyKeys("agent_001", "agent_002");
        assertThat(news.agentsVanished()).containsExactly("agent_003");
    }
}
