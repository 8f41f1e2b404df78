package org.sparkworld.runtime.mission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;
import static org.sparkworld.runtime.TestWorlds.action;
import static org.sparkworld.runtime.TestWorlds.bond;
import static org.sparkworld.runtime.TestWorlds.world;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.BondStatus;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.oracle.OracleInvoker;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.spi.IMissionEvaluator;
import org.sparkworld.runtime.spi.IMissionGenerator;
import org.sparkworld.runtime.spi.IMissionMeetingCoordinator;
import org.sparkworld.runtime.spi.MeetingOutcome;
import org.sparkworld.runtime.spi.MissionContent;
import org.sparkworld.runtime.spi.ProgressEvaluation;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MissionLifecycleTest {

    private WorldState world;
    @Mock
    private IMissionGenerator generator;
    @Mock
    private IMissionEvaluator evaluator;
    @Mock
    private IMissionMeetingCoordinator coordinator;
    private OracleInvoker invoker;
    private MissionLifecycle lifecycle;
    private TickJournal journal;

    @BeforeEach
    void setUp() {
        world = world(3, 5);
        world.advanceTick();
        invoker = new OracleInvoker(1000L);
        lifecycle = new MissionLifecycle(generator, evaluator, coordinator, invoker);
        journal = new TickJournal(1L);
    }

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    private Bond unmissionedBond() {
        Bond bond = new Bond(world.nextBondId(), List.of("agent_001", "agent_002"), "agent_001", 1L);
        world.addBond(bond);
        world.getAgent("agent_001").joinBond(BondStatus.LEADER, bond.getMembers());
        world.getAgent("agent_002").joinBond(BondStatus.BONDED, bond.getMembers());
        return bond;
    }

    @Test
    void createAttachesGeneratedMission() {
        Bond bond = unmissionedBond();
        when(generator.generateMission(anyList()))
            .thenReturn(new MissionContent("Map the caves", "Deep below.", "Every cave charted"));

        Mission mission = lifecycle.create(world, bond, journal);

        assertThat(bond.getMissionId()).isEqualTo(mission.getId());
        assertThat(mission.getTitle()).isEqualTo("Map the caves");
        assertThat(mission.getLeaderId()).isEqualTo("agent_001");
        assertThat(mission.getState()).isEqualTo(Mission.State.CREATED);
        assertThat(mission.getProgress()).isEqualTo(Mission.INITIAL_PROGRESS);
    }

    @Test
    void failingGeneratorYieldsPlaceholderMission() {
        Bond bond = unmissionedBond();
        when(generator.generateMission(anyList())).thenThrow(new IllegalStateException("no inspiration"));

        Mission mission = lifecycle.create(world, bond, journal);

        assertThat(mission.getTitle()).isEqualTo("Hold together");
        assertThat(mission.getGoal()).contains(bond.getId());
        assertThat(invoker.getFailureCount()).isEqualTo(1);
    }

    @Test
    void incompleteContentYieldsPlaceholderMission() {
        Bond bond = unmissionedBond();
        when(generator.generateMission(anyList())).thenReturn(new MissionContent(" ", "", null));

        assertThat(lifecycle.create(world, bond, journal).getTitle()).isEqualTo("Hold together");
    }

    @Test
    void meetingAssignsTasksOnlyToMembers() {
        Bond bond = bond(world, "agent_001", "agent_002");
        when(coordinator.conductMeeting(any(), anyMap(), anyLong(), anyList())).thenReturn(new MeetingOutcome(
            List.of("Agent 1: you scout", "Agent 2: I will"),
            Map.of("agent_002", "scout the north", "agent_003", "not a member")));

        Map<String, List<String>> transcripts = lifecycle.conductMeetings(world, journal);

        Mission mission = world.getMission(bond.getMissionId());
        assertThat(transcripts.get(mission.getId())).hasSize(2);
        assertThat(mission.getAssignedTasks()).containsOnlyKeys("agent_002");
        assertThat(mission.getState()).isEqualTo(Mission.State.IN_PROGRESS);
    }

    @Test
    void evaluationCompletesMissionAndReturnsBond() {
        Bond bond = bond(world, "agent_001", "agent_002");
        when(evaluator.evaluateProgress(any(), anyList())).thenReturn(new ProgressEvaluation(true, "All charted"));

        List<Bond> finished = lifecycle.evaluate(world,
            List.of(action("agent_001", ActionIntent.IDLE, null, 1L)), journal);

        Mission mission = world.getMission(bond.getMissionId());
        assertThat(finished).containsExactly(bond);
        assertThat(mission.isComplete()).isTrue();
        assertThat(mission.getCompletionReason()).isEqualTo(Mission.CompletionReason.GOAL_MET);
        assertThat(mission.getProgress()).isEqualTo("All charted");
    }

    @Test
    void failingEvaluatorKeepsMissionOpen() {
        Bond bond = bond(world, "agent_001", "agent_002");
        when(evaluator.evaluateProgress(any(), anyList())).thenThrow(new IllegalStateException("judge asleep"));

        assertThat(lifecycle.evaluate(world, List.of(), journal)).isEmpty();
        assertThat(world.getMission(bond.getMissionId()).isComplete()).isFalse();
    }
}
