package org.sparkworld.runtime.mission;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.oracle.OracleInvoker;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.spi.IMissionEvaluator;
import org.sparkworld.runtime.spi.IMissionGenerator;
import org.sparkworld.runtime.spi.IMissionMeetingCoordinator;
import org.sparkworld.runtime.spi.MeetingOutcome;
import org.sparkworld.runtime.spi.MissionContent;
import org.sparkworld.runtime.spi.ProgressEvaluation;

/**
 * Creates, runs and judges the one mission of every bond.
 * <p>
 * Missions move CREATED, IN_PROGRESS, COMPLETE. Every call to a mission collaborator goes
 * through the {@link OracleInvoker}; a failing generator still yields a placeholder mission
 * so that a bond never exists without one.
 */
public class MissionLifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(MissionLifecycle.class);

    private final IMissionGenerator generator;
    private final IMissionEvaluator evaluator;
    private final IMissionMeetingCoordinator coordinator;
    private final OracleInvoker invoker;

    public MissionLifecycle(IMissionGenerator generator, IMissionEvaluator evaluator,
                            IMissionMeetingCoordinator coordinator, OracleInvoker invoker) {
        this.generator = generator;
        this.evaluator = evaluator;
        this.coordinator = coordinator;
        this.invoker = invoker;
    }

    /**
     * Creates and attaches the mission of a freshly formed bond.
     *
     * @param world The world.
     * @param bond A bond without a mission.
     * @param journal The tick journal.
     * @return The new mission.
     */
    public Mission create(WorldState world, Bond bond, TickJournal journal) {
        if (bond.getMissionId() != null) {
            throw new IllegalStateException("Bond " + bond.getId() + " already has mission " + bond.getMissionId());
        }
        List<CharacterBlueprint> personas = new ArrayList<>();
        for (String memberId : bond.getMembers()) {
            personas.add(world.getAgent(memberId).getPersona());
        }
        MissionContent content = invoker.call("mission generator for " + bond.getId(),
            () -> generator.generateMission(personas), () -> placeholder(world, bond), journal);
        if (isBlank(content.title()) || isBlank(content.goal())) {
            LOG.warn("Tick {}: mission generator returned incomplete content for {}, using placeholder",
                journal.getTick(), bond.getId());
            content = placeholder(world, bond);
        }

        Mission mission = new Mission(world.nextMissionId(), bond.getId(), content.title(),
            content.description() == null ? "" : content.description(), content.goal(),
            bond.getLeaderId(), journal.getTick());
        world.addMission(mission);
        bond.setMissionId(mission.getId());
        journal.event(WorldEventType.MISSION_CREATED, bond.getLeaderId(), mission.getId(),
            "Mission '" + mission.getTitle() + "' given to " + bond.getId());
        return mission;
    }

    /**
     * Holds the meeting of every open mission before its members decide.
     *
     * @param world The world.
     * @param journal The tick journal, receives every transcript.
     * @return Transcript per mission id, for the members' observations.
     */
    public Map<String, List<String>> conductMeetings(WorldState world, TickJournal journal) {
        Map<String, List<String>> transcripts = new LinkedHashMap<>();
        for (Bond bond : world.getBonds()) {
            Mission mission = world.getMission(bond.getMissionId());
            if (mission == null || mission.isComplete()) {
                continue;
            }
            Map<String, CharacterBlueprint> members = new LinkedHashMap<>();
            for (String memberId : bond.getMembers()) {
                members.put(memberId, world.getAgent(memberId).getPersona());
            }
            List<PendingAction> previous = actionsOf(bond, world.getPreviousActions());
            MeetingOutcome outcome = invoker.call("meeting coordinator for " + mission.getId(),
                () -> coordinator.conductMeeting(mission, members, journal.getTick(), previous),
                () -> new MeetingOutcome(List.of(), Map.of()), journal);

            Map<String, String> assignments = new LinkedHashMap<>();
            outcome.assignments().forEach((agentId, task) -> {
                if (bond.hasMember(agentId)) {
                    assignments.put(agentId, task);
                } else {
                    LOG.debug("Tick {}: ignoring task for non-member {} in {}", journal.getTick(), agentId,
                        mission.getId());
                }
            });
            if (!assignments.isEmpty()) {
                mission.assignTasks(assignments);
            }
            transcripts.put(mission.getId(), outcome.transcript());
            journal.recordMeeting(mission.getId(), outcome.transcript());
        }
        return transcripts;
    }

    /**
     * Judges every open mission against this tick's actions.
     *
     * @param world The world.
     * @param actions All actions of this tick.
     * @param journal The tick journal.
     * @return Bonds whose mission was completed and which must now be dissolved.
     */
    public List<Bond> evaluate(WorldState world, List<PendingAction> actions, TickJournal journal) {
        List<Bond> finished = new ArrayList<>();
        for (Bond bond : world.getBonds()) {
            Mission mission = world.getMission(bond.getMissionId());
            if (mission == null || mission.isComplete()) {
                continue;
            }
            List<PendingAction> memberActions = actionsOf(bond, actions);
            ProgressEvaluation evaluation = invoker.call("mission evaluator for " + mission.getId(),
                () -> evaluator.evaluateProgress(mission, memberActions),
                () -> new ProgressEvaluation(false, mission.getProgress()), journal);
            if (!isBlank(evaluation.progressSummary())) {
                mission.updateProgress(evaluation.progressSummary());
            }
            if (evaluation.isComplete()) {
                mission.complete(Mission.CompletionReason.GOAL_MET, journal.getTick());
                journal.missionCompleted(mission.getId(), Mission.CompletionReason.GOAL_MET.name());
                finished.add(bond);
                LOG.info("Tick {}: mission '{}' of {} completed", journal.getTick(), mission.getTitle(), bond.getId());
            } else {
                journal.event(WorldEventType.MISSION_PROGRESS, bond.getLeaderId(), mission.getId(),
                    mission.getProgress());
            }
        }
        return finished;
    }

    private static List<PendingAction> actionsOf(Bond bond, List<PendingAction> actions) {
        List<PendingAction> result = new ArrayList<>();
        for (PendingAction action : actions) {
            if (bond.hasMember(action.agentId())) {
                result.add(action);
            }
        }
        return result;
    }

    private static MissionContent placeholder(WorldState world, Bond bond) {
        List<String> names = new ArrayList<>();
        for (String memberId : bond.getMembers()) {
            Agent member = world.getAgent(memberId);
            names.add(member.getName());
        }
        String team = String.join(", ", names);
        return new MissionContent("Hold together", "The bond of " + team + " has yet to find its purpose.",
            "Keep every member of " + bond.getId() + " alive");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
