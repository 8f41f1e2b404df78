package org.sparkworld.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.sparkworld.runtime.TestWorlds.collaborators;
import static org.sparkworld.runtime.TestWorlds.silentBenefactor;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.sparkworld.persistence.WorldSnapshot;
import org.sparkworld.persistence.WorldSnapshotCodec;
import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.internal.services.SeededRandomProvider;
import org.sparkworld.runtime.ledger.LedgerEntry;
import org.sparkworld.runtime.ledger.SparkLedger;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.oracle.OracleInvoker;
import org.sparkworld.runtime.oracle.WorldCollaborators;
import org.sparkworld.runtime.oracle.impl.HeuristicDecisionOracle;
import org.sparkworld.runtime.oracle.impl.WhimsicalBenefactorOracle;
import org.sparkworld.runtime.report.TickReport;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.spi.Decision;
import org.sparkworld.runtime.spi.GrantDecision;
import org.sparkworld.runtime.spi.IBenefactorOracle;
import org.sparkworld.runtime.spi.IDecisionOracle;
import org.sparkworld.runtime.spi.ITickReportListener;
import org.sparkworld.runtime.visibility.Observation;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class WorldEngineTest {

    private OracleInvoker invoker;

    @BeforeEach
    void setUp() {
        invoker = new OracleInvoker(2000L);
    }

    @AfterEach
    void tearDown() {
        invoker.close();
    }

    private WorldEngine genesis(int agents, WorldCollaborators collaborators) {
        return genesis(agents, BenefactorPolicy.defaults(), collaborators);
    }

    private WorldEngine genesis(int agents, BenefactorPolicy policy, WorldCollaborators collaborators) {
        return WorldEngine.genesis("sim-engine", "Engine World", agents, 1234L, WorldRules.defaults(), policy,
            collaborators, invoker);
    }

    @Test
    void genesisCreatesAgentsAndBenefactor() {
        WorldEngine engine = genesis(4, collaborators(new ScriptedDecisionOracle(), silentBenefactor()));
        WorldState world = engine.getWorld();

        assertThat(world.getTick()).isZero();
        assertThat(world.getAliveAgents()).extracting(Agent::getId)
            .containsExactly("agent_001", "agent_002", "agent_003", "agent_004");
        assertThat(world.getAliveAgents()).allSatisfy(a -> assertThat(a.getSparks()).isEqualTo(5));
        assertThat(world.getBenefactor().getBalance()).isEqualTo(4);
        assertThat(world.getBenefactor().getRegenerationPerTick()).isEqualTo(2);
        assertThat(world.getLatestNews().directory()).hasSize(4);
    }

    @Test
    void genesisNeedsAnAgent() {
        assertThatThrownBy(() -> genesis(0, collaborators(new ScriptedDecisionOracle(), silentBenefactor())))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bondFormsFromRequestAndAcceptInConsecutiveTicks() {
        ScriptedDecisionOracle oracle = new ScriptedDecisionOracle()
            .at(1, "agent_001", ActionIntent.BOND_REQUEST, "agent_002")
            .at(2, "agent_002", ActionIntent.BOND_ACCEPT, "agent_001");
        WorldEngine engine = genesis(2, collaborators(oracle, silentBenefactor()));

        TickReport first = engine.tick();
        assertThat(first.bondsFormed()).isEmpty();
        assertThat(oracle.observationOf("agent_002", 1).bondOffers()).isEmpty();

        TickReport second = engine.tick();
        assertThat(oracle.observationOf("agent_002", 2).bondOffers())
            .extracting(PendingAction::agentId).containsExactly("agent_001");
        assertThat(second.bondsFormed()).containsExactly("bond_001");

        WorldState world = engine.getWorld();
        Bond bond = world.getBond("bond_001");
        assertThat(bond.getLeaderId()).isEqualTo("agent_001");
        Mission mission = world.getMission(bond.getMissionId());
        assertThat(mission.getTitle()).isEqualTo("Find the lost bell");
        assertThat(second.eventsOf(WorldEventType.MISSION_CREATED)).hasSize(1);
        // 5 - 1 - 1, bonds formed in tick 2 mint from tick 3 on
        assertThat(world.getAgent("agent_001").getSparks()).isEqualTo(3);

        TickReport third = engine.tick();
        int sum = world.getAgent("agent_001").getSparks() + world.getAgent("agent_002").getSparks();
        assertThat(sum).isEqualTo(3 + 3 - 2 + 2);
        assertThat(third.mintReceipts().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(2);
        assertThat(oracle.observationOf("agent_001", 3).mission().meetingNotes()).containsExactly("Leader: keep looking");
    }

    @Test
    void acceptInTheSameTickIsDropped() {
        ScriptedDecisionOracle oracle = new ScriptedDecisionOracle()
            .at(1, "agent_001", ActionIntent.BOND_REQUEST, "agent_002")
            .at(1, "agent_002", ActionIntent.BOND_ACCEPT, "agent_001");
        WorldEngine engine = genesis(2, collaborators(oracle, silentBenefactor()));

        TickReport report = engine.tick();

        assertThat(report.bondsFormed()).isEmpty();
        assertThat(report.eventsOf(WorldEventType.DROPPED_ACTION)).hasSize(1);
    }

    @Test
    void messagesArriveOneTickLater() {
        ScriptedDecisionOracle oracle = new ScriptedDecisionOracle()
            .at(1, "agent_001", ActionIntent.MESSAGE, "agent_002");
        WorldEngine engine = genesis(2, collaborators(oracle, silentBenefactor()));

        engine.tick();
        engine.tick();

        assertThat(oracle.observationOf("agent_002", 1).inbox()).isEmpty();
        assertThat(oracle.observationOf("agent_002", 2).inbox())
            .singleElement().satisfies(m -> assertThat(m.content()).isEqualTo("hello"));
    }

    @Test
    void slowDecisionOracleMakesTheAgentIdle() {
        IDecisionOracle slow = (agentId, observation) -> {
            if (agentId.equals("agent_001")) {
                try {
                    Thread.sleep(5_000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return new Decision(ActionIntent.REQUEST_GRANT, null, "please", "poor");
        };
        invoker.close();
        invoker = new OracleInvoker(100L);
        WorldEngine engine = genesis(2, collaborators(slow, silentBenefactor()));

        TickReport report = engine.tick();

        assertThat(report.actions()).extracting(PendingAction::agentId, PendingAction::intent)
            .containsExactly(
                tuple("agent_001", ActionIntent.IDLE),
                tuple("agent_002", ActionIntent.REQUEST_GRANT));
        assertThat(report.eventsOf(WorldEventType.ORACLE_FAILURE)).hasSize(1);
    }

    @Test
    void grantIsClampedToBenefactorBalanceAndDeliveredNextTick() {
        ScriptedDecisionOracle oracle = new ScriptedDecisionOracle()
            .at(1, "agent_001", ActionIntent.REQUEST_GRANT, null);
        IBenefactorOracle generous = (balance, tick, requests) -> requests.stream()
            .map(r -> new GrantDecision(r.agentId(), 5, "take it all"))
            .toList();
        BenefactorPolicy poor = new BenefactorPolicy("Bob", 3, 1, 5);
        WorldEngine engine = genesis(2, poor, collaborators(oracle, generous));

        TickReport first = engine.tick();
        assertThat(first.grants()).isEmpty();
        assertThat(first.benefactorBalance()).isEqualTo(4);

        TickReport second = engine.tick();
        assertThat(second.grants()).singleElement().satisfies(outcome -> {
            assertThat(outcome.proposed()).isEqualTo(5);
            assertThat(outcome.granted()).isEqualTo(4);
            assertThat(outcome.requestedInTick()).isEqualTo(1L);
        });
        assertThat(oracle.observationOf("agent_001", 2).grantOutcome().granted()).isEqualTo(4);
        assertThat(engine.getWorld().getAgent("agent_001").getSparks()).isEqualTo(5 - 2 + 4);
        assertThat(second.benefactorBalance()).isEqualTo(1);
    }

    @Test
    void agentsRunningDryVanishAndLeaveTheirBond() {
        ScriptedDecisionOracle oracle = new ScriptedDecisionOracle()
            .at(1, "agent_001", ActionIntent.BOND_REQUEST, "agent_002")
            .at(2, "agent_002", ActionIntent.BOND_ACCEPT, "agent_001");
        WorldEngine engine = genesis(3, collaborators(oracle, silentBenefactor()));
        engine.tick();
        engine.tick();
        WorldState world = engine.getWorld();
        Agent doomed = world.getAgent("agent_002");
        doomed.takeSparks(doomed.getSparks() - 1);

        TickReport report = engine.tick();

        assertThat(report.agentsVanished()).contains("agent_002");
        assertThat(report.bondsDissolved()).containsExactly("bond_001");
        assertThat(world.getAgent("agent_001").isBonded()).isFalse();
        assertThat(world.getMission("mission_001").getCompletionReason())
            .isEqualTo(Mission.CompletionReason.BOND_DISSOLVED);
        assertThat(WorldInvariants.check(world)).isEmpty();
    }

    @Test
    void sparksAreConservedAcrossManyTicks() {
        WorldCollaborators collaborators = collaborators(
            new HeuristicDecisionOracle(new SeededRandomProvider(11L), ConfigFactory.empty()),
            new WhimsicalBenefactorOracle(new SeededRandomProvider(12L), ConfigFactory.empty()));
        WorldEngine engine = genesis(6, collaborators);
        WorldState world = engine.getWorld();

        for (int i = 0; i < 30; i++) {
            long before = totalSparks(world);
            int regeneration = world.getBenefactor().getRegenerationPerTick();

            TickReport report = engine.tick();

            long created = 0;
            long destroyed = 0;
            for (LedgerEntry entry : report.ledger()) {
                if (SparkLedger.VOID.equals(entry.destination())) {
                    destroyed += entry.amount();
                } else if (SparkLedger.VOID.equals(entry.source()) || entry.source().startsWith("bond_")) {
                    created += entry.amount();
                }
            }
            assertThat(totalSparks(world)).as("tick %d", report.tick())
                .isEqualTo(before + created - destroyed + regeneration);
            assertThat(world.getAgents()).allSatisfy(a -> assertThat(a.getSparks()).isGreaterThanOrEqualTo(0));
        }
    }

    @Test
    void sameSeedAndCollaboratorsReplayTheSameHistory() {
        List<String> first = runSummaries();
        List<String> second = runSummaries();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void restoredSnapshotContinuesLikeAnUninterruptedRun() {
        ScriptedDecisionOracle script = bondingScript();
        WorldEngine uninterrupted = genesis(4, collaborators(script, silentBenefactor()));
        for (int i = 0; i < 5; i++) {
            uninterrupted.tick();
        }

        WorldEngine interrupted = genesis(4, collaborators(bondingScript(), silentBenefactor()));
        interrupted.tick();
        interrupted.tick();
        WorldSnapshotCodec codec = new WorldSnapshotCodec();
        WorldState restored = codec.decode(codec.encode(WorldSnapshot.capture(interrupted.snapshot()))).restore();
        WorldEngine resumed = new WorldEngine(restored, WorldRules.defaults(),
            collaborators(bondingScript(), silentBenefactor()), invoker);
        for (int i = 0; i < 3; i++) {
            resumed.tick();
        }

        assertThat(restored.getTick()).isEqualTo(5L);
        for (Agent agent : uninterrupted.getWorld().getAgents()) {
            assertThat(restored.getAgent(agent.getId()).getSparks()).as(agent.getId()).isEqualTo(agent.getSparks());
            assertThat(restored.getAgent(agent.getId()).getBondMates()).isEqualTo(agent.getBondMates());
        }
        assertThat(restored.getBenefactor().getBalance()).isEqualTo(uninterrupted.getWorld().getBenefactor().getBalance());
    }

    @Test
    void failingListenerDoesNotAbortTheTick() {
        List<Long> delivered = new ArrayList<>();
        ITickReportListener broken = report -> {
            throw new IllegalStateException("listener down");
        };
        ITickReportListener recording = report -> delivered.add(report.tick());
        WorldEngine engine = genesis(2, collaborators(new ScriptedDecisionOracle(), silentBenefactor(), broken, recording));

        engine.tick();
        engine.tick();

        assertThat(delivered).containsExactly(1L, 2L);
        assertThat(engine.getStage()).isNull();
    }

    @Test
    void observationIsImmutable() {
        ScriptedDecisionOracle oracle = new ScriptedDecisionOracle();
        WorldEngine engine = genesis(2, collaborators(oracle, silentBenefactor()));
        engine.tick();

        Observation observation = oracle.observationOf("agent_001", 1);

        assertThatThrownBy(() -> observation.availableIntents().add(ActionIntent.SPAWN))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    private static ScriptedDecisionOracle bondingScript() {
        return new ScriptedDecisionOracle()
            .at(1, "agent_001", ActionIntent.BOND_REQUEST, "agent_002")
            .at(1, "agent_003", ActionIntent.BOND_REQUEST, "agent_004")
            .at(2, "agent_002", ActionIntent.BOND_ACCEPT, "agent_001")
            .at(2, "agent_004", ActionIntent.BOND_ACCEPT, "agent_003")
            .at(3, "agent_001", ActionIntent.RAID, "agent_003")
            .at(4, "agent_004", ActionIntent.RAID, "agent_002");
    }

    private List<String> runSummaries() {
        WorldEngine engine = genesis(5, collaborators(
            new HeuristicDecisionOracle(new SeededRandomProvider(11L), ConfigFactory.empty()),
            new WhimsicalBenefactorOracle(new SeededRandomProvider(12L), ConfigFactory.empty())));
        List<String> summaries = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            summaries.add(engine.tick().summary());
        }
        for (Agent agent : engine.getWorld().getAgents()) {
            summaries.add(agent.getId() + "=" + agent.getSparks());
        }
        return summaries;
    }

    private static long totalSparks(WorldState world) {
        long total = world.getBenefactor().getBalance();
        for (Agent agent : world.getAgents()) {
            total += agent.getSparks();
        }
        return total;
    }
}
