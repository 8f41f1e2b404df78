package org.sparkworld.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.bonding.BondingProtocol;
import org.sparkworld.runtime.internal.services.SeededRandomProvider;
import org.sparkworld.runtime.ledger.SparkLedger;
import org.sparkworld.runtime.lifecycle.SpawnProcedure;
import org.sparkworld.runtime.lifecycle.VanishProcedure;
import org.sparkworld.runtime.mission.MissionLifecycle;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.Mission;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.oracle.OracleInvoker;
import org.sparkworld.runtime.oracle.WorldCollaborators;
import org.sparkworld.runtime.raid.RaidResolver;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.TickReport;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.spi.Decision;
import org.sparkworld.runtime.spi.GrantDecision;
import org.sparkworld.runtime.spi.GrantRequest;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.spi.ITickReportListener;
import org.sparkworld.runtime.visibility.GrantOutcome;
import org.sparkworld.runtime.visibility.Observation;
import org.sparkworld.runtime.visibility.TickGeneration;
import org.sparkworld.runtime.visibility.VisibilityGateway;

/**
 * Drives the world one tick at a time.
 * <p>
 * Every {@link #tick()} advances the counter and runs the {@link TickStage}s strictly in
 * order. The engine owns the {@link WorldState} and is the only caller of the components;
 * the components never call each other. Random draws of a tick come from a stream derived
 * from the root seed and the tick number, so a world restored from a snapshot continues
 * exactly as an uninterrupted one.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. Ticks must not overlap.
 */
public class WorldEngine {

    private static final Logger LOG = LoggerFactory.getLogger(WorldEngine.class);

    private final WorldState world;
    private final WorldRules rules;
    private final WorldCollaborators collaborators;
    private final OracleInvoker invoker;
    private final IRandomProvider random;

    private final SparkLedger ledger;
    private final VanishProcedure vanishProcedure;
    private final SpawnProcedure spawnProcedure;
    private final BondingProtocol bondingProtocol;
    private final RaidResolver raidResolver;
    private final MissionLifecycle missionLifecycle;
    private final VisibilityGateway visibilityGateway;

    private TickStage stage = null;

    /**
     * Creates an engine for an existing world, e.g. one restored from a snapshot.
     *
     * @param world The world to drive.
     * @param rules The economy constants.
     * @param collaborators The external collaborators.
     * @param invoker The oracle bridge.
     */
    public WorldEngine(WorldState world, WorldRules rules, WorldCollaborators collaborators, OracleInvoker invoker) {
        this.world = world;
        this.rules = rules;
        this.collaborators = collaborators;
        this.invoker = invoker;
        this.random = new SeededRandomProvider(world.getSeed());
        this.ledger = new SparkLedger(rules);
        this.vanishProcedure = new VanishProcedure();
        this.spawnProcedure = new SpawnProcedure(rules, ledger, collaborators.characterGenerator(), invoker);
        this.bondingProtocol = new BondingProtocol();
        this.raidResolver = new RaidResolver(rules, ledger);
        this.missionLifecycle = new MissionLifecycle(collaborators.missionGenerator(),
            collaborators.missionEvaluator(), collaborators.meetingCoordinator(), invoker);
        this.visibilityGateway = new VisibilityGateway(rules);
    }

    /**
     * Creates a new world with {@code agentCount} genesis agents at tick 0.
     *
     * @param simulationId The simulation id.
     * @param name The simulation name.
     * @param agentCount Number of genesis agents, at least 1.
     * @param seed The root random seed.
     * @param rules The economy constants.
     * @param benefactorPolicy How to set up the benefactor.
     * @param collaborators The external collaborators.
     * @param invoker The oracle bridge.
     * @return The engine.
     */
    public static WorldEngine genesis(String simulationId, String name, int agentCount, long seed, WorldRules rules,
                                      BenefactorPolicy benefactorPolicy, WorldCollaborators collaborators,
                                      OracleInvoker invoker) {
        if (agentCount < 1) {
            throw new IllegalArgumentException("A world needs at least one agent, got " + agentCount);
        }
        WorldState world = new WorldState(simulationId, name, seed, benefactorPolicy.create(agentCount));
        WorldEngine engine = new WorldEngine(world, rules, collaborators, invoker);
        for (int i = 0; i < agentCount; i++) {
            engine.spawnProcedure.createGenesisAgent(world);
        }
        world.setLatestNews(VisibilityGateway.compileNews(world, new TickJournal(0L)));
        LOG.info("Created world '{}' ({}) with {} agents, benefactor balance {} (+{}/tick)", name, simulationId,
            agentCount, world.getBenefactor().getBalance(), world.getBenefactor().getRegenerationPerTick());
        return engine;
    }

    /**
     * Runs one complete tick.
     *
     * @return The report of the tick.
     * @throws IllegalStateException if called while a tick is running.
     * @throws WorldCorruptionException if the world is inconsistent after the tick.
     */
    public TickReport tick() {
        if (stage != null) {
            throw new IllegalStateException("Tick " + world.getTick() + " is still running in stage " + stage);
        }
        try {
            long tick = world.advanceTick();
            if (world.getRequestTables().current().getTick() != tick) {
                throw new WorldCorruptionException("Request tables collect for tick "
                    + world.getRequestTables().current().getTick() + " but the world is at tick " + tick);
            }
            TickJournal journal = new TickJournal(tick);
            IRandomProvider tickRandom = random.deriveFor("tick", tick);

            stage = TickStage.UPKEEP_AND_MINT;
            ledger.applyUpkeep(world, journal);
            vanishProcedure.sweep(world, journal);
            int minted = ledger.mint(world, tickRandom, journal);

            stage = TickStage.BENEFACTOR;
            Map<String, GrantOutcome> grants = consultBenefactor(journal);

            stage = TickStage.AGENT_DECISIONS;
            Map<String, List<String>> meetingNotes = missionLifecycle.conductMeetings(world, journal);
            List<PendingAction> actions = collectDecisions(grants, meetingNotes, journal);

            stage = TickStage.SPARK_DISTRIBUTION;
            LOG.debug("Tick {}: {} sparks minted across {} bonds", tick, minted, world.getBonds().size());

            stage = TickStage.ACTION_RESOLUTION;
            resolveActions(actions, tickRandom, journal);

            stage = TickStage.REPORT;
            world.setPreviousActions(actions);
            world.setLatestNews(VisibilityGateway.compileNews(world, journal));
            if (rules.verifyInvariants()) {
                WorldInvariants.verify(world);
            }
            world.getRequestTables().rotate(tick + 1);
            TickReport report = journal.toReport(world.getSimulationId(), world.getAliveAgents().size(),
                world.getBonds().size(), world.getBenefactor().getBalance());
            deliver(report);
            LOG.debug("{}", report.summary());
            return report;
        } finally {
            stage = null;
        }
    }

    private Map<String, GrantOutcome> consultBenefactor(TickJournal journal) {
        List<PendingAction> requests = world.getRequestTables().frozen().grantRequests();
        List<GrantDecision> decisions = List.of();
        if (!requests.isEmpty()) {
            List<GrantRequest> view = new ArrayList<>();
            for (PendingAction request : requests) {
                Agent requester = world.getAgent(request.agentId());
                view.add(new GrantRequest(request.agentId(), requester == null ? request.agentId() : requester.getName(),
                    requester == null ? 0 : requester.getSparks(), request.content(), request.tick()));
            }
            int balance = world.getBenefactor().getBalance();
            long tick = journal.getTick();
            decisions = invoker.call("benefactor oracle",
                () -> collaborators.benefactorOracle().decideGrants(balance, tick, List.copyOf(view)),
                List::of, journal);
        }
        return ledger.applyGrants(world, requests, decisions, journal);
    }

    private List<PendingAction> collectDecisions(Map<String, GrantOutcome> grants,
                                                 Map<String, List<String>> meetingNotes, TickJournal journal) {
        List<PendingAction> actions = new ArrayList<>();
        for (Agent agent : world.getAliveAgents()) {
            Observation observation = visibilityGateway.observe(world, agent, grants.get(agent.getId()), meetingNotes);
            String agentId = agent.getId();
            Decision decision = invoker.call("decision oracle for " + agentId,
                () -> collaborators.decisionOracle().decide(agentId, observation),
                () -> Decision.idle("No decision could be obtained"), journal);
            PendingAction action = toAction(agentId, decision, journal.getTick());
            actions.add(action);
            journal.recordAction(action);
        }
        return actions;
    }

    private static PendingAction toAction(String agentId, Decision decision, long tick) {
        ActionIntent intent = decision.intent() == null ? ActionIntent.IDLE : decision.intent();
        String target = decision.targetId() == null || decision.targetId().isBlank() ? null : decision.targetId().trim();
        String content = decision.content() == null ? "" : decision.content();
        return new PendingAction(agentId, intent, target, content, decision.reasoning(), tick);
    }

    private void resolveActions(List<PendingAction> actions, IRandomProvider tickRandom, TickJournal journal) {
        List<PendingAction> accepts = new ArrayList<>();
        for (PendingAction action : actions) {
            if (action.intent() == ActionIntent.BOND_REQUEST) {
                bondingProtocol.submitRequest(world, action, journal);
            } else if (action.intent() == ActionIntent.BOND_ACCEPT) {
                accepts.add(action);
            }
        }
        for (Bond bond : bondingProtocol.resolveAccepts(world, accepts, journal)) {
            missionLifecycle.create(world, bond, journal);
        }

        for (PendingAction action : actions) {
            if (action.intent() == ActionIntent.RAID) {
                raidResolver.resolve(world, action, tickRandom, journal);
            }
        }
        for (PendingAction action : actions) {
            if (action.intent() == ActionIntent.SPAWN) {
                spawnProcedure.spawn(world, action, journal);
            }
        }

        TickGeneration current = world.getRequestTables().current();
        for (PendingAction action : actions) {
            switch (action.intent()) {
                case MESSAGE -> deliverMessage(current, action, journal);
                case REQUEST_GRANT -> {
                    Agent requester = world.getAgent(action.agentId());
                    if (requester != null && requester.isAlive()) {
                        current.addGrantRequest(action);
                    } else {
                        journal.dropped(action, "requester has vanished");
                    }
                }
                default -> {
                    // resolved above, or idle
                }
            }
        }

        vanishProcedure.sweep(world, journal);

        for (Bond bond : missionLifecycle.evaluate(world, actions, journal)) {
            vanishProcedure.dissolve(world, bond, Mission.CompletionReason.GOAL_MET, journal);
        }
    }

    private void deliverMessage(TickGeneration current, PendingAction message, TickJournal journal) {
        Agent target = world.getAgent(message.targetId());
        if (!message.hasTarget()) {
            journal.dropped(message, "no recipient");
        } else if (message.targetId().equals(message.agentId())) {
            journal.dropped(message, "cannot message oneself");
        } else if (target == null || !target.isAlive()) {
            journal.dropped(message, "recipient is unknown or has vanished");
        } else {
            current.addMessage(message);
            journal.event(WorldEventType.MESSAGE_SENT, message.agentId(), message.targetId(), message.content());
        }
    }

    private void deliver(TickReport report) {
        for (ITickReportListener listener : collaborators.reportListeners()) {
            try {
                listener.onTick(report);
            } catch (RuntimeException e) {
                LOG.warn("Report listener '{}' failed at tick {}: {}",
                    listener.getClass().getSimpleName(), report.tick(), e.getMessage());
            }
        }
    }

    /**
     * Returns the world for persistence.
     *
     * @return The world, between two ticks.
     * @throws IllegalStateException if a tick is in progress.
     */
    public WorldState snapshot() {
        if (stage != null) {
            throw new IllegalStateException("Cannot snapshot tick " + world.getTick() + " during stage " + stage);
        }
        return world;
    }

    public WorldState getWorld() {
        return world;
    }

    /**
     * @return The running stage, or {@code null} between ticks.
     */
    public TickStage getStage() {
        return stage;
    }
}
