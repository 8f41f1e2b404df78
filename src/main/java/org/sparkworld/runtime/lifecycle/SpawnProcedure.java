package org.sparkworld.runtime.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.ledger.LedgerReason;
import org.sparkworld.runtime.ledger.SparkLedger;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.oracle.OracleInvoker;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.spi.ICharacterGenerator;
import org.sparkworld.runtime.visibility.PersonalEvent;

/**
 * Brings new agents into the world, at genesis and when a bonded agent spawns.
 */
public class SpawnProcedure {

    private static final Logger LOG = LoggerFactory.getLogger(SpawnProcedure.class);

    private final WorldRules rules;
    private final SparkLedger ledger;
    private final ICharacterGenerator generator;
    private final OracleInvoker invoker;

    public SpawnProcedure(WorldRules rules, SparkLedger ledger, ICharacterGenerator generator, OracleInvoker invoker) {
        this.rules = rules;
        this.ledger = ledger;
        this.generator = generator;
        this.invoker = invoker;
    }

    /**
     * Creates a genesis agent.
     *
     * @param world The world at tick 0.
     * @return The new agent.
     * @throws IllegalStateException if the character generator gives no persona.
     */
    public Agent createGenesisAgent(WorldState world) {
        CharacterBlueprint persona = invoker.call("character generator", generator::spawn, () -> null, null);
        if (persona == null) {
            throw new IllegalStateException("Character generator produced no persona for a genesis agent");
        }
        Agent agent = new Agent(world.nextAgentId(), persona, rules.initialSparks(), world.getTick(), null);
        world.addAgent(agent);
        return agent;
    }

    /**
     * Handles a spawn action.
     * <p>
     * The parent must be alive, bonded and hold at least the spawn cost. The generator is
     * asked first; if it fails, the spawn is refused and nothing is charged.
     *
     * @param world The world.
     * @param action A spawn action.
     * @param journal The tick journal.
     * @return The newborn, or {@code null} if the spawn was refused.
     */
    public Agent spawn(WorldState world, PendingAction action, TickJournal journal) {
        Agent parent = world.getAgent(action.agentId());
        String problem = null;
        if (parent == null || !parent.isAlive()) {
            problem = "parent has vanished";
        } else if (!parent.isBonded()) {
            problem = "only bonded agents can spawn";
        } else if (parent.getSparks() < rules.spawnCost()) {
            problem = "needs " + rules.spawnCost() + " sparks, holds " + parent.getSparks();
        }
        if (problem != null) {
            refuse(world, action, problem, journal);
            return null;
        }

        CharacterBlueprint persona = invoker.call("character generator for child of " + parent.getId(),
            generator::spawn, () -> null, journal);
        if (persona == null) {
            refuse(world, action, "no persona could be generated", journal);
            return null;
        }

        Agent child = new Agent(world.nextAgentId(), persona, 0, journal.getTick(), parent.getId());
        world.addAgent(child);
        ledger.burn(parent, rules.spawnCost(), LedgerReason.SPAWN_COST, journal);
        ledger.endow(child, rules.newbornSparks(), LedgerReason.SPAWN_ENDOWMENT, journal);
        world.getTotals().agentsSpawned++;
        journal.agentSpawned(child.getId(), parent.getId());
        world.getRequestTables().current().addEvent(parent.getId(), new PersonalEvent(
            PersonalEvent.Type.SPAWNED_CHILD, "Spawned " + persona.name() + " (" + child.getId() + ")",
            -rules.spawnCost(), child.getId(), journal.getTick()));
        LOG.debug("Tick {}: {} spawned {} ({})", journal.getTick(), parent.getId(), child.getId(), persona.name());
        return child;
    }

    private static void refuse(WorldState world, PendingAction action, String reason, TickJournal journal) {
        journal.dropped(action, reason);
        journal.event(WorldEventType.SPAWN_REFUSED, action.agentId(), null, reason);
        Agent parent = world.getAgent(action.agentId());
        if (parent != null && parent.isAlive()) {
            world.getRequestTables().current().addEvent(parent.getId(), new PersonalEvent(
                PersonalEvent.Type.ACTION_REFUSED, "Spawn refused: " + reason, 0, null, journal.getTick()));
        }
    }
}
