package org.sparkworld.runtime.ledger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.WorldRules;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Benefactor;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.spi.GrantDecision;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.visibility.GrantOutcome;
import org.sparkworld.runtime.visibility.PersonalEvent;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

/**
 * All creation, destruction and transfer of sparks.
 * <p>
 * The engine calls the tick phases in a fixed order: {@link #applyUpkeep}, then (after the
 * vanish sweep) {@link #mint}, then {@link #applyGrants}. Raids and spawns move sparks
 * through {@link #transfer}, {@link #burn} and {@link #endow}. Every movement is written
 * to the tick journal as a {@link LedgerEntry}.
 */
public class SparkLedger {

    private static final Logger LOG = LoggerFactory.getLogger(SparkLedger.class);

    /** Ledger party for sparks created from or destroyed into nothing. */
    public static final String VOID = "void";
    /** Ledger party for the benefactor pool. */
    public static final String BENEFACTOR = "benefactor";

    private final WorldRules rules;

    public SparkLedger(WorldRules rules) {
        this.rules = rules;
    }

    /**
     * Charges upkeep and ages every living agent.
     *
     * @param world The world.
     * @param journal The tick journal.
     * @return Living agents whose balance is now zero, in creation order.
     */
    public List<Agent> applyUpkeep(WorldState world, TickJournal journal) {
        List<Agent> exhausted = new ArrayList<>();
        for (Agent agent : world.getAliveAgents()) {
            int cost = Math.min(rules.upkeepCost(), agent.getSparks());
            agent.growOlder();
            if (cost > 0) {
                burn(agent, cost, LedgerReason.UPKEEP, journal);
                world.getTotals().sparksLost += cost;
            }
            if (agent.getSparks() <= 0) {
                exhausted.add(agent);
            }
        }
        return exhausted;
    }

    /**
     * Mints {@code |members|} sparks per live bond, each unit to a member drawn uniformly
     * with replacement.
     *
     * @param world The world. Bonds of vanished agents must already be dissolved.
     * @param random The tick's random stream.
     * @param journal The tick journal, receives per-member receipts.
     * @return Total sparks minted.
     */
    public int mint(WorldState world, IRandomProvider random, TickJournal journal) {
        int total = 0;
        for (Bond bond : world.getBonds()) {
            List<String> members = new ArrayList<>(bond.getMembers());
            Object2IntLinkedOpenHashMap<String> receipts = new Object2IntLinkedOpenHashMap<>();
            for (int unit = 0; unit < members.size(); unit++) {
                receipts.addTo(members.get(random.nextInt(members.size())), 1);
            }
            for (Object2IntMap.Entry<String> receipt : receipts.object2IntEntrySet()) {
                world.getAgent(receipt.getKey()).addSparks(receipt.getIntValue());
                journal.recordLedger(new LedgerEntry(journal.getTick(), bond.getId(), receipt.getKey(),
                    receipt.getIntValue(), LedgerReason.BOND_MINT));
                journal.recordMintReceipt(receipt.getKey(), receipt.getIntValue());
            }
            bond.setSparksGeneratedThisTick(members.size());
            total += members.size();
        }
        world.getTotals().sparksMinted += total;
        return total;
    }

    /**
     * Applies the benefactor oracle's proposals to the frozen grant requests, then
     * regenerates the pool.
     * <p>
     * Each request is answered at most once. Proposals are clamped to
     * {@code [0, maxGrantPerRequest]} and to the remaining balance. Requesters that are no
     * longer alive are refused. Proposals for agents without a request are ignored.
     *
     * @param world The world.
     * @param requests The frozen grant requests, in submission order.
     * @param decisions The oracle's proposals.
     * @param journal The tick journal.
     * @return The outcome of every request, keyed by requester.
     */
    public Map<String, GrantOutcome> applyGrants(WorldState world, List<PendingAction> requests,
                                                 List<GrantDecision> decisions, TickJournal journal) {
        Benefactor benefactor = world.getBenefactor();
        Map<String, GrantDecision> byAgent = new LinkedHashMap<>();
        for (GrantDecision decision : decisions) {
            if (decision != null && decision.agentId() != null) {
                byAgent.putIfAbsent(decision.agentId(), decision);
            }
        }

        Map<String, GrantOutcome> outcomes = new LinkedHashMap<>();
        for (PendingAction request : requests) {
            String agentId = request.agentId();
            if (outcomes.containsKey(agentId)) {
                continue;
            }
            Agent agent = world.getAgent(agentId);
            GrantDecision decision = byAgent.get(agentId);
            int proposed = decision == null ? 0 : decision.amount();
            String reasoning = decision == null ? "No answer from the benefactor" : decision.reasoning();
            int before = benefactor.getBalance();
            int granted = 0;
            if (agent == null || !agent.isAlive()) {
                reasoning = "Requester is no longer alive";
            } else {
                granted = benefactor.clamp(proposed);
                if (granted > 0) {
                    benefactor.withdraw(granted);
                    agent.addSparks(granted);
                    journal.recordLedger(new LedgerEntry(journal.getTick(), BENEFACTOR, agentId, granted,
                        LedgerReason.BENEFACTOR_GRANT));
                    world.getRequestTables().current().addEvent(agentId, new PersonalEvent(
                        PersonalEvent.Type.GRANT_RECEIVED, benefactor.getName() + " granted " + granted + " sparks",
                        granted, BENEFACTOR, journal.getTick()));
                    world.getTotals().sparksGranted += granted;
                }
            }
            GrantOutcome outcome = new GrantOutcome(agentId, request.tick(), journal.getTick(), proposed, granted,
                before, benefactor.getBalance(), reasoning);
            outcomes.put(agentId, outcome);
            journal.recordGrant(outcome);
            journal.event(WorldEventType.GRANT, agentId, null,
                benefactor.getName() + " granted " + granted + " of " + proposed + " proposed");
            if (outcome.wasClamped()) {
                LOG.debug("Tick {}: grant to {} clamped from {} to {}", journal.getTick(), agentId, proposed, granted);
            }
        }
        benefactor.regenerate();
        return outcomes;
    }

    /**
     * Moves sparks between two agents.
     *
     * @throws IllegalStateException if the payer cannot cover the amount.
     */
    public void transfer(Agent from, Agent to, int amount, LedgerReason reason, TickJournal journal) {
        requireCovered(from, amount);
        from.takeSparks(amount);
        to.addSparks(amount);
        journal.recordLedger(new LedgerEntry(journal.getTick(), from.getId(), to.getId(), amount, reason));
    }

    /**
     * Destroys sparks held by an agent.
     *
     * @throws IllegalStateException if the agent cannot cover the amount.
     */
    public void burn(Agent from, int amount, LedgerReason reason, TickJournal journal) {
        requireCovered(from, amount);
        from.takeSparks(amount);
        journal.recordLedger(new LedgerEntry(journal.getTick(), from.getId(), VOID, amount, reason));
    }

    /**
     * Creates sparks for an agent.
     */
    public void endow(Agent to, int amount, LedgerReason reason, TickJournal journal) {
        to.addSparks(amount);
        journal.recordLedger(new LedgerEntry(journal.getTick(), VOID, to.getId(), amount, reason));
    }

    private static void requireCovered(Agent agent, int amount) {
        if (amount > agent.getSparks()) {
            throw new IllegalStateException("Agent " + agent.getId() + " holds " + agent.getSparks()
                + " sparks, cannot pay " + amount);
        }
    }
}
