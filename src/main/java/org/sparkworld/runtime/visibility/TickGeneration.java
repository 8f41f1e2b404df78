package org.sparkworld.runtime.visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;

/**
 * One generation of inter-agent traffic: everything produced during a single tick that
 * is addressed to somebody else.
 * <p>
 * While current, the engine appends to it. Once {@link #freeze() frozen} it rejects new
 * entries; the only permitted mutation is {@link #consumeBondRequest(String, String)},
 * which removes a request that has been turned into a bond.
 */
public class TickGeneration {

    private final long tick;
    private final Map<String, List<PendingAction>> bondRequestsByTarget = new LinkedHashMap<>();
    private final Map<String, List<PendingAction>> messagesByTarget = new LinkedHashMap<>();
    private final Map<String, PendingAction> grantRequestsByAgent = new LinkedHashMap<>();
    private final Map<String, List<PersonalEvent>> eventsByAgent = new LinkedHashMap<>();
    private boolean frozen = false;

    /**
     * @param tick The tick this generation collects traffic for.
     */
    public TickGeneration(long tick) {
        this.tick = tick;
    }

    public long getTick() {
        return tick;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Makes this generation read-only.
     */
    public void freeze() {
        this.frozen = true;
    }

    /**
     * Queues a bond request for its target.
     *
     * @param request A {@link ActionIntent#BOND_REQUEST} with a target.
     */
    public void addBondRequest(PendingAction request) {
        ensureWritable();
        requireIntent(request, ActionIntent.BOND_REQUEST);
        bondRequestsByTarget.computeIfAbsent(request.targetId(), k -> new ArrayList<>()).add(request);
    }

    /**
     * Queues a direct message for its target.
     *
     * @param message A {@link ActionIntent#MESSAGE} with a target.
     */
    public void addMessage(PendingAction message) {
        ensureWritable();
        requireIntent(message, ActionIntent.MESSAGE);
        messagesByTarget.computeIfAbsent(message.targetId(), k -> new ArrayList<>()).add(message);
    }

    /**
     * Queues a grant request for the benefactor. One per agent; the single-action rule
     * makes a second one impossible within a tick.
     *
     * @param request A {@link ActionIntent#REQUEST_GRANT}.
     */
    public void addGrantRequest(PendingAction request) {
        ensureWritable();
        requireIntent(request, ActionIntent.REQUEST_GRANT);
        grantRequestsByAgent.putIfAbsent(request.agentId(), request);
    }

    /**
     * Records a personal event for an agent.
     *
     * @param agentId The agent the event happened to.
     * @param event The event.
     */
    public void addEvent(String agentId, PersonalEvent event) {
        ensureWritable();
        eventsByAgent.computeIfAbsent(agentId, k -> new ArrayList<>()).add(event);
    }

    /**
     * @param targetId The receiving agent.
     * @return Bond requests addressed to the agent, in submission order.
     */
    public List<PendingAction> bondRequestsFor(String targetId) {
        return Collections.unmodifiableList(bondRequestsByTarget.getOrDefault(targetId, List.of()));
    }

    /**
     * Finds the request from {@code requesterId} to {@code targetId}.
     *
     * @return The request, or {@code null} if none is pending.
     */
    public PendingAction findBondRequest(String requesterId, String targetId) {
        for (PendingAction request : bondRequestsByTarget.getOrDefault(targetId, List.of())) {
            if (request.agentId().equals(requesterId)) {
                return request;
            }
        }
        return null;
    }

    /**
     * Removes a consumed bond request. Permitted on a frozen generation.
     *
     * @return {@code true} if a request was removed.
     */
    public boolean consumeBondRequest(String requesterId, String targetId) {
        List<PendingAction> requests = bondRequestsByTarget.get(targetId);
        if (requests == null) {
            return false;
        }
        Iterator<PendingAction> it = requests.iterator();
        while (it.hasNext()) {
            if (it.next().agentId().equals(requesterId)) {
                it.remove();
                if (requests.isEmpty()) {
                    bondRequestsByTarget.remove(targetId);
                }
                return true;
            }
        }
        return false;
    }

    /**
     * @param targetId The receiving agent.
     * @return Messages addressed to the agent, in submission order.
     */
    public List<PendingAction> messagesFor(String targetId) {
        return Collections.unmodifiableList(messagesByTarget.getOrDefault(targetId, List.of()));
    }

    /**
     * @return All grant requests of this generation, in submission order.
     */
    public List<PendingAction> grantRequests() {
        return List.copyOf(grantRequestsByAgent.values());
    }

    /**
     * @param agentId The agent.
     * @return Personal events of the agent, in occurrence order.
     */
    public List<PersonalEvent> eventsFor(String agentId) {
        return Collections.unmodifiableList(eventsByAgent.getOrDefault(agentId, List.of()));
    }

    /**
     * @return All bond requests, flattened, in target insertion order.
     */
    public List<PendingAction> allBondRequests() {
        List<PendingAction> all = new ArrayList<>();
        bondRequestsByTarget.values().forEach(all::addAll);
        return all;
    }

    /**
     * @return All messages, flattened, in target insertion order.
     */
    public List<PendingAction> allMessages() {
        List<PendingAction> all = new ArrayList<>();
        messagesByTarget.values().forEach(all::addAll);
        return all;
    }

    /**
     * @return An unmodifiable view of every agent's personal events.
     */
    public Map<String, List<PersonalEvent>> allEvents() {
        return Collections.unmodifiableMap(eventsByAgent);
    }

    private void ensureWritable() {
        if (frozen) {
            throw new IllegalStateException("Generation of tick " + tick + " is frozen");
        }
    }

    private static void requireIntent(PendingAction action, ActionIntent expected) {
        if (action.intent() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " but got " + action.intent());
        }
        if (expected.isTargeted() && action.targetId() == null) {
            throw new IllegalArgumentException(expected + " requires a target");
        }
    }
}
