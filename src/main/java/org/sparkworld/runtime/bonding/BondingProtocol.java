package org.sparkworld.runtime.bonding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.action.ActionIntent;
import org.sparkworld.runtime.action.PendingAction;
import org.sparkworld.runtime.model.Agent;
import org.sparkworld.runtime.model.Bond;
import org.sparkworld.runtime.model.BondStatus;
import org.sparkworld.runtime.model.WorldState;
import org.sparkworld.runtime.report.TickJournal;
import org.sparkworld.runtime.report.WorldEventType;
import org.sparkworld.runtime.visibility.PersonalEvent;
import org.sparkworld.runtime.visibility.TickGeneration;

/**
 * Two-step bond formation: a request in tick {@code T}, an accept in {@code T+1}.
 * <p>
 * Requests go into the current request generation. Accepts are checked against the frozen
 * generation only. All valid accept edges of a tick are merged by transitive closure, so
 * A-accepts-B plus B-accepts-C yields one bond {A, B, C}. When a component contains a member
 * that is no longer eligible, the whole component is skipped; earlier components win.
 */
public class BondingProtocol {

    private static final Logger LOG = LoggerFactory.getLogger(BondingProtocol.class);

    /**
     * Validates a bond request and queues it for its target.
     *
     * @param world The world.
     * @param request A {@link ActionIntent#BOND_REQUEST}.
     * @param journal The tick journal.
     * @return {@code true} if the request was queued.
     */
    public boolean submitRequest(WorldState world, PendingAction request, TickJournal journal) {
        Agent requester = world.getAgent(request.agentId());
        Agent target = world.getAgent(request.targetId());
        String problem = null;
        if (!request.hasTarget()) {
            problem = "no target";
        } else if (request.targetId().equals(request.agentId())) {
            problem = "cannot bond with oneself";
        } else if (target == null) {
            problem = "unknown target";
        } else if (!target.isAlive()) {
            problem = "target has vanished";
        } else if (requester == null || !requester.isAlive()) {
            problem = "requester has vanished";
        } else if (requester.isBonded()) {
            problem = "requester is already bonded";
        } else if (target.isBonded()) {
            problem = "target is already bonded";
        }
        if (problem != null) {
            journal.dropped(request, problem);
            return false;
        }
        world.getRequestTables().current().addBondRequest(request);
        journal.event(WorldEventType.BOND_REQUESTED, request.agentId(), request.targetId(),
            requester.getName() + " asked " + target.getName() + " to bond");
        return true;
    }

    /**
     * Resolves this tick's accepts into bonds.
     *
     * @param world The world.
     * @param accepts {@link ActionIntent#BOND_ACCEPT} actions; the target is the requester.
     * @param journal The tick journal.
     * @return The bonds formed, in formation order. Missions are not yet attached.
     */
    public List<Bond> resolveAccepts(WorldState world, List<PendingAction> accepts, TickJournal journal) {
        TickGeneration frozen = world.getRequestTables().frozen();
        List<PendingAction> edges = new ArrayList<>();
        for (PendingAction accept : accepts) {
            String problem = validateAccept(world, frozen, accept);
            if (problem != null) {
                journal.dropped(accept, problem);
            } else {
                edges.add(accept);
            }
        }
        if (edges.isEmpty()) {
            return List.of();
        }
        edges.sort(Comparator.comparing(PendingAction::agentId));

        UnionFind components = new UnionFind();
        for (PendingAction edge : edges) {
            components.union(edge.targetId(), edge.agentId());
        }
        Map<String, Set<String>> membersByRoot = new LinkedHashMap<>();
        Map<String, List<PendingAction>> edgesByRoot = new LinkedHashMap<>();
        for (PendingAction edge : edges) {
            String root = components.find(edge.agentId());
            Set<String> members = membersByRoot.computeIfAbsent(root, k -> new LinkedHashSet<>());
            members.add(edge.targetId());
            members.add(edge.agentId());
            edgesByRoot.computeIfAbsent(root, k -> new ArrayList<>()).add(edge);
        }

        List<Bond> formed = new ArrayList<>();
        for (Map.Entry<String, Set<String>> component : membersByRoot.entrySet()) {
            List<String> members = new ArrayList<>(component.getValue());
            String ineligible = firstIneligible(world, members);
            if (ineligible != null) {
                LOG.debug("Tick {}: skipping bond of {} because {} is no longer eligible",
                    journal.getTick(), members, ineligible);
                for (PendingAction edge : edgesByRoot.get(component.getKey())) {
                    journal.dropped(edge, ineligible + " is no longer eligible to bond");
                }
                continue;
            }
            Bond bond = form(world, members, journal);
            for (PendingAction edge : edgesByRoot.get(component.getKey())) {
                frozen.consumeBondRequest(edge.targetId(), edge.agentId());
            }
            formed.add(bond);
        }
        return formed;
    }

    private static String validateAccept(WorldState world, TickGeneration frozen, PendingAction accept) {
        if (!accept.hasTarget()) {
            return "no requester named";
        }
        if (accept.targetId().equals(accept.agentId())) {
            return "cannot accept oneself";
        }
        PendingAction request = frozen.findBondRequest(accept.targetId(), accept.agentId());
        if (request == null) {
            return "no pending request from " + accept.targetId();
        }
        if (request.tick() >= accept.tick()) {
            return "request is not from an earlier tick";
        }
        Agent accepter = world.getAgent(accept.agentId());
        Agent requester = world.getAgent(accept.targetId());
        if (requester == null || !requester.isAlive()) {
            return "requester has vanished";
        }
        if (accepter == null || !accepter.isAlive()) {
            return "accepter has vanished";
        }
        if (requester.isBonded()) {
            return "requester is already bonded";
        }
        if (accepter.isBonded()) {
            return "accepter is already bonded";
        }
        return null;
    }

    private static String firstIneligible(WorldState world, List<String> members) {
        for (String id : members) {
            Agent agent = world.getAgent(id);
            if (agent == null || !agent.isAlive() || agent.isBonded()) {
                return id;
            }
        }
        return null;
    }

    private static Bond form(WorldState world, List<String> members, TickJournal journal) {
        Bond bond = new Bond(world.nextBondId(), members, members.get(0), journal.getTick());
        world.addBond(bond);
        TickGeneration current = world.getRequestTables().current();
        for (String id : members) {
            Agent agent = world.getAgent(id);
            agent.joinBond(id.equals(bond.getLeaderId()) ? BondStatus.LEADER : BondStatus.BONDED, bond.getMembers());
            current.addEvent(id, new PersonalEvent(PersonalEvent.Type.BOND_FORMED,
                "Bonded with " + agent.getBondMates() + " in " + bond.getId(), 0, bond.getLeaderId(),
                journal.getTick()));
        }
        world.getTotals().bondsFormed++;
        journal.bondFormed(bond.getId(), members);
        LOG.debug("Tick {}: bond {} formed by {}, leader {}", journal.getTick(), bond.getId(), members,
            bond.getLeaderId());
        return bond;
    }

    /**
     * Disjoint sets over agent ids.
     */
    private static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();

        String find(String id) {
            String root = id;
            while (true) {
                String next = parent.getOrDefault(root, root);
                if (next.equals(root)) {
                    break;
                }
                root = next;
            }
            // path compression
            String node = id;
            while (!node.equals(root)) {
                String next = parent.getOrDefault(node, node);
                parent.put(node, root);
                node = next;
            }
            return root;
        }

        void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (!rootA.equals(rootB)) {
                parent.put(rootB, rootA);
            }
        }
    }
}
