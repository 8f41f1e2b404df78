package org.sparkworld.runtime.visibility;

/**
 * The benefactor's answer to one grant request.
 * <p>
 * Computed in tick {@code T} from a request made in {@code T-1} and shown to the
 * requester in the observation of tick {@code T}.
 *
 * @param agentId The requester.
 * @param requestedInTick The tick the request was made in.
 * @param decidedInTick The tick the request was processed in.
 * @param proposed What the benefactor oracle proposed.
 * @param granted What was actually granted after clamping.
 * @param balanceBefore Benefactor balance before this grant.
 * @param balanceAfter Benefactor balance after this grant.
 * @param reasoning The oracle's reasoning.
 */
public record GrantOutcome(
    String agentId,
    long requestedInTick,
    long decidedInTick,
    int proposed,
    int granted,
    int balanceBefore,
    int balanceAfter,
    String reasoning
) {

    public boolean wasClamped() {
        return granted < proposed;
    }
}
