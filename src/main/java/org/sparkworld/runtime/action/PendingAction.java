package org.sparkworld.runtime.action;

/**
 * An action submitted by an agent during a tick.
 * <p>
 * Created from the decision oracle's output once per living agent per tick. Bond requests,
 * messages and grant requests are queued in the current request generation and only become
 * visible to their recipient in the following tick.
 *
 * @param agentId The acting agent.
 * @param intent What the agent wants to do.
 * @param targetId The target agent, or {@code null}.
 * @param content Opaque message payload.
 * @param reasoning Opaque oracle reasoning, kept for narration.
 * @param tick The tick in which the action was created.
 */
public record PendingAction(
    String agentId,
    ActionIntent intent,
    String targetId,
    String content,
    String reasoning,
    long tick
) {

    public boolean hasTarget() {
        return targetId != null;
    }
}
