package org.sparkworld.runtime.spi;

/**
 * A grant request as presented to the benefactor oracle.
 *
 * @param agentId The requester.
 * @param agentName The requester's display name.
 * @param sparks The requester's balance at the time of the decision.
 * @param plea The free-text plea.
 * @param requestedInTick The tick the request was made in.
 */
public record GrantRequest(String agentId, String agentName, int sparks, String plea, long requestedInTick) {}
