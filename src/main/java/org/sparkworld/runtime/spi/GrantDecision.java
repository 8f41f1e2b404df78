package org.sparkworld.runtime.spi;

/**
 * The benefactor oracle's proposal for one request. The ledger clamps the amount regardless.
 *
 * @param agentId The requester.
 * @param amount The proposed grant.
 * @param reasoning Free text.
 */
public record GrantDecision(String agentId, int amount, String reasoning) {}
