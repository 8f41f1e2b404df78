package org.sparkworld.runtime.model;

/**
 * Life status of an agent. {@link #VANISHED} is terminal.
 */
public enum AgentStatus {
    ALIVE,
    VANISHED
}
