package org.sparkworld.runtime.action;

import java.util.Locale;

/**
 * The closed set of things an agent may do in a tick.
 * <p>
 * Exactly one intent per living agent per tick. {@link #IDLE} is the safe default when the
 * decision oracle times out, fails or returns something unusable.
 */
public enum ActionIntent {
    BOND_REQUEST("bond-request", true),
    BOND_ACCEPT("bond-accept", true),
    RAID("raid", true),
    SPAWN("spawn", false),
    REQUEST_GRANT("request-grant", false),
    MESSAGE("message", true),
    IDLE("idle", false);

    private final String wireName;
    private final boolean targeted;

    ActionIntent(String wireName, boolean targeted) {
        this.wireName = wireName;
        this.targeted = targeted;
    }

    /**
     * @return The external name, e.g. {@code bond-request}.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * @return {@code true} if the intent needs a target agent.
     */
    public boolean isTargeted() {
        return targeted;
    }

    /**
     * Parses an external intent name. Accepts the wire name, the enum name and
     * underscore/hyphen variants, case-insensitively.
     *
     * @param value The raw intent text.
     * @return The intent, or {@link #IDLE} if the value is blank or unknown.
     */
    public static ActionIntent parse(String value) {
        if (value == null || value.isBlank()) {
            return IDLE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ActionIntent intent : values()) {
            if (intent.wireName.equals(normalized)) {
                return intent;
            }
        }
        return IDLE;
    }
}
