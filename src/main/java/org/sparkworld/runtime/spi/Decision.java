package org.sparkworld.runtime.spi;

import org.sparkworld.runtime.action.ActionIntent;

/**
 * The decision oracle's answer for one agent in one tick.
 * <p>
 * Free-text fields are opaque to the engine. The target may be missing or malformed;
 * the engine treats anything that does not name a known agent as "no target".
 *
 * @param intent The chosen intent; {@code null} is treated as {@link ActionIntent#IDLE}.
 * @param targetId The raw target agent id, may be {@code null}, blank or {@code "None"}.
 * @param content What the agent says.
 * @param reasoning Why the agent decided so.
 */
public record Decision(ActionIntent intent, String targetId, String content, String reasoning) {

    public static Decision idle(String reasoning) {
        return new Decision(ActionIntent.IDLE, null, "", reasoning);
    }
}
