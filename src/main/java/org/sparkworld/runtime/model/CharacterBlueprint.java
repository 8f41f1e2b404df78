package org.sparkworld.runtime.model;

import java.util.List;

/**
 * The persona of an agent, produced once per agent by the character generator.
 * <p>
 * The engine never interprets these fields; they are carried along for observations,
 * mission generation and narration.
 *
 * @param name Display name.
 * @param species Any imaginable form.
 * @param homeRealm Where the agent comes from.
 * @param personality Three to five adjectives.
 * @param quirk One striking habit.
 * @param ability A short power tied to species or quirk.
 * @param backstory At most two sentences.
 * @param openingGoal A single clear desire.
 * @param speechStyle How the agent expresses itself.
 */
public record CharacterBlueprint(
    String name,
    String species,
    String homeRealm,
    List<String> personality,
    String quirk,
    String ability,
    String backstory,
    String openingGoal,
    String speechStyle
) {

    public CharacterBlueprint {
        personality = personality == null ? List.of() : List.copyOf(personality);
    }

    /**
     * Returns a one-line description used in prompts and log output.
     *
     * @return {@code "name (species) - trait, trait"}.
     */
    public String summary() {
        return name + " (" + species + ") - " + String.join(", ", personality);
    }
}
