package org.sparkworld.runtime.spi;

import org.sparkworld.runtime.model.CharacterBlueprint;

/**
 * Creates personas. Called exactly once per new agent, at genesis and for every spawn.
 */
public interface ICharacterGenerator extends IWorldCollaborator {

    /**
     * @return A fresh persona, never {@code null}.
     */
    CharacterBlueprint spawn();
}
