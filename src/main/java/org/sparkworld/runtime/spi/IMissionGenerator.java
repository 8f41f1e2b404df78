package org.sparkworld.runtime.spi;

import java.util.List;

import org.sparkworld.runtime.model.CharacterBlueprint;

/**
 * Writes the mission a freshly formed bond will pursue.
 */
public interface IMissionGenerator extends IWorldCollaborator {

    /**
     * @param members Personas of the bond members, leader first.
     * @return The mission content.
     */
    MissionContent generateMission(List<CharacterBlueprint> members);
}
