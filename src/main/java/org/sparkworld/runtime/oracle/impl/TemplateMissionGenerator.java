package org.sparkworld.runtime.oracle.impl;

import java.util.ArrayList;
import java.util.List;

import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.spi.IMissionGenerator;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.spi.MissionContent;

import com.typesafe.config.Config;

/**
 * Offline mission generator that fills fixed templates with the members' names and realms.
 */
public class TemplateMissionGenerator implements IMissionGenerator {

    private static final List<String[]> TEMPLATES = List.of(
        new String[] {"The Lantern Watch", "Keep a light burning over %s.", "Stand watch together until dawn"},
        new String[] {"Roads Between Realms", "Chart a safe road from %s.", "Map one safe road"},
        new String[] {"The Spark Cache", "Hide a reserve of sparks near %s.", "Store sparks for hard times"},
        new String[] {"Old Debts", "Settle an old quarrel that began in %s.", "Make peace with a rival"});

    private final IRandomProvider random;

    public TemplateMissionGenerator(IRandomProvider random, Config options) {
        this.random = random;
    }

    @Override
    public MissionContent generateMission(List<CharacterBlueprint> members) {
        String[] template = TEMPLATES.get(random.nextInt(TEMPLATES.size()));
        List<String> names = new ArrayList<>();
        for (CharacterBlueprint member : members) {
            names.add(member.name());
        }
        String realm = members.isEmpty() ? "the wilds" : members.get(0).homeRealm();
        return new MissionContent(template[0],
            String.format(template[1], realm) + " Team: " + String.join(", ", names) + ".",
            template[2]);
    }
}
