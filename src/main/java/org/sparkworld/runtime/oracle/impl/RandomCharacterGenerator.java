package org.sparkworld.runtime.oracle.impl;

import java.util.ArrayList;
import java.util.List;

import org.sparkworld.runtime.model.CharacterBlueprint;
import org.sparkworld.runtime.spi.ICharacterGenerator;
import org.sparkworld.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Offline persona generator that combines entries of fixed word pools.
 * <p>
 * Names repeat once the pool is exhausted and then get a roman-style suffix.
 */
public class RandomCharacterGenerator implements ICharacterGenerator {

    private static final List<String> NAMES = List.of("Ember", "Quill", "Moss", "Vesper", "Tamsin", "Orrin",
        "Lark", "Brindle", "Sable", "Juniper", "Corvin", "Wren", "Fennel", "Ashby", "Marlo", "Thistle");
    private static final List<String> SPECIES = List.of("lantern sprite", "stone golem", "river otterkin",
        "cloud moth", "ember fox", "glass heron", "moss troll", "clockwork owl");
    private static final List<String> REALMS = List.of("the Hollow Marsh", "the Brass Citadel", "the Whispering Dunes",
        "the Lantern Coast", "the Frostvale", "the Sunken Library");
    private static final List<String> TRAITS = List.of("curious", "stubborn", "generous", "wary", "boastful",
        "patient", "mischievous", "loyal", "anxious", "cheerful");
    private static final List<String> QUIRKS = List.of("hums while thinking", "collects buttons",
        "speaks to the moon", "never sits down", "counts everything twice");
    private static final List<String> ABILITIES = List.of("reads old maps", "kindles small fires",
        "hears distant footsteps", "mends broken things", "remembers every face");
    private static final List<String> GOALS = List.of("find a loyal companion", "never run out of sparks",
        "see every realm once", "build something that lasts", "earn the benefactor's favor");
    private static final List<String> STYLES = List.of("formal", "terse", "poetic", "rambling", "playful");

    private final IRandomProvider random;
    private int created = 0;

    public RandomCharacterGenerator(IRandomProvider random, Config options) {
        this.random = random;
    }

    @Override
    public CharacterBlueprint spawn() {
        int round = created / NAMES.size();
        String name = pick(NAMES) + (round == 0 ? "" : " " + (round + 1));
        created++;
        String species = pick(SPECIES);
        String realm = pick(REALMS);
        List<String> personality = new ArrayList<>();
        while (personality.size() < 2) {
            String trait = pick(TRAITS);
            if (!personality.contains(trait)) {
                personality.add(trait);
            }
        }
        return new CharacterBlueprint(name, species, realm, personality, pick(QUIRKS), pick(ABILITIES),
            name + " the " + species + " left " + realm + " in search of sparks.", pick(GOALS), pick(STYLES));
    }

    private String pick(List<String> pool) {
        return pool.get(random.nextInt(pool.size()));
    }
}
