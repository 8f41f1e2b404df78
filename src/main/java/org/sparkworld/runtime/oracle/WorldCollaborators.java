package org.sparkworld.runtime.oracle;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sparkworld.runtime.spi.IBenefactorOracle;
import org.sparkworld.runtime.spi.ICharacterGenerator;
import org.sparkworld.runtime.spi.IDecisionOracle;
import org.sparkworld.runtime.spi.IMissionEvaluator;
import org.sparkworld.runtime.spi.IMissionGenerator;
import org.sparkworld.runtime.spi.IMissionMeetingCoordinator;
import org.sparkworld.runtime.spi.IRandomProvider;
import org.sparkworld.runtime.spi.ITickReportListener;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * The full set of external collaborators a world engine talks to.
 *
 * @param decisionOracle Chooses agent actions.
 * @param benefactorOracle Answers grant requests.
 * @param characterGenerator Creates personas.
 * @param missionGenerator Writes missions.
 * @param missionEvaluator Judges missions.
 * @param meetingCoordinator Runs mission meetings.
 * @param reportListeners Receive tick reports, in order.
 */
public record WorldCollaborators(
    IDecisionOracle decisionOracle,
    IBenefactorOracle benefactorOracle,
    ICharacterGenerator characterGenerator,
    IMissionGenerator missionGenerator,
    IMissionEvaluator missionEvaluator,
    IMissionMeetingCoordinator meetingCoordinator,
    List<ITickReportListener> reportListeners
) {

    private static final Logger LOG = LoggerFactory.getLogger(WorldCollaborators.class);

    public WorldCollaborators {
        reportListeners = List.copyOf(reportListeners);
    }

    /**
     * Instantiates every collaborator from configuration.
     * <p>
     * Each collaborator block has the form {@code { className = "...", options { ... } }}.
     * Every collaborator receives its own random stream derived from {@code random}.
     *
     * @param oracles The {@code sparkworld.oracles} block.
     * @param reporters The {@code sparkworld.reporters} list.
     * @param random The root random provider of the simulation.
     * @return The collaborators.
     * @throws IllegalArgumentException if a class cannot be loaded or has the wrong type.
     */
    public static WorldCollaborators fromConfig(Config oracles, List<? extends Config> reporters, IRandomProvider random) {
        List<ITickReportListener> listeners = new ArrayList<>();
        for (int i = 0; i < reporters.size(); i++) {
            listeners.add(create(reporters.get(i), ITickReportListener.class, random.deriveFor("reporter", i)));
        }
        return new WorldCollaborators(
            create(oracles.getConfig("decision"), IDecisionOracle.class, random.deriveFor("decision", 0)),
            create(oracles.getConfig("benefactor"), IBenefactorOracle.class, random.deriveFor("benefactor", 0)),
            create(oracles.getConfig("character-generator"), ICharacterGenerator.class, random.deriveFor("character", 0)),
            create(oracles.getConfig("mission-generator"), IMissionGenerator.class, random.deriveFor("mission", 0)),
            create(oracles.getConfig("mission-evaluator"), IMissionEvaluator.class, random.deriveFor("evaluator", 0)),
            create(oracles.getConfig("meeting-coordinator"), IMissionMeetingCoordinator.class, random.deriveFor("meeting", 0)),
            listeners);
    }

    /**
     * Creates one collaborator through its {@code (IRandomProvider, Config)} constructor.
     *
     * @param block The collaborator block.
     * @param type The expected interface.
     * @param random The collaborator's random stream.
     * @param <T> The interface type.
     * @return The instance.
     */
    public static <T> T create(Config block, Class<T> type, IRandomProvider random) {
        String className = block.getString("className");
        Config options = block.hasPath("options") ? block.getConfig("options") : ConfigFactory.empty();
        try {
            Object instance = Class.forName(className)
                .getConstructor(IRandomProvider.class, Config.class)
                .newInstance(random, options);
            if (!type.isInstance(instance)) {
                throw new IllegalArgumentException(className + " does not implement " + type.getSimpleName());
            }
            LOG.debug("Created {} as {}", className, type.getSimpleName());
            return type.cast(instance);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate collaborator: " + className, e);
        }
    }
}
