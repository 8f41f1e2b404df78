package org.sparkworld.runtime.spi;

/**
 * Base interface for every external collaborator of the world engine.
 * <p>
 * Collaborators are configured as {@code { className, options }} blocks and created
 * reflectively. Implementations must provide a constructor with signature:
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}
 * </p>
 */
public interface IWorldCollaborator {
    // Marker interface for common collaborator management
}
