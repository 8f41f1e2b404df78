package org.sparkworld.persistence;

/**
 * Thrown when a world snapshot cannot be written, read or decoded.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>No snapshot stored for the simulation or tick</li>
 *   <li>I/O failure of the underlying store</li>
 *   <li>Corrupted or incompatible snapshot content</li>
 * </ul>
 * <p>
 * This is a RuntimeException because persistence failures abort the running operation and
 * cannot be recovered from automatically.
 */
public class PersistenceException extends RuntimeException {

    /**
     * @param message Description of the failure
     */
    public PersistenceException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure
     * @param cause The underlying exception
     */
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
