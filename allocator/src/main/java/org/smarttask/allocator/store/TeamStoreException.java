package org.smarttask.allocator.store;

/**
 * Thrown when the team store cannot read or persist data.
 */
public class TeamStoreException extends RuntimeException {

    public TeamStoreException(String message) {
        super(message);
    }

    public TeamStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
