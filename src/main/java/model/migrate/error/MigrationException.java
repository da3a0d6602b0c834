package model.migrate.error;

/**
 * Base failure for a record that cannot be migrated.
 * Terminal for the record: nothing is emitted for a tree that raised it.
 */
public class MigrationException extends RuntimeException {
    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
