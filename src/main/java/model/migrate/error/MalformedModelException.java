package model.migrate.error;

/**
 * Input does not parse as an old-form model at all.
 */
public class MalformedModelException extends MigrationException {
    public MalformedModelException(String message) {
        super(message);
    }

    public MalformedModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
