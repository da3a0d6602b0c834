package model.migrate.error;

/**
 * Old tree violates the binary split shape: wrong branch count,
 * branches on different features, or branches that are not complements.
 */
public class StructuralException extends MigrationException {
    public static final String NOT_BINARY = "split node is not binary";
    public static final String DIFFERENT_FEATURE = "predicates use different feature";
    public static final String NOT_UNIFIABLE = "predicates are not unifiable";

    public StructuralException(String message) {
        super(message);
    }
}
