package model.migrate.error;

/**
 * Old predicate operator with no new-form equivalent (e.g. exists).
 */
public class UnsupportedPredicateException extends MigrationException {
    private final String operator;

    public UnsupportedPredicateException(String operator) {
        super("unsupported predicate operator: " + operator);
        this.operator = operator;
    }

    public String operator() { return operator; }
}
