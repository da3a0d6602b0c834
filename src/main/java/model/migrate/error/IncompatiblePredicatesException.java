package model.migrate.error;

// Union of two predicates has no single-predicate form.
public class IncompatiblePredicatesException extends MigrationException {
    public IncompatiblePredicatesException() {
        super("can't migrate complex predicate");
    }
}
