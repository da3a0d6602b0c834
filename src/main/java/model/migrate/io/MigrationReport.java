package model.migrate.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one batch: record counts and the reason for each failed record.
 */
public class MigrationReport {
    public record Failure(int lineNumber, String reason) {}

    private int read;
    private int migrated;
    private final List<Failure> failures = new ArrayList<>();
    private boolean aborted;

    void recordRead() { read++; }

    void recordMigrated() { migrated++; }

    void recordFailure(int lineNumber, String reason) { failures.add(new Failure(lineNumber, reason)); }

    void abort() { aborted = true; }

    public int read() { return read; }
    public int migrated() { return migrated; }
    public int failed() { return failures.size(); }
    public List<Failure> failures() { return Collections.unmodifiableList(failures); }

    /** True when a fail-fast batch stopped at its first failing record. */
    public boolean aborted() { return aborted; }

    public boolean succeeded() { return failures.isEmpty(); }

    @Override
    public String toString() {
        return "read=" + read + " migrated=" + migrated + " failed=" + failed() + (aborted ? " (aborted)" : "");
    }
}
