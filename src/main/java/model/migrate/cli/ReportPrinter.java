package model.migrate.cli;

import java.io.PrintStream;

import model.migrate.io.MigrationReport;

/**
 * Writes batch failures and the end-of-run summary to the error stream.
 */
public final class ReportPrinter {
    private static final String TAG = "[migrate] ";

    private ReportPrinter() {}

    public static void print(MigrationReport report, PrintStream err) {
        for (MigrationReport.Failure f : report.failures()) {
            String action = report.aborted() ? "failed" : "skipped";
            err.println(TAG + "line " + f.lineNumber() + " " + action + ": " + f.reason());
        }
        if (report.aborted()) {
            err.println(TAG + "aborted after " + report.migrated() + " migrated record(s)");
        } else {
            err.println(TAG + report.migrated() + " record(s) migrated, " + report.failed() + " skipped");
        }
    }
}
