package model.migrate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import model.migrate.cli.MigrationConfig;
import model.migrate.cli.ReportPrinter;
import model.migrate.io.BatchMigrator;
import model.migrate.io.LegacyModelReader;
import model.migrate.io.MigrationReport;
import model.migrate.io.ModelWriter;
import model.migrate.tree.TreeMigrator;

/**
 * Migrates a batch of old-form tree models, one record per line, to stdout.
 *
 * Exit status: 0 on success (or when records were skipped with --skip-invalid),
 * 1 when the batch stopped at a failing record, 2 on usage or I/O errors.
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_MIGRATION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        MigrationConfig cfg;
        try {
            cfg = MigrationConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(MigrationConfig.USAGE);
            return EXIT_USAGE;
        }
        if (cfg.help) {
            out.println(MigrationConfig.USAGE);
            return EXIT_OK;
        }

        BatchMigrator batch = new BatchMigrator(
            new LegacyModelReader(cfg.maxDepth),
            new TreeMigrator(cfg.strictComplement),
            new ModelWriter(),
            cfg.modelField,
            cfg.failFast);

        MigrationReport report;
        try (BufferedReader in = open(cfg, stdin)) {
            Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            report = batch.run(in, w);
            w.flush();
        } catch (IOException e) {
            err.println("Error: cannot read input: " + e.getMessage());
            return EXIT_USAGE;
        }

        ReportPrinter.print(report, err);
        return report.aborted() ? EXIT_MIGRATION_FAILED : EXIT_OK;
    }

    private static BufferedReader open(MigrationConfig cfg, InputStream stdin) throws IOException {
        if (cfg.input != null) return Files.newBufferedReader(cfg.input, StandardCharsets.UTF_8);
        return new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
    }
}
