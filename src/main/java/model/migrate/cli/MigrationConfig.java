package model.migrate.cli;

import java.nio.file.Path;
import java.nio.file.Paths;

import model.migrate.io.LegacyModelReader;
import model.migrate.io.RecordLine;

public class MigrationConfig {
    public static final String USAGE = String.join("\n",
        "usage: tree-migrator [options] [< input]",
        "  --input=PATH          read records from PATH instead of stdin",
        "  --field=N             0-based TAB field holding the model JSON (default: last)",
        "  --skip-invalid        leave failing records out and continue (default: stop at first failure)",
        "  --strict-complement   also require equal values on complementary branches",
        "  --max-depth=N         reject trees nested deeper than N splits (default: " + LegacyModelReader.DEFAULT_MAX_DEPTH + ")",
        "  --help                print this message");

    public final Path input;          // null means stdin
    public final int modelField;
    public final boolean failFast;
    public final boolean strictComplement;
    public final int maxDepth;
    public final boolean help;

    public MigrationConfig(Path input,
                           int modelField,
                           boolean failFast,
                           boolean strictComplement,
                           int maxDepth,
                           boolean help) {
        this.input = input;
        this.modelField = modelField;
        this.failFast = failFast;
        this.strictComplement = strictComplement;
        this.maxDepth = maxDepth;
        this.help = help;
    }

    public static MigrationConfig defaultConfig() {
        return new MigrationConfig(
                null,
                RecordLine.LAST_FIELD,
                true,     // stop at first failing record
                false,    // operator-only complement check
                LegacyModelReader.DEFAULT_MAX_DEPTH,
                false
        );
    }

    /**
     * Parses {@code --name=value} flags.
     *
     * @throws IllegalArgumentException on an unknown flag or a malformed value
     */
    public static MigrationConfig fromArgs(String[] args) {
        Path input = null;
        int modelField = RecordLine.LAST_FIELD;
        boolean failFast = true;
        boolean strictComplement = false;
        int maxDepth = LegacyModelReader.DEFAULT_MAX_DEPTH;
        boolean help = false;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.isEmpty()) continue;
            if (s.startsWith("--input=")) {
                String p = s.substring("--input=".length());
                if (p.isEmpty()) throw new IllegalArgumentException("--input requires a path");
                input = Paths.get(p);
            } else if (s.startsWith("--field=")) {
                modelField = parseInt("--field", s.substring("--field=".length()), 0);
            } else if (s.startsWith("--max-depth=")) {
                maxDepth = parseInt("--max-depth", s.substring("--max-depth=".length()), 1);
            } else if (s.equals("--skip-invalid")) {
                failFast = false;
            } else if (s.equals("--strict-complement")) {
                strictComplement = true;
            } else if (s.equals("--help") || s.equals("-h")) {
                help = true;
            } else {
                throw new IllegalArgumentException("Unknown option: " + s);
            }
        }
        return new MigrationConfig(input, modelField, failFast, strictComplement, maxDepth, help);
    }

    private static int parseInt(String flag, String raw, int min) {
        int v;
        try {
            v = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": '" + raw + "'", e);
        }
        if (v < min) throw new IllegalArgumentException(flag + " must be >= " + min + ", got " + v);
        return v;
    }
}
