package model.migrate.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;

import model.migrate.error.MigrationException;
import model.migrate.tree.LegacyNode;
import model.migrate.tree.Node;
import model.migrate.tree.TreeMigrator;

/**
 * Line-oriented batch driver: reads one record per line, migrates its model
 * field and writes the rewritten record.
 *
 * Fail-fast (default): the first failing record ends the batch and nothing is
 * written for it or any later line. Skip mode leaves failing records out and
 * keeps going. Either way every failure lands in the returned report.
 */
public class BatchMigrator {
    private final LegacyModelReader reader;
    private final TreeMigrator migrator;
    private final ModelWriter writer;
    private final int modelField;
    private final boolean failFast;

    public BatchMigrator(LegacyModelReader reader, TreeMigrator migrator, ModelWriter writer, int modelField, boolean failFast) {
        this.reader = reader;
        this.migrator = migrator;
        this.writer = writer;
        this.modelField = modelField;
        this.failFast = failFast;
    }

    /** Fail-fast batch over the last field of each line, with default limits. */
    public BatchMigrator() {
        this(new LegacyModelReader(), new TreeMigrator(), new ModelWriter(), RecordLine.LAST_FIELD, true);
    }

    public MigrationReport run(BufferedReader in, Writer out) throws IOException {
        MigrationReport report = new MigrationReport();
        int lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) continue;
            report.recordRead();
            String migrated;
            try {
                migrated = migrateRecord(line);
            } catch (MigrationException e) {
                report.recordFailure(lineNumber, e.getMessage());
                if (failFast) {
                    report.abort();
                    break;
                }
                continue;
            }
            out.write(migrated);
            out.write('\n');
            out.flush();
            report.recordMigrated();
        }
        return report;
    }

    /**
     * Migrates a single record line.
     *
     * @throws MigrationException if the record's model cannot be migrated
     */
    public String migrateRecord(String line) {
        RecordLine record = RecordLine.parse(line, modelField);
        LegacyNode legacy = reader.read(record.model());
        Node node = migrator.migrate(legacy);
        return record.withModel(writer.write(node));
    }
}
