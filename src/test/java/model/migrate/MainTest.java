package model.migrate;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {

    private static final String GOOD_OLD = "[{\"feature\":\"x\",\"predicate\":{\"lt\":3},\"children\":\"A\"},"
        + "{\"feature\":\"x\",\"predicate\":{\"not\":{\"lt\":3}},\"children\":\"B\"}]";
    private static final String GOOD_NEW = "{\"key\":\"x\",\"predicate\":{\"lt\":3},\"left\":\"A\",\"right\":\"B\"}";
    private static final String EXISTS_OLD = "[{\"feature\":\"x\",\"predicate\":{\"exists\":true},\"children\":1},"
        + "{\"feature\":\"x\",\"predicate\":{\"not\":{\"exists\":true}},\"children\":0}]";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return Main.run(args,
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() { return out.toString(StandardCharsets.UTF_8); }
    private String err() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void migratesBatchFromStdin() {
        int status = run("a\t" + GOOD_OLD + "\nb\t0.5\n");
        assertEquals(Main.EXIT_OK, status);
        assertEquals("a\t" + GOOD_NEW + "\nb\t0.5\n", out());
        assertTrue(err().contains("2 record(s) migrated"));
    }

    @Test
    void abortsOnFirstFailure() {
        int status = run("a\t" + GOOD_OLD + "\nb\t" + EXISTS_OLD + "\nc\t" + GOOD_OLD + "\n");
        assertEquals(Main.EXIT_MIGRATION_FAILED, status);
        assertEquals("a\t" + GOOD_NEW + "\n", out());
        assertTrue(err().contains("line 2 failed: unsupported predicate operator: exists"), err());
    }

    @Test
    void skipInvalidKeepsGoing() {
        int status = run("a\t" + GOOD_OLD + "\nb\t" + EXISTS_OLD + "\nc\t" + GOOD_OLD + "\n", "--skip-invalid");
        assertEquals(Main.EXIT_OK, status);
        assertEquals("a\t" + GOOD_NEW + "\nc\t" + GOOD_NEW + "\n", out());
        assertTrue(err().contains("line 2 skipped"), err());
    }

    @Test
    void readsInputFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("models.tsv");
        Files.writeString(file, GOOD_OLD + "\n");
        assertEquals(Main.EXIT_OK, run("", "--input=" + file));
        assertEquals(GOOD_NEW + "\n", out());
    }

    @Test
    void usageErrors(@TempDir Path dir) {
        assertEquals(Main.EXIT_USAGE, run("", "--bogus"));
        assertTrue(err().contains("Unknown option: --bogus"));
        assertEquals(Main.EXIT_USAGE, run("", "--input=" + dir.resolve("missing.tsv")));
        assertTrue(err().contains("cannot read input"));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(Main.EXIT_OK, run("", "--help"));
        assertTrue(out().startsWith("usage:"));
    }
}
