package model.migrate.io;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import model.migrate.error.MalformedModelException;

public class RecordLineTest {

    @Test
    void defaultsToLastField() {
        RecordLine r = RecordLine.parse("model-7\t2024\t[1]", RecordLine.LAST_FIELD);
        assertEquals("[1]", r.model());
        assertEquals("model-7\t2024\t{}", r.withModel("{}"));
    }

    @Test
    void selectsFieldByIndex() {
        RecordLine r = RecordLine.parse("id\t\"tree\"\tnote", 1);
        assertEquals("\"tree\"", r.model());
        assertEquals(List.of("id", "\"tree\"", "note"), r.fields());
        assertEquals("id\tX\tnote", r.withModel("X"));
    }

    @Test
    void singleFieldLineIsTheModel() {
        assertEquals("0.5", RecordLine.parse("0.5", RecordLine.LAST_FIELD).model());
        assertEquals("0.5", RecordLine.parse("0.5", 0).model());
    }

    @Test
    void keepsEmptyTrailingFields() {
        RecordLine r = RecordLine.parse("a\tb\t", 1);
        assertEquals(3, r.fields().size());
        assertEquals("a\tc\t", r.withModel("c"));
    }

    @Test
    void missingFieldRejected() {
        assertThrows(MalformedModelException.class, () -> RecordLine.parse("a\tb", 2));
    }
}
