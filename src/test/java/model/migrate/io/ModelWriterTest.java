package model.migrate.io;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import model.migrate.predicate.Op;
import model.migrate.predicate.Predicate;
import model.migrate.tree.Node;
import model.migrate.tree.TreeMigrator;

public class ModelWriterTest {

    private final ModelWriter writer = new ModelWriter();

    @Test
    void writesSplitMembersInOrder() {
        Node node = new Node.Split("x", Predicate.of(Op.LT, 3),
            new Node.Leaf(new JsonPrimitive("A")), new Node.Leaf(new JsonPrimitive("B")));
        assertEquals("{\"key\":\"x\",\"predicate\":{\"lt\":3},\"left\":\"A\",\"right\":\"B\"}", writer.write(node));
    }

    @Test
    void leafPayloadWrittenVerbatim() {
        String payload = "{\"value\":1.50,\"label\":null,\"tags\":[\"<a>\",2]}";
        Node leaf = new Node.Leaf(JsonParser.parseString(payload));
        assertEquals(payload, writer.write(leaf));
    }

    @Test
    void readMigrateWriteExample() {
        String old = "[{\"feature\":\"x\",\"predicate\":{\"lt\":3},\"children\":\"A\"},"
            + "{\"feature\":\"x\",\"predicate\":{\"not\":{\"lt\":3}},\"children\":\"B\"}]";
        Node migrated = new TreeMigrator().migrate(new LegacyModelReader().read(old));
        assertEquals("{\"key\":\"x\",\"predicate\":{\"lt\":3},\"left\":\"A\",\"right\":\"B\"}", writer.write(migrated));
    }

    @Test
    void nestedSplitUsesNewOperatorTags() {
        String old = "[{\"feature\":\"age\",\"predicate\":{\"or\":[{\"lt\":18},{\"eq\":18}]},\"children\":"
            + "[{\"feature\":\"city\",\"predicate\":{\"not\":{\"eq\":\"Oslo\"}},\"children\":-0.5},"
            + "{\"feature\":\"city\",\"predicate\":{\"eq\":\"Oslo\"},\"children\":0.25}]},"
            + "{\"feature\":\"age\",\"predicate\":{\"not\":{\"or\":[{\"lt\":18},{\"eq\":18}]}},\"children\":1}]";
        Node migrated = new TreeMigrator().migrate(new LegacyModelReader().read(old));
        assertEquals("{\"key\":\"age\",\"predicate\":{\"ltEq\":18},"
            + "\"left\":{\"key\":\"city\",\"predicate\":{\"notEq\":\"Oslo\"},\"left\":-0.5,\"right\":0.25},"
            + "\"right\":1}", writer.write(migrated));
    }
}
