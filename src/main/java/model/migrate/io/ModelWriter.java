package model.migrate.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import model.migrate.predicate.Predicate;
import model.migrate.tree.Node;

/**
 * Serializes new-form trees. Splits become {"key", "predicate", "left", "right"};
 * leaf payloads are written back exactly as read.
 */
public class ModelWriter {
    // Nulls kept so leaf payloads survive unchanged; HTML escaping off for readable feature names.
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

    public String write(Node node) {
        return gson.toJson(toJson(node));
    }

    public JsonElement toJson(Node node) {
        if (node instanceof Node.Leaf leaf) {
            return leaf.payload();
        }
        if (node instanceof Node.Split split) {
            JsonObject obj = new JsonObject();
            obj.addProperty("key", split.key());
            obj.add("predicate", toJson(split.predicate()));
            obj.add("left", toJson(split.left()));
            obj.add("right", toJson(split.right()));
            return obj;
        }
        throw new IllegalArgumentException("Unknown node type: " + (node == null ? "null" : node.getClass().getName()));
    }

    public JsonElement toJson(Predicate predicate) {
        JsonObject obj = new JsonObject();
        obj.add(predicate.op().tag(), predicate.value());
        return obj;
    }
}
