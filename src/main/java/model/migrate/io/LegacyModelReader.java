package model.migrate.io;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import model.migrate.error.MalformedModelException;
import model.migrate.predicate.LegacyPredicate;
import model.migrate.tree.LegacyBranch;
import model.migrate.tree.LegacyNode;

/**
 * Reads old-form model JSON into {@link LegacyNode} trees.
 *
 * Shape rules:
 *   split  = array holding at least one object with "feature" or "predicate";
 *            every element must then be a complete branch
 *   leaf   = any other JSON value, kept verbatim
 *   branch = {"feature": string, "predicate": old predicate, "children": node}
 *   old predicate = object with exactly one operator key: eq, lt, not, or, or anything else (unknown)
 */
public class LegacyModelReader {
    public static final int DEFAULT_MAX_DEPTH = 1_000;

    private final int maxDepth;

    public LegacyModelReader() {
        this(DEFAULT_MAX_DEPTH);
    }

    public LegacyModelReader(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.maxDepth = maxDepth;
    }

    /**
     * Parses strict JSON. Raw nesting (leaf payloads included) is capped at
     * {@link #nestingLimit()} before any tree is built.
     */
    public LegacyNode read(String json) {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        if (json.isBlank()) throw new MalformedModelException("empty model");
        checkSyntaxAndNesting(json);
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new MalformedModelException("invalid model JSON: " + e.getMessage(), e);
        }
        return readNode(root);
    }

    /**
     * JSON nesting allowed for a model: each split level takes two levels
     * (array and branch object) and a predicate may take two more per level.
     */
    public int nestingLimit() {
        return 4 * maxDepth + 4;
    }

    private void checkSyntaxAndNesting(String json) {
        int limit = nestingLimit();
        try (JsonReader in = new JsonReader(new StringReader(json))) {
            in.setLenient(false);
            int depth = 0;
            while (true) {
                JsonToken token = in.peek();
                switch (token) {
                    case BEGIN_ARRAY -> { in.beginArray(); depth = enter(depth, limit); }
                    case BEGIN_OBJECT -> { in.beginObject(); depth = enter(depth, limit); }
                    case END_ARRAY -> { in.endArray(); depth--; }
                    case END_OBJECT -> { in.endObject(); depth--; }
                    case NAME -> in.nextName();
                    case END_DOCUMENT -> { return; }
                    default -> in.skipValue();
                }
            }
        } catch (IOException e) {
            throw new MalformedModelException("invalid model JSON: " + e.getMessage(), e);
        }
    }

    private static int enter(int depth, int limit) {
        if (depth + 1 > limit) throw new MalformedModelException("model JSON nested deeper than " + limit + " levels");
        return depth + 1;
    }

    public LegacyNode readNode(JsonElement element) {
        return node(element, 0);
    }

    public LegacyPredicate readPredicate(JsonElement element) {
        return predicate(element, 0);
    }

    private LegacyNode node(JsonElement element, int depth) {
        if (!isSplit(element)) return new LegacyNode.Leaf(element);
        checkDepth(depth);
        JsonArray array = element.getAsJsonArray();
        List<LegacyBranch> branches = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            if (!e.isJsonObject()) throw new MalformedModelException("split branch must be an object: " + e);
            branches.add(branch(e.getAsJsonObject(), depth));
        }
        return new LegacyNode.Split(branches);
    }

    private static boolean isSplit(JsonElement element) {
        if (!element.isJsonArray()) return false;
        JsonArray array = element.getAsJsonArray();
        for (JsonElement e : array) {
            if (!e.isJsonObject()) continue;
            JsonObject o = e.getAsJsonObject();
            if (o.has("feature") || o.has("predicate")) return true;
        }
        return false;
    }

    private LegacyBranch branch(JsonObject obj, int depth) {
        JsonElement featureElem = obj.get("feature");
        if (featureElem == null) throw new MalformedModelException("branch has no feature: " + obj);
        if (!featureElem.isJsonPrimitive() || !featureElem.getAsJsonPrimitive().isString()) {
            throw new MalformedModelException("branch feature must be a string: " + featureElem);
        }
        JsonElement predicateElem = obj.get("predicate");
        if (predicateElem == null) {
            throw new MalformedModelException("branch on feature '" + featureElem.getAsString() + "' has no predicate");
        }
        JsonElement childrenElem = obj.get("children");
        if (childrenElem == null) {
            throw new MalformedModelException("branch on feature '" + featureElem.getAsString() + "' has no children");
        }
        // predicate nesting is bounded on its own, independent of split depth
        LegacyPredicate predicate = predicate(predicateElem, 0);
        return new LegacyBranch(featureElem.getAsString(), predicate, node(childrenElem, depth + 1));
    }

    private LegacyPredicate predicate(JsonElement element, int depth) {
        checkDepth(depth);
        if (!element.isJsonObject()) {
            throw new MalformedModelException("predicate must be an object: " + element);
        }
        JsonObject obj = element.getAsJsonObject();
        if (obj.size() != 1) {
            throw new MalformedModelException("predicate must have exactly one operator, got " + obj.size() + ": " + obj);
        }
        Map.Entry<String, JsonElement> entry = obj.entrySet().iterator().next();
        String tag = entry.getKey();
        JsonElement value = entry.getValue();
        return switch (tag) {
            case "eq" -> LegacyPredicate.eq(value);
            case "lt" -> LegacyPredicate.lt(value);
            case "not" -> {
                if (!value.isJsonObject()) throw new MalformedModelException("not expects a predicate object: " + value);
                yield LegacyPredicate.not(predicate(value, depth + 1));
            }
            case "or" -> {
                if (!value.isJsonArray()) throw new MalformedModelException("or expects an array of predicates: " + value);
                List<LegacyPredicate> operands = new ArrayList<>();
                for (JsonElement e : value.getAsJsonArray()) operands.add(predicate(e, depth + 1));
                yield LegacyPredicate.or(operands);
            }
            default -> LegacyPredicate.unknown(tag, value);
        };
    }

    private void checkDepth(int depth) {
        if (depth >= maxDepth) throw new MalformedModelException("tree exceeds maximum depth of " + maxDepth);
    }
}
