package model.migrate.tree;

import java.util.Objects;

import com.google.gson.JsonElement;

import model.migrate.predicate.Predicate;

/**
 * New-form tree node: an opaque leaf, or a split whose predicate guards
 * the left child with the right child as the implicit else branch.
 */
public interface Node {

    record Leaf(JsonElement payload) implements Node {
        public Leaf {
            Objects.requireNonNull(payload, "payload");
        }
    }

    record Split(String key, Predicate predicate, Node left, Node right) implements Node {}
}
