package model.migrate.tree;

import java.util.List;
import java.util.Objects;

import com.google.gson.JsonElement;

/**
 * Old-form tree node. The shape is decided once when the model is read:
 * a split carries its branches as found in the input (binary or not),
 * anything else is an opaque leaf payload.
 */
public interface LegacyNode {

    record Leaf(JsonElement payload) implements LegacyNode {
        public Leaf {
            Objects.requireNonNull(payload, "payload");
        }
    }

    record Split(List<LegacyBranch> branches) implements LegacyNode {
        public Split {
            branches = List.copyOf(branches);
        }

        public static Split of(LegacyBranch left, LegacyBranch right) {
            return new Split(List.of(left, right));
        }
    }
}
