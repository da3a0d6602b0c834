package model.migrate.tree;

import java.util.List;

import model.migrate.error.StructuralException;
import model.migrate.predicate.Predicate;
import model.migrate.predicate.PredicateAlgebra;

/**
 * Rewrites an old-form tree into the new single-predicate form.
 * All-or-nothing: any failure propagates and no partial tree is returned.
 * Holds no mutable state, so one instance can serve several threads.
 */
public class TreeMigrator {
    private final boolean strictComplement;

    public TreeMigrator() {
        this(false);
    }

    /**
     * @param strictComplement also require the two branch predicates to share
     *                         their comparison value, not only complementary operators
     */
    public TreeMigrator(boolean strictComplement) {
        this.strictComplement = strictComplement;
    }

    public Node migrate(LegacyNode node) {
        if (node instanceof LegacyNode.Leaf leaf) {
            return new Node.Leaf(leaf.payload());
        }
        if (node instanceof LegacyNode.Split split) {
            return migrateSplit(split);
        }
        throw new IllegalArgumentException("Unknown node type: " + (node == null ? "null" : node.getClass().getName()));
    }

    private Node migrateSplit(LegacyNode.Split split) {
        List<LegacyBranch> branches = split.branches();
        if (branches.size() != 2) throw new StructuralException(StructuralException.NOT_BINARY);
        LegacyBranch left = branches.get(0);
        LegacyBranch right = branches.get(1);

        String feature = left.feature();
        if (!feature.equals(right.feature())) throw new StructuralException(StructuralException.DIFFERENT_FEATURE);

        Predicate predicate = PredicateAlgebra.translate(left.predicate());
        Predicate otherwise = PredicateAlgebra.translate(right.predicate());
        boolean complementary = strictComplement
            ? PredicateAlgebra.isStrictComplement(predicate, otherwise)
            : PredicateAlgebra.isComplement(predicate, otherwise);
        if (!complementary) throw new StructuralException(StructuralException.NOT_UNIFIABLE);

        return new Node.Split(feature, predicate, migrate(left.children()), migrate(right.children()));
    }
}
