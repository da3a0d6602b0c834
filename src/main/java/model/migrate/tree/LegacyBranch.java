package model.migrate.tree;

import model.migrate.predicate.LegacyPredicate;

// One side of an old split: "if predicate(feature) then children".
public record LegacyBranch(String feature, LegacyPredicate predicate, LegacyNode children) {}
