package model.migrate.predicate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import model.migrate.error.IncompatiblePredicatesException;
import model.migrate.error.UnsupportedPredicateException;

/**
 * Negation, union and complement checks over new-form predicates, plus
 * translation of old-form predicates into the new vocabulary.
 * Stateless; the union table is constant data built once.
 */
public final class PredicateAlgebra {
    private PredicateAlgebra() {}

    // (lhs, rhs) -> result; both operands must carry the same value.
    private static final Map<Op, Map<Op, Op>> UNION = buildUnionTable();

    private static Map<Op, Map<Op, Op>> buildUnionTable() {
        Map<Op, Map<Op, Op>> table = new EnumMap<>(Op.class);
        // same direction
        put(table, Op.LT, Op.LT, Op.LT);
        put(table, Op.GT, Op.GT, Op.GT);
        put(table, Op.IS_EQ, Op.IS_EQ, Op.IS_EQ);
        put(table, Op.NOT_EQ, Op.NOT_EQ, Op.NOT_EQ);
        // strict widened by non-strict
        putSymmetric(table, Op.LT, Op.LT_EQ, Op.LT_EQ);
        putSymmetric(table, Op.GT, Op.GT_EQ, Op.GT_EQ);
        // open ray plus its boundary point
        putSymmetric(table, Op.LT, Op.IS_EQ, Op.LT_EQ);
        putSymmetric(table, Op.GT, Op.IS_EQ, Op.GT_EQ);

        Map<Op, Map<Op, Op>> frozen = new EnumMap<>(Op.class);
        for (Map.Entry<Op, Map<Op, Op>> e : table.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableMap(e.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }

    private static void put(Map<Op, Map<Op, Op>> table, Op lhs, Op rhs, Op result) {
        table.computeIfAbsent(lhs, k -> new EnumMap<>(Op.class)).put(rhs, result);
    }

    private static void putSymmetric(Map<Op, Map<Op, Op>> table, Op a, Op b, Op result) {
        put(table, a, b, result);
        put(table, b, a, result);
    }

    /**
     * Translates a bare eq/lt predicate. Composite or unknown operators fail.
     */
    public static Predicate translateLeaf(LegacyPredicate old) {
        return switch (old.kind()) {
            case EQ -> new Predicate(Op.IS_EQ, old.value());
            case LT -> new Predicate(Op.LT, old.value());
            default -> throw new UnsupportedPredicateException(old.tag());
        };
    }

    public static Predicate negate(Predicate p) {
        return new Predicate(p.op().negate(), p.value());
    }

    /**
     * Least predicate true whenever either operand is true, for the operator
     * pairs that have a single-predicate form. Requires equal values.
     *
     * @throws IncompatiblePredicatesException for any other combination
     */
    public static Predicate union(Predicate lhs, Predicate rhs) {
        if (!lhs.sameValue(rhs)) throw new IncompatiblePredicatesException();
        Op result = UNION.getOrDefault(lhs.op(), Map.of()).get(rhs.op());
        if (result == null) throw new IncompatiblePredicatesException();
        return new Predicate(result, lhs.value());
    }

    /**
     * True iff the negation of {@code lhs} has the operator of {@code rhs}.
     * Values are not compared; see {@link #isStrictComplement}.
     */
    public static boolean isComplement(Predicate lhs, Predicate rhs) {
        return lhs.op().negate() == rhs.op();
    }

    /** Like {@link #isComplement} but also requires equal comparison values. */
    public static boolean isStrictComplement(Predicate lhs, Predicate rhs) {
        return isComplement(lhs, rhs) && lhs.sameValue(rhs);
    }

    /**
     * Translates any old-form predicate. not negates its translated operand;
     * or folds its translated operands left to right through {@link #union}.
     */
    public static Predicate translate(LegacyPredicate old) {
        return switch (old.kind()) {
            case EQ, LT -> translateLeaf(old);
            case NOT -> negate(translate(old.operand()));
            case OR -> fold(old.operands());
            case UNKNOWN -> throw new UnsupportedPredicateException(old.tag());
        };
    }

    private static Predicate fold(List<LegacyPredicate> operands) {
        // or over nothing has no closed form
        if (operands.isEmpty()) throw new IncompatiblePredicatesException();
        Predicate acc = translate(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            acc = union(acc, translate(operands.get(i)));
        }
        return acc;
    }
}
