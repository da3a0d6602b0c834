package model.migrate.predicate;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

/**
 * Old-form predicate. Leaf kinds (EQ, LT, UNKNOWN) carry a value;
 * NOT wraps exactly one operand and OR an ordered list of operands.
 * UNKNOWN keeps the raw operator tag (e.g. "exists") so translation can name it.
 */
public final class LegacyPredicate {
    public enum Kind { EQ, LT, NOT, OR, UNKNOWN }

    private final Kind kind;
    private final String tag;
    private final JsonElement value;               // leaf kinds only
    private final List<LegacyPredicate> operands;  // NOT: size == 1, OR: any size

    private LegacyPredicate(Kind kind, String tag, JsonElement value, List<LegacyPredicate> operands) {
        if (kind == Kind.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("not requires exactly one operand");
        }
        this.kind = kind;
        this.tag = tag;
        this.value = value;
        this.operands = operands;
    }

    public static LegacyPredicate eq(JsonElement value) {
        return new LegacyPredicate(Kind.EQ, "eq", Objects.requireNonNull(value), List.of());
    }

    public static LegacyPredicate eq(Number value) { return eq(new JsonPrimitive(value)); }

    public static LegacyPredicate eq(String value) { return eq(new JsonPrimitive(value)); }

    public static LegacyPredicate lt(JsonElement value) {
        return new LegacyPredicate(Kind.LT, "lt", Objects.requireNonNull(value), List.of());
    }

    public static LegacyPredicate lt(Number value) { return lt(new JsonPrimitive(value)); }

    public static LegacyPredicate not(LegacyPredicate operand) {
        return new LegacyPredicate(Kind.NOT, "not", null, List.of(operand));
    }

    public static LegacyPredicate or(LegacyPredicate... operands) {
        return or(Arrays.asList(operands));
    }

    public static LegacyPredicate or(List<LegacyPredicate> operands) {
        return new LegacyPredicate(Kind.OR, "or", null, List.copyOf(operands));
    }

    /** Any operator outside eq/lt/not/or, such as exists. */
    public static LegacyPredicate unknown(String tag, JsonElement value) {
        return new LegacyPredicate(Kind.UNKNOWN, tag, value, List.of());
    }

    public Kind kind() { return kind; }
    public String tag() { return tag; }
    public JsonElement value() { return value; }
    public List<LegacyPredicate> operands() { return operands; }

    public LegacyPredicate operand() {
        if (kind != Kind.NOT) throw new IllegalStateException("operand() is only defined for not, got " + tag);
        return operands.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LegacyPredicate other)) return false;
        return kind == other.kind && tag.equals(other.tag)
            && Objects.equals(value, other.value) && operands.equals(other.operands);
    }

    @Override
    public int hashCode() { return Objects.hash(kind, tag, value, operands); }

    // For debugging
    @Override
    public String toString() {
        return switch (kind) {
            case NOT -> "{not: " + operands.get(0) + "}";
            case OR -> "{or: " + operands + "}";
            default -> "{" + tag + ": " + value + "}";
        };
    }
}
