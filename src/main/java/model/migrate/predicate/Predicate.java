package model.migrate.predicate;

import java.util.Objects;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

/**
 * New-form predicate: one operator applied to one comparison value.
 * The value is kept as parsed so it is written back verbatim.
 */
public record Predicate(Op op, JsonElement value) {
    public Predicate {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(value, "value");
    }

    public static Predicate of(Op op, Number value) { return new Predicate(op, new JsonPrimitive(value)); }
    public static Predicate of(Op op, String value) { return new Predicate(op, new JsonPrimitive(value)); }

    /**
     * Value equality. Numbers compare exactly as decimals, so 3 equals 3.0
     * but adjacent integers beyond double precision stay distinct.
     */
    public boolean sameValue(Predicate other) {
        if (isNumber(value) && isNumber(other.value)) {
            return value.getAsBigDecimal().compareTo(other.value.getAsBigDecimal()) == 0;
        }
        return value.equals(other.value);
    }

    private static boolean isNumber(JsonElement e) {
        return e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber();
    }

    @Override
    public String toString() { return "{" + op.tag() + ": " + value + "}"; }
}
