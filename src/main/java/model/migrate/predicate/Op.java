package model.migrate.predicate;

/**
 * New-form comparison operators, each with its serialized tag.
 */
public enum Op {
    IS_EQ("isEq"),
    NOT_EQ("notEq"),
    LT("lt"),
    LT_EQ("ltEq"),
    GT("gt"),
    GT_EQ("gtEq");

    private final String tag;

    Op(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    /** Complement operator. Involutive: {@code op.negate().negate() == op}. */
    public Op negate() {
        return switch (this) {
            case IS_EQ -> NOT_EQ;
            case NOT_EQ -> IS_EQ;
            case LT -> GT_EQ;
            case GT_EQ -> LT;
            case LT_EQ -> GT;
            case GT -> LT_EQ;
        };
    }
}
