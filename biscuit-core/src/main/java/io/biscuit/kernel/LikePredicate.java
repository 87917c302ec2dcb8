package io.biscuit.kernel;

/**
 * Scan-time predicate on one indexed column: {@code column [NOT] [I]LIKE pattern}.
 */
public record LikePredicate(String column, Operator operator, String pattern) {

    public enum Operator {
        LIKE(false, true),
        NOT_LIKE(true, true),
        ILIKE(false, false),
        NOT_ILIKE(true, false);

        private final boolean negated;
        private final boolean caseSensitive;

        Operator(boolean negated, boolean caseSensitive) {
            this.negated = negated;
            this.caseSensitive = caseSensitive;
        }

        public boolean negated() {
            return negated;
        }

        public boolean caseSensitive() {
            return caseSensitive;
        }
    }

    public LikePredicate {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column required");
        }
        if (operator == null) {
            throw new IllegalArgumentException("operator required");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("pattern required");
        }
    }

    public static LikePredicate like(String column, String pattern) {
        return new LikePredicate(column, Operator.LIKE, pattern);
    }

    public static LikePredicate notLike(String column, String pattern) {
        return new LikePredicate(column, Operator.NOT_LIKE, pattern);
    }

    public static LikePredicate ilike(String column, String pattern) {
        return new LikePredicate(column, Operator.ILIKE, pattern);
    }

    public static LikePredicate notIlike(String column, String pattern) {
        return new LikePredicate(column, Operator.NOT_ILIKE, pattern);
    }

    @Override
    public String toString() {
        return column + " " + operator.name().replace('_', ' ') + " '" + pattern + "'";
    }
}
