package io.biscuit.runtime;

/**
 * How a query's locators are to be delivered.
 *
 * @param needsOrder true to return locators in (block, offset) order
 * @param limit      maximum number of locators, or {@link #NO_LIMIT}
 */
public record QueryOptions(boolean needsOrder, int limit) {

    public static final int NO_LIMIT = -1;

    private static final QueryOptions ORDERED = new QueryOptions(true, NO_LIMIT);
    private static final QueryOptions UNORDERED = new QueryOptions(false, NO_LIMIT);

    public QueryOptions {
        if (limit < NO_LIMIT) {
            throw new IllegalArgumentException("limit must be non-negative or NO_LIMIT: " + limit);
        }
    }

    public static QueryOptions ordered() {
        return ORDERED;
    }

    public static QueryOptions unordered() {
        return UNORDERED;
    }

    public QueryOptions withLimit(int limit) {
        return new QueryOptions(needsOrder, limit);
    }

    public boolean hasLimit() {
        return limit != NO_LIMIT;
    }
}
