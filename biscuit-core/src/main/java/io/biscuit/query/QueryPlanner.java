package io.biscuit.query;

import io.biscuit.core.InvalidPatternException;
import io.biscuit.index.PositionalBitmapStore;
import io.biscuit.kernel.LikePredicate;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders and evaluates a conjunction of LIKE predicates over several columns.
 * <p>
 * Every predicate is compiled before any bitmap work, so a malformed pattern fails
 * the whole query without a partial result. Predicates then run in ascending
 * {@link #score(CompiledPattern) score} order; the caller's order breaks ties.
 * <p>
 * Each predicate is evaluated against its own universe, the running candidates that
 * hold a non-null value in the predicate's column. A negated predicate is inverted
 * within that universe before it is combined with the others, so evaluation order
 * never changes the result.
 */
public final class QueryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    private static final Comparator<QueryPlan.Step> EVALUATION_ORDER =
            Comparator.comparingDouble(QueryPlan.Step::score).thenComparingInt(QueryPlan.Step::ordinal);

    private final Map<String, PositionalBitmapStore> stores;

    public QueryPlanner(Map<String, PositionalBitmapStore> stores) {
        if (stores == null) {
            throw new IllegalArgumentException("stores required");
        }
        this.stores = stores;
    }

    /**
     * Selectivity estimate; lower means fewer expected matches.
     * <pre>
     * 1/(concreteChars+1) - 0.05*underscoreCount + 0.15*literalCount - anchorStrength/200
     * </pre>
     */
    public static double score(CompiledPattern pattern) {
        var anchorStrength = (pattern.anchoredStart() ? 1 : 0) + (pattern.anchoredEnd() ? 1 : 0);
        return 1.0 / (pattern.concreteChars() + 1)
                - 0.05 * pattern.underscoreCount()
                + 0.15 * pattern.literalCount()
                - anchorStrength / 200.0;
    }

    /**
     * Compile and order {@code predicates}.
     *
     * @throws IllegalArgumentException if a predicate names an unknown column
     * @throws InvalidPatternException if a pattern is malformed
     */
    public QueryPlan plan(List<LikePredicate> predicates) {
        if (predicates == null) {
            throw new IllegalArgumentException("predicates required");
        }
        var steps = new ArrayList<QueryPlan.Step>(predicates.size());
        for (var i = 0; i < predicates.size(); i++) {
            var predicate = predicates.get(i);
            if (predicate == null) {
                throw new IllegalArgumentException("predicate " + i + " is null");
            }
            if (!stores.containsKey(predicate.column())) {
                throw new IllegalArgumentException("unknown column: " + predicate.column());
            }
            CompiledPattern pattern;
            try {
                pattern = PatternCompiler.compile(predicate.pattern(), predicate.operator().caseSensitive());
            } catch (InvalidPatternException e) {
                logger.warn("Rejected query on {}: {}", predicate.column(), e.getMessage());
                throw e;
            }
            steps.add(new QueryPlan.Step(i, predicate, pattern, score(pattern)));
        }
        steps.sort(EVALUATION_ORDER);
        var plan = new QueryPlan(steps);
        if (logger.isDebugEnabled() && !plan.isEmpty()) {
            logger.debug("Query plan: {}", plan.describe());
        }
        return plan;
    }

    /**
     * Evaluate {@code plan} against the {@code live} slots.
     *
     * @return a new bitmap of matching live slots
     */
    public RoaringBitmap execute(QueryPlan plan, RoaringBitmap live) {
        var running = live.clone();
        for (var step : plan.steps()) {
            if (running.isEmpty()) {
                logger.debug("Candidates exhausted before {}", step.predicate());
                break;
            }
            var store = stores.get(step.predicate().column());
            var universe = RoaringBitmap.and(running, store.nonNull());
            var matched = PatternMatcher.evaluate(step.pattern(), store, universe);
            running = step.predicate().operator().negated()
                    ? PatternMatcher.negate(matched, universe)
                    : matched;
            if (logger.isDebugEnabled()) {
                logger.debug("{} -> {} candidates", step.predicate(), running.getLongCardinality());
            }
        }
        return running;
    }

    /**
     * {@link #plan(List)} followed by {@link #execute(QueryPlan, RoaringBitmap)}.
     */
    public RoaringBitmap evaluate(List<LikePredicate> predicates, RoaringBitmap live) {
        return execute(plan(predicates), live);
    }
}
