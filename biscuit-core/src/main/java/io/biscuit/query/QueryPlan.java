package io.biscuit.query;

import io.biscuit.kernel.LikePredicate;

import java.util.List;
import java.util.Locale;

/**
 * Predicates of one query in evaluation order, most selective first.
 */
public record QueryPlan(List<Step> steps) {

    public QueryPlan {
        steps = List.copyOf(steps);
    }

    /**
     * One compiled predicate with its selectivity score.
     *
     * @param ordinal   position of the predicate in the caller's list
     * @param predicate the predicate as written
     * @param pattern   its compiled pattern
     * @param score     estimated selectivity; lower runs first
     */
    public record Step(int ordinal, LikePredicate predicate, CompiledPattern pattern, double score) {
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * One-line rendering used in plan traces.
     */
    public String describe() {
        var sb = new StringBuilder();
        for (var i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            if (i > 0) {
                sb.append(" -> ");
            }
            sb.append('[').append(step.ordinal()).append("] ")
                    .append(step.predicate())
                    .append(" (").append(step.pattern().shape())
                    .append(String.format(Locale.ROOT, ", score=%.3f)", step.score()));
        }
        return sb.toString();
    }
}
