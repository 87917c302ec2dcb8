package io.biscuit.benchmarks;

import io.biscuit.kernel.IndexRecord;
import io.biscuit.kernel.LikePredicate;
import io.biscuit.kernel.RecordLocator;
import io.biscuit.runtime.BiscuitIndex;
import io.biscuit.runtime.QueryOptions;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * LIKE evaluation per pattern shape, plus ordered materialization.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class LikePatternBenchmark {

    @Param({"10000", "100000", "1000000"})
    public int rowCount;

    private BiscuitIndex index;

    @Setup(Level.Trial)
    public void setup() {
        index = BiscuitIndex.create(List.of("name", "email"));
        var records = new ArrayList<IndexRecord>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            var name = generateName(i);
            records.add(IndexRecord.of(RecordLocator.of(i / 100, i % 100), name,
                    name.toLowerCase(Locale.ROOT) + "@example" + (i % 7) + ".com"));
        }
        index.build(records);
    }

    private String generateName(int index) {
        String[] prefixes = {"Alice", "Bob", "Charlie", "David", "Emma", "Frank", "Grace", "Henry"};
        String[] suffixes = {"Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis"};

        String prefix = prefixes[index % prefixes.length];
        String suffix = suffixes[(index / prefixes.length) % suffixes.length];
        return prefix + suffix + index;
    }

    @Benchmark
    public long prefix() {
        return index.count(List.of(LikePredicate.like("name", "Grace%")));
    }

    @Benchmark
    public long suffix() {
        return index.count(List.of(LikePredicate.like("email", "%@example3.com")));
    }

    @Benchmark
    public long substring() {
        return index.count(List.of(LikePredicate.like("name", "%Jones%")));
    }

    @Benchmark
    public long complex() {
        return index.count(List.of(LikePredicate.ilike("name", "%a%s%1_")));
    }

    @Benchmark
    public long multiColumnWithNegation() {
        return index.count(List.of(
                LikePredicate.like("name", "Emma%"),
                LikePredicate.notLike("email", "%example0%")));
    }

    @Benchmark
    public void orderedMaterialization(Blackhole blackhole) {
        var cursor = index.query(List.of(LikePredicate.like("name", "%a%")), QueryOptions.ordered());
        while (cursor.hasNext()) {
            blackhole.consume(cursor.next());
        }
    }
}
