package com.iecore;

import com.iecore.document.EntityOccurrence;
import com.iecore.range.Bounds;
import com.iecore.range.RangeIndexer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 区间定位性能基准：两阶段收缩 vs 两次独立 lowerBound
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class RangeIndexerBenchmark {

    @Param({"1000", "100000"})
    int occurrenceCount;

    /** 查询窗口宽度（token 数） */
    @Param({"20", "2000"})
    int windowTokens;

    List<EntityOccurrence> occurrences;
    int[] queryStarts;
    int cursor;

    @Setup
    public void setup() {
        Random random = new Random(42);
        occurrences = new ArrayList<>(occurrenceCount);
        int offset = 0;
        for (int i = 0; i < occurrenceCount; i++) {
            offset += random.nextInt(8);
            occurrences.add(EntityOccurrence.of("entity-" + (i % 500), offset));
        }
        queryStarts = new int[1024];
        for (int i = 0; i < queryStarts.length; i++) {
            queryStarts[i] = random.nextInt(Math.max(1, offset));
        }
    }

    @Benchmark
    public Bounds twoPhase() {
        int start = queryStarts[cursor++ & (queryStarts.length - 1)];
        return RangeIndexer.findBounds(occurrences, start, start + windowTokens, EntityOccurrence::offset);
    }

    @Benchmark
    public int independentLowerBounds() {
        int start = queryStarts[cursor++ & (queryStarts.length - 1)];
        int left = RangeIndexer.lowerBound(occurrences, start, 0, occurrences.size(), EntityOccurrence::offset);
        int right = RangeIndexer.lowerBound(occurrences, start + windowTokens, left, occurrences.size(), EntityOccurrence::offset);
        return right - left;
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(RangeIndexerBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
