package com.entity.linker.benchmark;

import com.entity.linker.blocking.Blocker;
import com.entity.linker.blocking.BlockingResult;
import com.entity.linker.blocking.FirstTokenBlockingKeyStrategy;
import com.entity.linker.blocking.TokenIndexBlockingFunction;
import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.Entity;
import com.entity.linker.features.FeatureExtractor;
import com.entity.linker.features.FeatureSets;
import com.entity.linker.features.OccupationHierarchy;
import com.entity.linker.normalization.EntityNormalizer;
import com.entity.linker.normalization.Tokenizer;
import com.entity.linker.parallel.WorkerPool;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks of candidate generation and feature extraction at different
 * collection sizes, sequential and on a worker pool.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class BlockingBenchmark {

    private static final String[] FIRST_NAMES = {
            "anna", "boris", "clara", "dmitri", "elena", "felix", "greta", "hugo", "irene", "jonas"};

    @Param({"1000", "5000"})
    private int entityCount;

    private List<Entity> sources;
    private List<Entity> targets;
    private Blocker firstTokenBlocker;
    private Blocker tokenIndexBlocker;
    private FeatureExtractor extractor;
    private List<CandidatePair> pairs;
    private Map<String, Entity> sourceIndex;
    private Map<String, Entity> targetIndex;
    private WorkerPool pool;

    @Setup(Level.Trial)
    public void setUp() {
        EntityNormalizer normalizer = EntityNormalizer.defaults(Set.of("name"));
        Random random = new Random(1269);
        sources = new ArrayList<>(entityCount);
        targets = new ArrayList<>(entityCount);
        sourceIndex = new HashMap<>();
        targetIndex = new HashMap<>();
        for (int i = 0; i < entityCount; i++) {
            String name = FIRST_NAMES[random.nextInt(FIRST_NAMES.length)] + " Person" + i;
            Entity source = normalizer.normalize(Entity.source("Q" + i).name(name).build());
            Entity target = normalizer.normalize(Entity.target("T" + i).name(name.toUpperCase()).build());
            sources.add(source);
            targets.add(target);
            sourceIndex.put(source.getId(), source);
            targetIndex.put(target.getId(), target);
        }

        firstTokenBlocker = new Blocker(List.of(new FirstTokenBlockingKeyStrategy()), List.of());
        tokenIndexBlocker = new Blocker(List.of(), List.of(new TokenIndexBlockingFunction(targets,
                Tokenizer.defaults(), "name", TokenIndexBlockingFunction.DEFAULT_LIMIT,
                TokenIndexBlockingFunction.DEFAULT_MAX_POSTINGS)));
        extractor = new FeatureExtractor(FeatureSets.defaultSet(OccupationHierarchy.FLAT));
        pool = new WorkerPool(Runtime.getRuntime().availableProcessors());
        pairs = firstTokenBlocker.block(sources, targets).pairs().subList(0, entityCount);
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        pool.close();
    }

    @Benchmark
    public void firstTokenBlocking(Blackhole bh) {
        BlockingResult result = firstTokenBlocker.block(sources, targets);
        bh.consume(result.size());
    }

    @Benchmark
    public void firstTokenBlockingParallel(Blackhole bh) {
        BlockingResult result = firstTokenBlocker.block(sources, targets, pool);
        bh.consume(result.size());
    }

    @Benchmark
    public void tokenIndexBlocking(Blackhole bh) {
        BlockingResult result = tokenIndexBlocker.block(sources, targets);
        bh.consume(result.size());
    }

    /**
     * Default feature set over one candidate per source.
     */
    @Benchmark
    public void featureExtraction(Blackhole bh) {
        bh.consume(extractor.extractAll(pairs, sourceIndex, targetIndex, pool));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(BlockingBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
