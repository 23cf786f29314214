package health;

import automaton.Automaton;
import search.BruteForceScanner;
import search.Gene;
import utilities.HealthLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Evaluates a batch of strands against one automaton and reduces their healths to (min, max).
 *
 * <p>With parallelism above one, the batch is cut into contiguous chunks that run on a fixed pool.
 * Each chunk has its own {@link HealthEvaluator}; only the immutable automaton is shared. Because
 * {@link HealthRange#merge} is order-independent, the result does not depend on scheduling.
 */
public final class BatchRunner {

    private final HealthConfiguration configuration;

    public BatchRunner() {
        this(HealthConfiguration.defaults());
    }

    public BatchRunner(HealthConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public HealthConfiguration configuration() {
        return configuration;
    }

    /** Builds the automaton from the genes, then runs the batch. */
    public HealthRange run(List<String> genes, long[] weights, List<Query> queries) {
        return run(Automaton.build(genes, weights), queries);
    }

    public HealthRange run(Automaton automaton, List<Query> queries) {
        return runDetailed(automaton, queries).range();
    }

    public BatchResult runDetailed(Automaton automaton, List<Query> queries) {
        Objects.requireNonNull(automaton, "automaton");
        Objects.requireNonNull(queries, "queries");
        long start = System.nanoTime();
        long[] healths = configuration.collectPerQuery() ? new long[queries.size()] : null;

        HealthRange range;
        int parallelism = configuration.parallelism();
        if (parallelism <= 1 || queries.size() <= configuration.chunkSize()) {
            range = evaluateChunk(automaton, queries, 0, queries.size(), healths);
        } else {
            range = evaluateParallel(automaton, queries, healths, parallelism);
        }

        long elapsed = System.nanoTime() - start;
        HealthLogger.info("Evaluated " + queries.size() + " strands against " + automaton.geneCount()
                + " genes in " + elapsed / 1_000_000.0 + " ms (threads=" + parallelism + ")");
        return new BatchResult(range, healths == null ? new long[0] : healths, elapsed);
    }

    // One health per query, in input order.
    public long[] evaluateAll(Automaton automaton, List<Query> queries) {
        long[] healths = new long[queries.size()];
        evaluateChunk(automaton, queries, 0, queries.size(), healths);
        return healths;
    }

    private HealthRange evaluateParallel(Automaton automaton, List<Query> queries, long[] healths, int parallelism) {
        int chunkSize = configuration.chunkSize();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<HealthRange>> partials = new ArrayList<>();
            for (int from = 0; from < queries.size(); from += chunkSize) {
                int lo = from;
                int hi = Math.min(queries.size(), from + chunkSize);
                partials.add(pool.submit(() -> evaluateChunk(automaton, queries, lo, hi, healths)));
            }
            HealthRange range = HealthRange.empty();
            for (Future<HealthRange> partial : partials) {
                range = range.merge(await(partial));
            }
            return range;
        } finally {
            pool.shutdownNow();
        }
    }

    private HealthRange evaluateChunk(Automaton automaton, List<Query> queries, int from, int to, long[] healths) {
        HealthEvaluator evaluator = new HealthEvaluator(automaton);
        HealthRange range = HealthRange.empty();
        for (int i = from; i < to; i++) {
            Query query = queries.get(i);
            long health = evaluator.evaluate(query);
            if (configuration.verify()) {
                verify(automaton.genes(), query, health, i);
            }
            if (healths != null) {
                healths[i] = health;
            }
            range = range.accept(health);
        }
        return range;
    }

    private static void verify(List<Gene> genes, Query query, long health, int queryIndex) {
        long expected = BruteForceScanner.health(genes, query.start(), query.end(), query.text());
        if (expected != health) {
            throw new IllegalStateException("Strand #" + queryIndex + ": automaton health " + health
                    + " differs from brute-force health " + expected);
        }
    }

    private static HealthRange await(Future<HealthRange> partial) {
        try {
            return partial.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for strand evaluation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Strand evaluation failed", cause);
        }
    }
}
