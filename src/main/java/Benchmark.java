import automaton.Automaton;
import datagenerators.GeneWorkloadGenerator;
import health.BatchRunner;
import health.HealthConfiguration;
import health.HealthRange;
import health.Query;
import search.BruteForceScanner;
import search.Gene;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Times the automaton against the brute-force scanner on a generated workload and checks that
 * both report the same (min, max).
 *
 * <p>Options: {@code --seed N --genes N --strands N --length N --threads N}.
 */
public final class Benchmark {

    public static void main(String[] args) {
        long seed = 42L;
        int geneCount = 2_000;
        int strandCount = 200;
        int strandLength = 2_000;
        int threads = Runtime.getRuntime().availableProcessors();

        for (int i = 0; i < args.length; i += 2) {
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for option " + args[i]);
            }
            String value = args[i + 1];
            switch (args[i]) {
                case "--seed" -> seed = Long.parseLong(value);
                case "--genes" -> geneCount = Integer.parseInt(value);
                case "--strands" -> strandCount = Integer.parseInt(value);
                case "--length" -> strandLength = Integer.parseInt(value);
                case "--threads" -> threads = Integer.parseInt(value);
                default -> throw new IllegalArgumentException("Unknown option " + args[i]);
            }
        }

        GeneWorkloadGenerator generator = new GeneWorkloadGenerator(seed);
        List<String> genes = generator.genes(geneCount, 1, 8, GeneWorkloadGenerator.DNA);
        long[] weights = generator.weights(geneCount, 0, 10_000_000L);
        List<Query> queries = new ArrayList<>(generator.queries(strandCount, genes, strandLength, GeneWorkloadGenerator.DNA));
        // Skewed strand over the full range: frequent symbols mean long failure chains.
        queries.add(new Query(0, geneCount - 1, generator.zipf(strandLength, GeneWorkloadGenerator.DNA, 1.2)));

        long t0 = System.nanoTime();
        Automaton automaton = Automaton.build(genes, weights);
        long buildNanos = System.nanoTime() - t0;

        HealthConfiguration configuration = HealthConfiguration.builder()
                .parallelism(threads)
                .chunkSize(Math.max(1, queries.size() / (threads * 4)))
                .build();
        t0 = System.nanoTime();
        HealthRange fast = new BatchRunner(configuration).run(automaton, queries);
        long automatonNanos = System.nanoTime() - t0;

        List<Gene> dictionary = Gene.of(genes, weights);
        t0 = System.nanoTime();
        HealthRange naive = HealthRange.empty();
        for (Query q : queries) {
            naive = naive.accept(BruteForceScanner.health(dictionary, q.start(), q.end(), q.text()));
        }
        long naiveNanos = System.nanoTime() - t0;

        System.out.println("Automaton: " + automaton);
        System.out.printf(Locale.ROOT, "Build: %.3f ms%n", buildNanos / 1e6);
        System.out.printf(Locale.ROOT, "Aho-Corasick (%d threads): %.3f ms -> %s%n", threads, automatonNanos / 1e6, fast.format());
        System.out.printf(Locale.ROOT, "Brute force: %.3f ms -> %s%n", naiveNanos / 1e6, naive.format());
        if (automatonNanos > 0) {
            System.out.printf(Locale.ROOT, "Speed-up: %.2fx%n", naiveNanos / (double) automatonNanos);
        }
        if (!fast.format().equals(naive.format())) {
            throw new IllegalStateException("Automaton and brute force disagree");
        }
    }
}
