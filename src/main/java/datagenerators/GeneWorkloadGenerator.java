package datagenerators;

import health.Query;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeded random gene sets and strands for benchmarks and randomized tests. Two generators built
 * with the same seed produce the same workload as long as the calls are made in the same order.
 */
public class GeneWorkloadGenerator {

    public static final char[] DNA = "acgt".toCharArray();
    public static final char[] LOWER = "abcdefghijklmnopqrstuvwxyz".toCharArray();

    private final RandomGenerator rng;

    public GeneWorkloadGenerator(long seed) {
        this.rng = new Well19937c(seed);
    }

    public List<String> genes(int count, int minLength, int maxLength, char[] alphabet) {
        if (minLength <= 0 || maxLength < minLength) {
            throw new IllegalArgumentException("need 0 < minLength <= maxLength");
        }
        checkAlphabet(alphabet);
        List<String> genes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int length = minLength + rng.nextInt(maxLength - minLength + 1);
            genes.add(uniform(length, alphabet));
        }
        return genes;
    }

    // Uniform weights in [min, max].
    public long[] weights(int count, long min, long max) {
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min");
        }
        long span = max - min + 1;
        long[] weights = new long[count];
        for (int i = 0; i < count; i++) {
            weights[i] = min + (long) Math.floor(rng.nextDouble() * span);
        }
        return weights;
    }

    public String uniform(int length, char[] alphabet) {
        checkAlphabet(alphabet);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet[rng.nextInt(alphabet.length)];
        }
        return new String(chars);
    }

    /**
     * Strand whose symbol frequencies follow a Zipf law over the alphabet: {@code alphabet[0]} is
     * the most frequent symbol.
     */
    public String zipf(int length, char[] alphabet, double exponent) {
        checkAlphabet(alphabet);
        // ZipfDistribution samples in [1, alphabet.length]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabet.length, exponent);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet[dist.sample() - 1];
        }
        return new String(chars);
    }

    /**
     * Queries with random valid ranges over {@code geneCount} genes. Each strand is made of
     * randomly picked genes glued together with random filler, so matches are plentiful.
     */
    public List<Query> queries(int count, List<String> genes, int strandLength, char[] alphabet) {
        if (genes.isEmpty()) {
            throw new IllegalArgumentException("genes must not be empty");
        }
        List<Query> queries = new ArrayList<>(count);
        for (int q = 0; q < count; q++) {
            int a = rng.nextInt(genes.size());
            int b = rng.nextInt(genes.size());
            StringBuilder strand = new StringBuilder(strandLength + 16);
            while (strand.length() < strandLength) {
                if (rng.nextBoolean()) {
                    strand.append(genes.get(rng.nextInt(genes.size())));
                } else {
                    strand.append(alphabet[rng.nextInt(alphabet.length)]);
                }
            }
            strand.setLength(strandLength);
            queries.add(new Query(Math.min(a, b), Math.max(a, b), strand.toString()));
        }
        return queries;
    }

    private static void checkAlphabet(char[] alphabet) {
        if (alphabet == null || alphabet.length == 0) {
            throw new IllegalArgumentException("alphabet must not be empty");
        }
    }
}
