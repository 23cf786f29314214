package automaton;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import search.Gene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Linked, frozen Aho-Corasick automaton over a fixed set of genes.
 *
 * <p>Instances are immutable once constructed: nothing here writes to the transition maps or the
 * arrays after the constructor returns, so one automaton can serve any number of concurrent
 * {@link search.Matcher}s as long as each matcher keeps its own cursor.
 */
public final class Automaton {

    public static final int ROOT = StateTable.ROOT;
    public static final int NO_STATE = StateTable.NO_STATE;

    private static final int[] NO_GENES = new int[0];
    private static final long[] NO_WEIGHTS = new long[0];

    private final Int2IntOpenHashMap[] transitions;
    private final int[] failure;
    private final int[] depth;
    private final int[] outputLink;
    // Output sets as parallel arrays: outputGenes[s][i] carries weight outputWeights[s][i].
    private final int[][] outputGenes;
    private final long[][] outputWeights;
    private final List<Gene> genes;

    Automaton(StateTable table, int[] outputLink, List<Gene> genes) {
        int states = table.size();
        this.transitions = new Int2IntOpenHashMap[states];
        this.failure = new int[states];
        this.depth = new int[states];
        this.outputGenes = new int[states][];
        this.outputWeights = new long[states][];
        for (int s = 0; s < states; s++) {
            Int2IntOpenHashMap edges = table.edges(s);
            edges.trim();
            transitions[s] = edges;
            failure[s] = table.failure(s);
            depth[s] = table.depth(s);

            List<GeneOutput> outputs = table.outputs(s);
            if (outputs.isEmpty()) {
                outputGenes[s] = NO_GENES;
                outputWeights[s] = NO_WEIGHTS;
            } else {
                int[] geneIdx = new int[outputs.size()];
                long[] weights = new long[outputs.size()];
                for (int i = 0; i < outputs.size(); i++) {
                    geneIdx[i] = outputs.get(i).geneIndex();
                    weights[i] = outputs.get(i).weight();
                }
                outputGenes[s] = geneIdx;
                outputWeights[s] = weights;
            }
        }
        this.outputLink = outputLink;
        this.genes = Collections.unmodifiableList(new ArrayList<>(genes));
    }

    /**
     * Builds an automaton from gene texts and their weights; gene {@code i} gets index {@code i}.
     *
     * @throws InvalidPatternException if any gene is empty
     */
    public static Automaton build(List<String> genes, long[] weights) {
        return build(Gene.of(genes, weights));
    }

    public static Automaton build(List<Gene> genes) {
        Objects.requireNonNull(genes, "genes");
        return new AutomatonBuilder(estimateStates(genes)).insertAll(genes).build();
    }

    private static int estimateStates(List<Gene> genes) {
        long symbols = 1;
        for (Gene gene : genes) {
            symbols += gene.length();
        }
        return (int) Math.min(symbols, 1 << 20);
    }

    public int stateCount() {
        return transitions.length;
    }

    public int geneCount() {
        return genes.size();
    }

    // Genes ordered by index.
    public List<Gene> genes() {
        return genes;
    }

    /** Target of the transition on {@code symbol}, or {@link #NO_STATE}. */
    public int transition(int state, int symbol) {
        return transitions[state].get(symbol);
    }

    public int failure(int state) {
        return failure[state];
    }

    public int depth(int state) {
        return depth[state];
    }

    /**
     * Nearest state strictly below {@code state} on its failure chain with a non-empty output set,
     * or {@link #NO_STATE}.
     */
    public int outputLink(int state) {
        return outputLink[state];
    }

    public int outputCount(int state) {
        return outputGenes[state].length;
    }

    public int outputGene(int state, int i) {
        return outputGenes[state][i];
    }

    public long outputWeight(int state, int i) {
        return outputWeights[state][i];
    }

    public List<GeneOutput> outputs(int state) {
        int n = outputCount(state);
        if (n == 0) {
            return Collections.emptyList();
        }
        List<GeneOutput> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            result.add(new GeneOutput(outputGenes[state][i], outputWeights[state][i]));
        }
        return result;
    }

    /** Follows {@code symbols} from the root by transitions only; {@link #NO_STATE} if it leaves the trie. */
    public int walk(int[] symbols) {
        int state = ROOT;
        for (int symbol : symbols) {
            state = transition(state, symbol);
            if (state == NO_STATE) {
                return NO_STATE;
            }
        }
        return state;
    }

    public int transitionCount() {
        int total = 0;
        for (Int2IntOpenHashMap edges : transitions) {
            total += edges.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return "Automaton{states=" + stateCount() + ", transitions=" + transitionCount() + ", genes=" + geneCount() + "}";
    }
}
