package automaton;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import search.Gene;
import utilities.HealthLogger;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static automaton.StateTable.NO_STATE;
import static automaton.StateTable.ROOT;

/**
 * Inserts genes into a {@link StateTable} and, once every gene is in, links and freezes the table
 * into an {@link Automaton}. A builder produces exactly one automaton.
 */
public final class AutomatonBuilder {

    private final StateTable table;
    private final ObjectArrayList<Gene> genes = new ObjectArrayList<>();
    private IntOpenHashSet seenIndices = new IntOpenHashSet();
    private int maxIndex = -1;
    private boolean built;

    public AutomatonBuilder() {
        this(16);
    }

    public AutomatonBuilder(int expectedStates) {
        this.table = new StateTable(expectedStates);
    }

    public AutomatonBuilder insert(Gene gene) {
        Objects.requireNonNull(gene, "gene");
        return insert(gene, gene.index());
    }

    public AutomatonBuilder insert(int[] symbols, int index, long weight) {
        Objects.requireNonNull(symbols, "symbols");
        return insert(new Gene(symbols, index, weight), index);
    }

    private AutomatonBuilder insert(Gene gene, int index) {
        ensureOpen();
        if (gene.length() == 0) {
            throw new InvalidPatternException(index, "gene must contain at least one symbol");
        }
        if (index < 0) {
            throw new InvalidPatternException(index, "gene index must be non-negative");
        }
        if (!seenIndices.add(index)) {
            throw new InvalidPatternException(index, "gene index already used");
        }

        int current = ROOT;
        for (int i = 0; i < gene.length(); i++) {
            int symbol = gene.symbolAt(i);
            int next = table.transition(current, symbol);
            if (next == NO_STATE) {
                next = table.newState(table.depth(current) + 1);
                table.addTransition(current, symbol, next);
            }
            current = next;
        }
        // Appended, never merged: identical texts keep one entry per gene.
        table.addOutput(current, new GeneOutput(index, gene.weight()));
        genes.add(gene);
        maxIndex = Math.max(maxIndex, index);
        return this;
    }

    public AutomatonBuilder insertAll(List<Gene> batch) {
        Objects.requireNonNull(batch, "genes");
        for (Gene gene : batch) {
            insert(gene);
        }
        return this;
    }

    public int geneCount() {
        return genes.size();
    }

    /**
     * Runs the failure-link pass and freezes the result. Gene indices must form the range
     * {@code [0, geneCount - 1]} by now.
     */
    public Automaton build() {
        ensureOpen();
        if (maxIndex + 1 != genes.size()) {
            throw new IllegalStateException("Gene indices must be contiguous from 0; got "
                    + genes.size() + " genes with max index " + maxIndex);
        }
        built = true;
        seenIndices = null;

        long start = System.nanoTime();
        int[] outputLink = FailureLinker.link(table);
        genes.sort(Comparator.comparingInt(Gene::index));
        Automaton automaton = new Automaton(table, outputLink, genes);
        HealthLogger.debug("Built automaton with " + automaton.stateCount() + " states for "
                + automaton.geneCount() + " genes in " + (System.nanoTime() - start) / 1_000_000.0 + " ms (linking)");
        return automaton;
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Automaton already built; a builder cannot be reused");
        }
    }
}
