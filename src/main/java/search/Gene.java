package search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A weighted pattern. Symbols are the code points of the gene text, so genes are not limited to
 * a fixed alphabet. Two genes may spell the same text; they stay distinct through their index.
 */
public final class Gene {

    private final int[] symbols;
    private final String text;
    private final int index;
    private final long weight;

    public Gene(String text, int index, long weight) {
        this.text = Objects.requireNonNull(text, "text");
        this.symbols = text.codePoints().toArray();
        this.index = index;
        this.weight = weight;
    }

    public Gene(int[] symbols, int index, long weight) {
        Objects.requireNonNull(symbols, "symbols");
        this.symbols = symbols.clone();
        this.text = new String(this.symbols, 0, this.symbols.length);
        this.index = index;
        this.weight = weight;
    }

    // Pairs gene texts with weights, assigning indices in list order.
    public static List<Gene> of(List<String> genes, long[] weights) {
        Objects.requireNonNull(genes, "genes");
        Objects.requireNonNull(weights, "weights");
        if (genes.size() != weights.length) {
            throw new IllegalArgumentException("Got " + genes.size() + " genes but " + weights.length + " weights");
        }
        List<Gene> result = new ArrayList<>(genes.size());
        for (int i = 0; i < genes.size(); i++) {
            result.add(new Gene(genes.get(i), i, weights[i]));
        }
        return result;
    }

    public int symbolAt(int position) {
        return symbols[position];
    }

    public int length() {
        return symbols.length;
    }

    public String text() {
        return text;
    }

    public int index() {
        return index;
    }

    public long weight() {
        return weight;
    }

    @Override
    public String toString() {
        return "Gene{#" + index + " '" + text + "' w=" + weight + "}";
    }
}
