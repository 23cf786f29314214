package search;

import java.util.List;
import java.util.Objects;

/**
 * Naive reference: tries every gene of the range at every text offset. Quadratic, used only to
 * cross-check the automaton.
 */
public final class BruteForceScanner {

    private BruteForceScanner() {
    }

    public static long health(List<Gene> genes, int start, int end, CharSequence text) {
        Objects.requireNonNull(genes, "genes");
        Objects.requireNonNull(text, "text");
        int[] symbols = text.codePoints().toArray();
        HealthSum total = new HealthSum();
        for (int offset = 0; offset < symbols.length; offset++) {
            for (int g = start; g <= end; g++) {
                Gene gene = genes.get(g);
                if (occursAt(symbols, offset, gene)) {
                    total.add(gene.weight());
                }
            }
        }
        return total.value();
    }

    static boolean occursAt(int[] text, int offset, Gene gene) {
        int len = gene.length();
        if (len == 0 || offset + len > text.length) {
            return false;
        }
        for (int i = 0; i < len; i++) {
            if (text[offset + i] != gene.symbolAt(i)) {
                return false;
            }
        }
        return true;
    }
}
