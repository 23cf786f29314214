package search;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BruteForceScannerTest {

    @Test
    void countsEveryOffset() {
        List<Gene> genes = Gene.of(List.of("a", "aa", "aaa"), new long[]{1, 2, 3});

        assertEquals(16, BruteForceScanner.health(genes, 0, 2, "aaaa"));
        assertEquals(4, BruteForceScanner.health(genes, 0, 0, "aaaa"));
    }

    @Test
    void totalFitsEvenWhenPartialSumsDoNot() {
        List<Gene> genes = Gene.of(List.of("a", "b", "c"), new long[]{Long.MAX_VALUE, 1, -1});

        assertEquals(Long.MAX_VALUE, BruteForceScanner.health(genes, 0, 2, "abc"));
        assertThrows(ArithmeticException.class, () -> BruteForceScanner.health(genes, 0, 1, "abc"));
    }

    @Test
    void onlyGenesInRangeCount() {
        List<Gene> genes = Gene.of(List.of("a", "b", "c", "aa", "bb", "cc"), new long[]{1, 2, 3, 10, 20, 30});

        assertEquals(12, BruteForceScanner.health(genes, 0, 5, "abcabc"));
        assertEquals(20, BruteForceScanner.health(genes, 1, 3, "aabbcc"));
        assertEquals(18, BruteForceScanner.health(genes, 0, 2, "aaabbbccc"));
    }

    @Test
    void accumulatesBeyondIntRange() {
        List<Gene> genes = Gene.of(List.of("a"), new long[]{10_000_000L});

        assertEquals(3_000_000_000L, BruteForceScanner.health(genes, 0, 0, "a".repeat(300)));
    }

    @Test
    void occursAtHandlesTextEnd() {
        Gene gene = new Gene("abc", 0, 1);
        int[] text = "xxab".codePoints().toArray();

        assertFalse(BruteForceScanner.occursAt(text, 2, gene));
        assertTrue(BruteForceScanner.occursAt("xabc".codePoints().toArray(), 1, gene));
    }

    @Test
    void geneRejectsMismatchedWeights() {
        assertThrows(IllegalArgumentException.class, () -> Gene.of(List.of("a"), new long[]{1, 2}));
    }
}
