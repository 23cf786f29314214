package search;

/**
 * One gene occurrence. {@code position} is the code point offset of the occurrence's last symbol.
 */
public record Match(int position, int geneIndex, long weight) {
}
