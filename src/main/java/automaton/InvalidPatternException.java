package automaton;

/**
 * Thrown when a gene cannot be inserted into the automaton, e.g. because it has no symbols.
 */
public class InvalidPatternException extends IllegalArgumentException {

    private final int geneIndex;

    public InvalidPatternException(int geneIndex, String message) {
        super("Invalid gene #" + geneIndex + ": " + message);
        this.geneIndex = geneIndex;
    }

    public int getGeneIndex() {
        return geneIndex;
    }
}
