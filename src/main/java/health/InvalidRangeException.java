package health;

/**
 * Thrown when a query's gene range is inverted or reaches outside {@code [0, geneCount - 1]}.
 * Ranges are never clamped.
 */
public class InvalidRangeException extends IllegalArgumentException {

    private final int start;
    private final int end;
    private final int geneCount;

    public InvalidRangeException(int start, int end, int geneCount) {
        super("Invalid gene range [" + start + ", " + end + "] for " + geneCount + " genes");
        this.start = start;
        this.end = end;
        this.geneCount = geneCount;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getGeneCount() {
        return geneCount;
    }
}
