package utilities;

/**
 * Structural problem in a health input file: wrong counts, missing lines or non-numeric tokens.
 */
public class MalformedInputException extends IllegalArgumentException {

    private final int line;

    public MalformedInputException(int line, String message) {
        super("Line " + line + ": " + message);
        this.line = line;
    }

    public MalformedInputException(int line, String message, Throwable cause) {
        super("Line " + line + ": " + message, cause);
        this.line = line;
    }

    // 1-based line number the problem was found on.
    public int getLine() {
        return line;
    }
}
