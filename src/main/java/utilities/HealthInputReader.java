package utilities;

import health.Query;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the line-oriented health input:
 *
 * <pre>
 * n
 * gene_0 ... gene_(n-1)
 * weight_0 ... weight_(n-1)
 * s
 * start end strand        (s lines)
 * </pre>
 *
 * Only the structure is checked here. Whether a range fits the gene count is left to the
 * evaluator.
 */
public class HealthInputReader {

    private final BufferedReader reader;
    private int lineNumber;

    private HealthInputReader(BufferedReader reader) {
        this.reader = reader;
    }

    public static HealthInput read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static HealthInput read(BufferedReader reader) throws IOException {
        return new HealthInputReader(reader).parse();
    }

    public static HealthInput parse(String content) {
        try {
            return read(new BufferedReader(new StringReader(content)));
        } catch (IOException e) {
            // StringReader does not fail.
            throw new IllegalStateException(e);
        }
    }

    private HealthInput parse() throws IOException {
        int geneCount = parseCount(nextLine("gene count"), "gene count");

        String[] genes = tokens(nextLine("genes"));
        if (genes.length != geneCount) {
            throw new MalformedInputException(lineNumber, "expected " + geneCount + " genes, found " + genes.length);
        }

        String[] weightTokens = tokens(nextLine("weights"));
        if (weightTokens.length != geneCount) {
            throw new MalformedInputException(lineNumber, "expected " + geneCount + " weights, found " + weightTokens.length);
        }
        long[] weights = new long[geneCount];
        for (int i = 0; i < geneCount; i++) {
            weights[i] = parseLong(weightTokens[i], "weight");
        }

        int strandCount = parseCount(nextLine("strand count"), "strand count");
        // The count is untrusted until the lines are there, so the list grows as they are read.
        List<Query> queries = new ArrayList<>();
        for (int i = 0; i < strandCount; i++) {
            String[] parts = tokens(nextLine("strand " + i));
            if (parts.length != 3) {
                throw new MalformedInputException(lineNumber, "expected 'start end strand', found " + parts.length + " tokens");
            }
            int start = parseInt(parts[0], "range start");
            int end = parseInt(parts[1], "range end");
            queries.add(new Query(start, end, parts[2]));
        }

        String rest;
        while ((rest = readLine()) != null) {
            if (!rest.isBlank()) {
                throw new MalformedInputException(lineNumber, "unexpected content after " + strandCount + " strands");
            }
        }
        return new HealthInput(Arrays.asList(genes), weights, queries);
    }

    private String nextLine(String what) throws IOException {
        String line = readLine();
        if (line == null) {
            throw new MalformedInputException(lineNumber + 1, "missing " + what);
        }
        return line;
    }

    private String readLine() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            lineNumber++;
        }
        return line;
    }

    private static String[] tokens(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }

    private int parseCount(String line, String what) {
        String[] parts = tokens(line);
        if (parts.length != 1) {
            throw new MalformedInputException(lineNumber, "expected a single " + what);
        }
        int count = parseInt(parts[0], what);
        if (count < 0) {
            throw new MalformedInputException(lineNumber, what + " must be non-negative, got " + count);
        }
        return count;
    }

    private int parseInt(String token, String what) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(lineNumber, what + " is not an integer: '" + token + "'", e);
        }
    }

    private long parseLong(String token, String what) {
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(lineNumber, what + " is not an integer: '" + token + "'", e);
        }
    }
}
