package utilities;

import health.Query;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthInputReaderTest {

    private static final String SMALL = "6\n"
            + "a b c aa d b\n"
            + "1 2 3 4 5 6\n"
            + "3\n"
            + "1 5 caaab\n"
            + "0 4 xyz\n"
            + "2 4 bcdybc\n";

    @Test
    void parsesGenesWeightsAndStrands() {
        HealthInput input = HealthInputReader.parse(SMALL);

        assertEquals(List.of("a", "b", "c", "aa", "d", "b"), input.genes());
        assertArrayEquals(new long[]{1, 2, 3, 4, 5, 6}, input.weights());
        assertEquals(List.of(new Query(1, 5, "caaab"), new Query(0, 4, "xyz"), new Query(2, 4, "bcdybc")), input.queries());
    }

    @Test
    void parsedInputIsAValue() {
        HealthInput input = HealthInputReader.parse(SMALL);
        input.weights()[0] = 99;

        assertEquals(1, input.weights()[0]);
        assertEquals(HealthInputReader.parse(SMALL), input);
        assertEquals(HealthInputReader.parse(SMALL).hashCode(), input.hashCode());
    }

    @Test
    void toleratesExtraWhitespaceAndTrailingBlankLines() {
        HealthInput input = HealthInputReader.parse("2\r\n  x   y \r\n 10\t-20\r\n1\r\n0 1   xy\r\n\r\n\n");

        assertEquals(List.of("x", "y"), input.genes());
        assertArrayEquals(new long[]{10, -20}, input.weights());
        assertEquals(1, input.queries().size());
    }

    @Test
    void readsLargeWeights() {
        HealthInput input = HealthInputReader.parse("1\na\n9000000000000\n0\n");

        assertEquals(9_000_000_000_000L, input.weights()[0]);
        assertTrue(input.queries().isEmpty());
    }

    @Test
    void geneCountMismatchIsMalformed() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> HealthInputReader.parse("3\na b\n1 2 3\n0\n"));
        assertEquals(2, e.getLine());
    }

    @Test
    void nonNumericWeightIsMalformed() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> HealthInputReader.parse("2\na b\n1 x\n0\n"));
        assertEquals(3, e.getLine());
        assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @Test
    void missingStrandLineIsMalformed() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> HealthInputReader.parse("1\na\n1\n2\n0 0 a\n"));
        assertEquals(6, e.getLine());
    }

    @Test
    void strandCountLargerThanTheFileIsMalformed() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> HealthInputReader.parse("1\na\n1\n2147483647\n0 0 a\n"));
        assertEquals(6, e.getLine());
    }

    @Test
    void strandLineNeedsThreeTokens() {
        assertThrows(MalformedInputException.class, () -> HealthInputReader.parse("1\na\n1\n1\n0 a\n"));
        assertThrows(MalformedInputException.class, () -> HealthInputReader.parse("1\na\n1\n1\nzero 0 a\n"));
    }

    @Test
    void negativeOrMissingCountsAreMalformed() {
        assertThrows(MalformedInputException.class, () -> HealthInputReader.parse(""));
        assertThrows(MalformedInputException.class, () -> HealthInputReader.parse("-1\n\n\n0\n"));
        assertThrows(MalformedInputException.class, () -> HealthInputReader.parse("1 2\na\n1\n0\n"));
    }

    @Test
    void contentAfterLastStrandIsMalformed() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> HealthInputReader.parse("1\na\n1\n1\n0 0 a\n0 0 a\n"));
        assertEquals(6, e.getLine());
    }

    @Test
    void readsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("input.txt");
        Files.writeString(file, SMALL, StandardCharsets.UTF_8);

        HealthInput input = HealthInputReader.read(file);

        assertEquals(6, input.genes().size());
        assertEquals(3, input.queries().size());
    }
}
