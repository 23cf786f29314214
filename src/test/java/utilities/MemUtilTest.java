package utilities;

import automaton.Automaton;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemUtilTest {

    private final Automaton automaton = Automaton.build(List.of("he", "she", "his", "hers"), new long[]{1, 2, 3, 4});

    @Test
    void reportsAutomatonShape() {
        String report = new MemUtil().jolMemoryReport(false, automaton);

        assertTrue(report.contains("States            : " + automaton.stateCount()));
        assertTrue(report.contains("Genes             : 4"));
        assertFalse(report.contains("Class footprint"));
    }

    @Test
    void footprintTableOnRequest() {
        String report = new MemUtil().jolMemoryReport(true, automaton);

        assertTrue(report.contains("--- Class footprint ---"));
    }
}
