import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BenchmarkTest {

    @Test
    void trailingOptionWithoutValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Benchmark.main(new String[]{"--genes", "10", "--seed"}));
        assertThrows(IllegalArgumentException.class, () -> Benchmark.main(new String[]{"--colour", "red"}));
    }

    @Test
    void smallWorkloadAgrees() {
        assertDoesNotThrow(() -> Benchmark.main(new String[]{
                "--seed", "7", "--genes", "50", "--strands", "20", "--length", "200", "--threads", "2"}));
    }
}
