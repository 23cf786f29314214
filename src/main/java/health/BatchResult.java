package health;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of a batch. {@code healths} holds one value per query in input order when the runner
 * was configured to collect them, and is empty otherwise.
 */
public record BatchResult(HealthRange range, long[] healths, long elapsedNanos) {

    public BatchResult {
        healths = healths.clone();
    }

    @Override
    public long[] healths() {
        return healths.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BatchResult other)) {
            return false;
        }
        return elapsedNanos == other.elapsedNanos
                && range.equals(other.range)
                && Arrays.equals(healths, other.healths);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(range, elapsedNanos) + Arrays.hashCode(healths);
    }

    @Override
    public String toString() {
        return "BatchResult{range=" + range + ", healths=" + healths.length + ", elapsedNanos=" + elapsedNanos + "}";
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
