package health;

/**
 * Running (min, max) over per-query healths. {@link #empty()} is the identity of {@link #merge},
 * and merge is commutative and associative, so partial results from any split of a batch combine
 * to the same pair.
 */
public record HealthRange(long min, long max, long count) {

    private static final HealthRange EMPTY = new HealthRange(Long.MAX_VALUE, Long.MIN_VALUE, 0);

    public static HealthRange empty() {
        return EMPTY;
    }

    public static HealthRange of(long health) {
        return new HealthRange(health, health, 1);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public HealthRange accept(long health) {
        return new HealthRange(Math.min(min, health), Math.max(max, health), count + 1);
    }

    public HealthRange merge(HealthRange other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new HealthRange(Math.min(min, other.min), Math.max(max, other.max), count + other.count);
    }

    // "min max"; min and max are undefined without at least one query.
    public String format() {
        if (isEmpty()) {
            throw new IllegalStateException("No strands were evaluated; min and max are undefined");
        }
        return min + " " + max;
    }
}
