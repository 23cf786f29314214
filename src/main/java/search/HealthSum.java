package search;

/**
 * Running sum of signed 64-bit weights, wide enough that intermediate totals may leave the
 * {@code long} range. Only the final {@link #value()} has to fit.
 *
 * <p>The low word wraps in two's complement and {@code high} counts the wraps, so the exact total
 * is {@code high * 2^64 + low}.
 */
public final class HealthSum {

    private long low;
    private long high;

    public void reset() {
        low = 0L;
        high = 0L;
    }

    public void add(long weight) {
        long sum = low + weight;
        if (weight > 0 && sum < low) {
            high++;
        } else if (weight < 0 && sum > low) {
            high--;
        }
        low = sum;
    }

    /**
     * @throws ArithmeticException if the total does not fit in a {@code long}
     */
    public long value() {
        if (high != 0L) {
            throw new ArithmeticException("health overflows 64 bits");
        }
        return low;
    }
}
