package search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HealthSumTest {

    @Test
    void wrapsAreUndoneByLaterWeights() {
        HealthSum sum = new HealthSum();
        sum.add(Long.MAX_VALUE);
        sum.add(Long.MAX_VALUE);
        assertThrows(ArithmeticException.class, sum::value);

        sum.add(-Long.MAX_VALUE);
        assertEquals(Long.MAX_VALUE, sum.value());
    }

    @Test
    void negativeWrap() {
        HealthSum sum = new HealthSum();
        sum.add(Long.MIN_VALUE);
        sum.add(-5);
        assertThrows(ArithmeticException.class, sum::value);

        sum.add(5);
        assertEquals(Long.MIN_VALUE, sum.value());
    }

    @Test
    void resetClearsBothWords() {
        HealthSum sum = new HealthSum();
        sum.add(Long.MAX_VALUE);
        sum.add(1);
        sum.reset();
        sum.add(-3);

        assertEquals(-3, sum.value());
    }
}
